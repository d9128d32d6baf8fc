package com.acrescrypto.assetfs.fs.archivefs;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;

/** One file inside an archive. Reads and writes are translated through the body keystream on the fly; writes
 * replace bytes in place and can never change the file's length. */
public class ArchiveFile extends File {
	protected ArchiveFS fs;
	protected String path;
	protected ArchiveEntry entry;
	protected ArchiveKeystream.BodyCipher cipher;
	protected long offset;
	protected boolean closed;

	protected Logger logger = LoggerFactory.getLogger(ArchiveFile.class);

	ArchiveFile(ArchiveFS fs, String path, ArchiveEntry entry, int mode) {
		super(fs);
		this.fs = fs;
		this.path = path;
		this.entry = entry;
		this.mode = mode;
		this.cipher = new ArchiveKeystream.BodyCipher(entry.getStartMagic());

		logger.trace("ArchiveFS {}: open {} (0x{}), {} bytes at {}",
				fs.getArchiveFile().getPath(),
				path,
				Integer.toHexString(mode),
				entry.getSize(),
				entry.getBodyOffset());
	}

	@Override
	public String getPath() {
		return path;
	}

	@Override
	public Stat getStat() throws IOException {
		return Stat.regularFile(entry.getSize());
	}

	@Override
	public long getSize() {
		return entry.getSize();
	}

	public ArchiveEntry getEntry() {
		return entry;
	}

	@Override
	public void truncate(long size) throws IOException {
		throw new UnsupportedOperationException(path + ": archived files cannot change length");
	}

	@Override
	public int read(byte[] buf, int bufOffset, int maxLength) throws IOException {
		assertReadable();
		if(maxLength == 0) return 0;
		if(offset >= entry.getSize()) return -1;

		int length = (int) Math.min(maxLength, entry.getSize() - offset);
		int n = fs.readRaw(entry.getBodyOffset() + offset, buf, bufOffset, length);
		if(n <= 0) return -1;

		cipher.seek(offset);
		cipher.apply(buf, bufOffset, n);
		offset += n;
		return n;
	}

	@Override
	public void write(byte[] data, int dataOffset, int length) throws IOException {
		assertWritable();
		if(offset + length > entry.getSize()) {
			throw new UnsupportedOperationException(path + ": cannot write past the end of an archived file ("
					+ (offset + length) + " > " + entry.getSize() + ")");
		}

		byte[] encoded = new byte[length];
		System.arraycopy(data, dataOffset, encoded, 0, length);
		cipher.seek(offset);
		cipher.apply(encoded, 0, length);
		fs.writeRaw(entry.getBodyOffset() + offset, encoded, 0, length);
		offset += length;
	}

	@Override
	public long seek(long pos, int mode) throws IOException {
		long newOffset = -1;
		switch(mode) {
		case SEEK_SET:
			newOffset = pos;
			break;
		case SEEK_CUR:
			newOffset = offset + pos;
			break;
		case SEEK_END:
			newOffset = entry.getSize() + pos;
			break;
		}

		if(newOffset < 0) throw new IllegalArgumentException();
		offset = newOffset;
		return offset;
	}

	@Override
	public long pos() {
		return offset;
	}

	@Override
	public void flush() throws IOException {
		if((mode & O_WRONLY) == 0) return;
		fs.flushRaw();
	}

	@Override
	public void close() throws IOException {
		if(closed) return;
		closed = true;

		fs.reportClosedFile(this);
		logger.trace("ArchiveFS {}: close {}", fs.getArchiveFile().getPath(), path);
	}
}
