package com.acrescrypto.assetfs.fs.localfs;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.EISDIRException;
import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;

/** Host file opened through a single FileChannel. The channel position is the file position. */
public class LocalFile extends File {
	protected final String path;
	protected final LocalFS localFS;
	protected FileChannel channel;
	protected boolean closed;

	private final static Logger logger = LoggerFactory.getLogger(LocalFile.class);

	LocalFile(LocalFS fs, String path, int mode) throws IOException {
		super(fs);
		this.localFS = fs;
		this.path = path;
		this.mode = mode;

		try {
			boolean writable = (mode & O_WRONLY) != 0;
			if(fs.exists(path)) {
				if(fs.stat(path).isDirectory()) throw new EISDIRException(path);
			} else if((mode & O_CREAT) == 0 || !writable) {
				throw new ENOENTException(path);
			}

			Path nativePath = fs.qualifiedPathNative(path);
			try {
				channel = FileChannel.open(nativePath, openOptions(mode));
			} catch(NoSuchFileException exc) {
				// parent directory is missing
				throw new ENOENTException(path);
			}

			if((mode & O_APPEND) != 0) channel.position(channel.size());
		} catch(Throwable exc) {
			close();
			throw exc;
		}

		logger.trace("LocalFS {}: open {} (0x{}), {} open",
				fs.getRoot(),
				path,
				Integer.toHexString(mode),
				fs.getOpenFiles().size());
	}

	protected static EnumSet<StandardOpenOption> openOptions(int mode) {
		EnumSet<StandardOpenOption> options = EnumSet.of(StandardOpenOption.READ);
		if((mode & O_WRONLY) == 0) return options;

		options.add(StandardOpenOption.WRITE);
		if((mode & O_CREAT) != 0) options.add(StandardOpenOption.CREATE);
		if((mode & O_TRUNC) != 0) options.add(StandardOpenOption.TRUNCATE_EXISTING);
		return options;
	}

	@Override
	public String getPath() {
		return path;
	}

	@Override
	public Stat getStat() throws IOException {
		return Stat.regularFile(getSize());
	}

	@Override
	public long getSize() throws IOException {
		return channel.size();
	}

	@Override
	public void truncate(long size) throws IOException {
		assertWritable();
		long current = channel.size();
		if(size < current) {
			channel.truncate(size);
		} else if(size > current) {
			// FileChannel cannot grow a file by truncation; write a trailing zero instead
			channel.write(ByteBuffer.allocate(1), size - 1);
		}
	}

	@Override
	public int read(byte[] buf, int offset, int maxLength) throws IOException {
		assertReadable();
		if(maxLength == 0) return 0;
		return channel.read(ByteBuffer.wrap(buf, offset, maxLength));
	}

	@Override
	public void write(byte[] buf, int offset, int length) throws IOException {
		assertWritable();
		logger.trace("LocalFS {}: write {}, {} bytes at {}", localFS.getRoot(), path, length, channel.position());
		ByteBuffer buffer = ByteBuffer.wrap(buf, offset, length);
		while(buffer.hasRemaining()) {
			channel.write(buffer);
		}
	}

	@Override
	public void flush() throws IOException {
		if((mode & O_WRONLY) != 0) channel.force(true);
	}

	@Override
	public long seek(long pos, int mode) throws IOException {
		long base;
		switch(mode) {
		case SEEK_SET:
			base = 0;
			break;
		case SEEK_CUR:
			base = channel.position();
			break;
		case SEEK_END:
			base = channel.size();
			break;
		default:
			throw new IllegalArgumentException("unknown seek mode " + mode);
		}

		if(base + pos < 0) throw new IllegalArgumentException(path + ": seek before start of file");
		return channel.position(base + pos).position();
	}

	@Override
	public long pos() throws IOException {
		return channel.position();
	}

	@Override
	public void close() throws IOException {
		if(closed) return;
		closed = true;

		localFS.reportClosedFile(this);
		if(channel != null) channel.close();
		logger.trace("LocalFS {}: close {}, {} open", localFS.getRoot(), path, localFS.getOpenFiles().size());
	}
}
