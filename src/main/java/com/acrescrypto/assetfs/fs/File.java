package com.acrescrypto.assetfs.fs;

import java.io.Closeable;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.EACCESException;

public abstract class File implements Closeable {
	public final static int O_RDONLY = 1 << 0;
	public final static int O_WRONLY = 1 << 1;
	public final static int O_RDWR = O_RDONLY | O_WRONLY; // no this is not how POSIX works, but it is nicer
	public final static int O_CREAT = 1 << 2;
	public final static int O_APPEND = 1 << 4;
	public final static int O_TRUNC = 1 << 5;

	public final static int SEEK_SET = 0;
	public final static int SEEK_CUR = 1;
	public final static int SEEK_END = 2;

	public abstract String getPath();
	public abstract Stat getStat() throws IOException;

	public long getSize() throws IOException {
		return getStat().getSize();
	}

	protected FS fs;
	protected int mode;

	protected File(FS fs) {
		this.fs = fs;
		fs.reportOpenFile(this);
	}

	protected Logger logger = LoggerFactory.getLogger(File.class);

	public abstract void truncate(long size) throws IOException;

	/** Read up to maxLength bytes at the current position. Returns -1 if the position is at or past the end of
	 * the file and maxLength is non-zero. */
	public abstract int read(byte[] buf, int offset, int maxLength) throws IOException;

	public final byte[] read(int maxLength) throws IOException {
		long remaining = Math.max(0, getSize() - pos());
		maxLength = (int) Math.min(maxLength, remaining);
		byte[] buf = new byte[maxLength];
		int total = 0;
		while(total < maxLength) {
			int readBytes = read(buf, total, maxLength - total);
			if(readBytes <= 0) break;
			total += readBytes;
		}

		if(total < buf.length) {
			byte[] newBuf = new byte[total];
			System.arraycopy(buf, 0, newBuf, 0, total);
			buf = newBuf;
		}

		logger.trace("FS -: read {} maxLen={} actualLen={} newOffset={}",
				this.getPath(),
				maxLength,
				buf.length,
				this.pos());
		return buf;
	}

	public byte[] read() throws IOException {
		long sizeNeeded = getSize() - pos();
		if(sizeNeeded > Integer.MAX_VALUE) throw new IndexOutOfBoundsException();
		return read((int) Math.max(0, sizeNeeded));
	}

	public long pos() throws IOException {
		return seek(0, SEEK_CUR);
	}

	public void write(byte[] data) throws IOException {
		write(data, 0, data.length);
	}

	public abstract void write(byte[] data, int offset, int length) throws IOException;
	public abstract long seek(long pos, int mode) throws IOException;
	public abstract void flush() throws IOException;
	public abstract void close() throws IOException;

	public void rewind() throws IOException {
		seek(0, SEEK_SET);
	}

	public boolean hasData() throws IOException {
		return pos() < getSize();
	}

	public int available() throws IOException {
		return (int) Math.min(Integer.MAX_VALUE, Math.max(0, getSize() - pos()));
	}

	public int getMode() {
		return mode;
	}

	public FS getFs() { return fs; }

	protected void assertWritable() throws EACCESException {
		if ((mode & File.O_WRONLY) == 0)
			throw new EACCESException(getPath());
	}

	protected void assertReadable() throws EACCESException {
		if ((mode & File.O_RDONLY) == 0)
			throw new EACCESException(getPath());
	}
}
