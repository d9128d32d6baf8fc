package com.acrescrypto.assetfs.fs;

import java.io.IOException;
import java.io.InputStream;

/** InputStream view of a File, starting at the file's current position. Closing the stream closes the file. */
public class FileInputStream extends InputStream {
	protected File file;
	private byte[] buf = new byte[1];
	protected long markOffset;

	public FileInputStream(File file) {
		this.file = file;
		mark(0);
	}

	@Override
	public int read() throws IOException {
		if(file.read(buf, 0, 1) <= 0) return -1;
		return buf[0] & 0xff;
	}

	@Override
	public int read(byte[] b, int off, int len) throws IOException {
		if(len == 0) return 0;
		return file.read(b, off, len);
	}

	@Override
	public long skip(long n) throws IOException {
		if(n <= 0) return 0;
		long start = file.pos();
		long target = Math.min(start + n, file.getSize());
		return file.seek(target, File.SEEK_SET) - start;
	}

	@Override
	public int available() throws IOException {
		return file.available();
	}

	@Override
	public void mark(int readlimit) {
		try {
			markOffset = file.pos();
		} catch (IOException e) {
			markOffset = 0;
		}
	}

	@Override
	public void reset() throws IOException {
		file.seek(markOffset, File.SEEK_SET);
	}

	@Override
	public boolean markSupported() {
		return true;
	}

	@Override
	public void close() throws IOException {
		file.close();
	}
}
