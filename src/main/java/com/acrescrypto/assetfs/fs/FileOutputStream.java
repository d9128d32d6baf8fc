package com.acrescrypto.assetfs.fs;

import java.io.IOException;
import java.io.OutputStream;

/** OutputStream writing at the current position of a File. Closing the stream closes the file. */
public class FileOutputStream extends OutputStream {
	protected File file;
	private byte[] buf = new byte[1];

	public FileOutputStream(File file) {
		this.file = file;
	}

	@Override
	public void write(int b) throws IOException {
		buf[0] = (byte) b;
		file.write(buf, 0, 1);
	}

	@Override
	public void write(byte[] b, int off, int len) throws IOException {
		file.write(b, off, len);
	}

	@Override
	public void flush() throws IOException {
		file.flush();
	}

	@Override
	public void close() throws IOException {
		file.close();
	}
}
