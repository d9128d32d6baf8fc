package com.acrescrypto.assetfs.fs.archivefs;

import java.io.EOFException;
import java.io.IOException;

import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.utility.Util;

/** Buffered sequential reader over an archive stream, used while scanning headers. Keeps track of its own
 * position so that callers can record offsets without asking the underlying file. */
class HeaderReader {
	protected final File file;
	protected final byte[] buf;
	protected int bufPos, bufLen;
	protected long bufStart;

	HeaderReader(File file, int bufferSize) throws IOException {
		this.file = file;
		this.buf = new byte[bufferSize];
		file.seek(0, File.SEEK_SET);
	}

	long position() {
		return bufStart + bufPos;
	}

	long length() throws IOException {
		return file.getSize();
	}

	void seek(long position) throws IOException {
		if(position >= bufStart && position <= bufStart + bufLen) {
			bufPos = (int) (position - bufStart);
			return;
		}

		file.seek(position, File.SEEK_SET);
		bufStart = position;
		bufPos = bufLen = 0;
	}

	void readFully(byte[] dest) throws IOException {
		int filled = 0;
		while(filled < dest.length) {
			if(bufPos == bufLen && !refill()) {
				throw new EOFException("stream ended after " + filled + " of " + dest.length + " bytes");
			}

			int n = Math.min(dest.length - filled, bufLen - bufPos);
			System.arraycopy(buf, bufPos, dest, filled, n);
			bufPos += n;
			filled += n;
		}
	}

	int readInt() throws IOException {
		byte[] b = new byte[4];
		readFully(b);
		return Util.deserializeIntLE(b, 0);
	}

	protected boolean refill() throws IOException {
		bufStart += bufLen;
		bufPos = bufLen = 0;
		file.seek(bufStart, File.SEEK_SET);
		int n = file.read(buf, 0, buf.length);
		if(n <= 0) return false;
		bufLen = n;
		return true;
	}
}
