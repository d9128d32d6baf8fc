package com.acrescrypto.assetfs.fs.ramfs;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.EISDIRException;
import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;
import com.acrescrypto.assetfs.fs.ramfs.RAMFS.Inode;

/** Handle on a RAMFS inode. Writes go straight to the inode, so every open handle sees them immediately. */
public class RAMFile extends File {
	String path;
	Inode inode;
	RAMFS fs;
	long pos;
	boolean closed;

	protected Logger logger = LoggerFactory.getLogger(RAMFS.class);

	protected RAMFile(RAMFS fs, String path, int mode) throws IOException {
		super(fs);
		try {
			this.fs = fs;
			this.path = path;
			this.mode = mode;

			logger.trace("RAMFS {}: open {} - (0x{}), {} open",
					fs.getName(),
					path,
					Integer.toHexString(mode),
					fs.getOpenFiles().size());

			synchronized(fs.inodesByPath) {
				try {
					this.inode = fs.lookup(path);
				} catch(ENOENTException exc) {
					if((mode & O_CREAT) == 0 || (mode & O_WRONLY) == 0) throw exc;
					fs.assertParentDirectory(path);
					this.inode = fs.makeInode(path, (inode)->inode.stat.makeRegularFile());
				}
			}

			if(inode.stat.isDirectory()) throw new EISDIRException(path);

			if((mode & (O_TRUNC|O_WRONLY)) == (O_TRUNC|O_WRONLY)) {
				inode.setSize(0);
			}

			if((mode & O_APPEND) != 0) {
				pos = inode.getSize();
			}
		} catch(Throwable exc) {
			close();
			throw exc;
		}
	}

	@Override
	public String getPath() {
		return path;
	}

	@Override
	public Stat getStat() throws IOException {
		return Stat.regularFile(inode.getSize());
	}

	@Override
	public long getSize() throws IOException {
		return inode.getSize();
	}

	@Override
	public void truncate(long size) throws IOException {
		assertWritable();
		if(size > Integer.MAX_VALUE) throw new IndexOutOfBoundsException();
		inode.setSize((int) size);
	}

	@Override
	public int read(byte[] buf, int offset, int maxLength) throws IOException {
		assertReadable();
		if(maxLength == 0) return 0;
		int readLen = inode.read(pos, buf, offset, maxLength);
		if(readLen > 0) pos += readLen;
		return readLen;
	}

	@Override
	public void write(byte[] buf, int offset, int length) throws IOException {
		assertWritable();
		inode.write(pos, buf, offset, length);
		pos += length;
	}

	@Override
	public long seek(long pos, int mode) throws IOException {
		long newPos = -1;
		switch(mode) {
		case File.SEEK_CUR:
			newPos = this.pos + pos;
			break;
		case File.SEEK_SET:
			newPos = pos;
			break;
		case File.SEEK_END:
			newPos = inode.getSize() + pos;
			break;
		}

		if(newPos < 0) throw new IllegalArgumentException();
		this.pos = newPos;
		return this.pos;
	}

	@Override
	public long pos() {
		return pos;
	}

	@Override
	public void flush() throws IOException {
	}

	@Override
	public void close() throws IOException {
		if(closed) return;
		closed = true;

		fs.reportClosedFile(this);
		logger.trace("RAMFS {}: close {}, {} open",
				fs.getName(),
				path,
				fs.getOpenFiles().size());
	}
}
