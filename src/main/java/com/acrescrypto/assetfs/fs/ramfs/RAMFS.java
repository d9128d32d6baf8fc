package com.acrescrypto.assetfs.fs.ramfs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.EACCESException;
import com.acrescrypto.assetfs.exceptions.EEXISTSException;
import com.acrescrypto.assetfs.exceptions.EISDIRException;
import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.fs.DirEntry;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.FSPath;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;

/** Volatile in-memory backend. Paths are case-sensitive. */
public class RAMFS extends FS {
	interface InodeMaker { void make(Inode inode); }

	/** Keyed by standardized path; the root is "". Ordered so a directory's descendants form a contiguous range. */
	TreeMap<String,Inode> inodesByPath = new TreeMap<String,Inode>();
	protected String name;

	private Logger logger = LoggerFactory.getLogger(RAMFS.class);

	protected class Inode {
		Stat stat = new Stat();
		byte[] data = new byte[0];
		int size;

		synchronized int read(long pos, byte[] buf, int offset, int maxLength) {
			if(pos >= size) return -1;
			int readLen = (int) Math.min(maxLength, size - pos);
			System.arraycopy(data, (int) pos, buf, offset, readLen);
			return readLen;
		}

		synchronized void write(long pos, byte[] buf, int offset, int length) {
			long end = pos + length;
			if(end > Integer.MAX_VALUE) throw new IndexOutOfBoundsException();
			if(end > size) setSize((int) end);
			System.arraycopy(buf, offset, data, (int) pos, length);
		}

		synchronized void setSize(int newSize) {
			if(newSize > data.length) {
				long doubled = Math.min(Integer.MAX_VALUE - 8, 2L*data.length);
				int capacity = (int) Math.max(newSize, doubled);
				byte[] grown = new byte[capacity];
				System.arraycopy(data, 0, grown, 0, size);
				data = grown;
			} else if(newSize < size) {
				for(int i = newSize; i < size; i++) data[i] = 0;
			}

			size = newSize;
			stat.setSize(size);
		}

		synchronized int getSize() {
			return size;
		}
	}

	public RAMFS() {
		this("ramfs");
	}

	public RAMFS(String name) {
		this.name = name;
		makeInode("", (inode)->inode.stat.makeDirectory());
	}

	public String getName() {
		return name;
	}

	@Override
	public Stat stat(String path) throws IOException {
		synchronized(inodesByPath) {
			Inode inode = lookup(path);
			if(inode.stat.isDirectory()) {
				return Stat.directory(childNames(FSPath.standardize(path)).size());
			}

			return inode.stat.clone();
		}
	}

	@Override
	public Collection<DirEntry> readdir(String path) throws IOException {
		synchronized(inodesByPath) {
			String standardized = FSPath.standardize(path);
			if(!lookup(standardized).stat.isDirectory()) throw new EISNOTDIRException(path);

			ArrayList<DirEntry> entries = new ArrayList<>();
			for(String child : childNames(standardized)) {
				entries.add(new DirEntry(child, stat(join(standardized, child))));
			}

			return entries;
		}
	}

	@Override
	public void mkdir(String path) throws IOException {
		logger.debug("RAMFS {}: mkdir {}", name, path);
		synchronized(inodesByPath) {
			if(exists(path)) throw new EEXISTSException(path);
			assertParentDirectory(path);
			makeInode(path, (inode)->inode.stat.makeDirectory());
		}
	}

	@Override
	public void rmdir(String path) throws IOException {
		logger.debug("RAMFS {}: rmdir {}", name, path);
		synchronized(inodesByPath) {
			String standardized = FSPath.standardize(path);
			if(!lookup(standardized).stat.isDirectory()) throw new EISNOTDIRException(path);
			if(standardized.isEmpty()) throw new EACCESException(path);

			descendants(standardized).clear();
			inodesByPath.remove(standardized);
		}
	}

	@Override
	public void unlink(String path) throws IOException {
		logger.debug("RAMFS {}: unlink {}", name, path);
		synchronized(inodesByPath) {
			String standardized = FSPath.standardize(path);
			if(lookup(standardized).stat.isDirectory()) throw new EISDIRException(path);
			inodesByPath.remove(standardized);
		}
	}

	@Override
	public void mv(String oldPath, String newPath) throws IOException {
		logger.debug("RAMFS {}: mv {} {}", name, oldPath, newPath);
		synchronized(inodesByPath) {
			String source = FSPath.standardize(oldPath), target = FSPath.standardize(newPath);
			Inode inode = lookup(source);
			if(source.equals(target)) return;
			if(FSPath.with(target).descendsFrom(source)) throw new EACCESException(newPath);

			Inode existing = inodesByPath.get(target);
			if(existing != null) {
				if(existing.stat.isDirectory() && !inode.stat.isDirectory()) throw new EISDIRException(newPath);
				if(!existing.stat.isDirectory() && inode.stat.isDirectory()) throw new EISNOTDIRException(newPath);
				if(existing.stat.isDirectory() && !descendants(target).isEmpty()) throw new EEXISTSException(newPath);
			} else {
				assertParentDirectory(target);
			}

			TreeMap<String,Inode> moved = new TreeMap<>(descendants(source));
			descendants(source).clear();
			inodesByPath.remove(source);
			inodesByPath.put(target, inode);
			for(Map.Entry<String,Inode> entry : moved.entrySet()) {
				String relocated = target + entry.getKey().substring(source.length());
				inodesByPath.put(relocated, entry.getValue());
			}
		}
	}

	@Override
	public RAMFile open(String path, int mode) throws IOException {
		return new RAMFile(this, FSPath.standardize(path), mode);
	}

	@Override
	public String toString() {
		return this.getClass().getSimpleName() + " " + name;
	}

	protected Inode lookup(String path) throws ENOENTException {
		Inode inode = inodesByPath.get(FSPath.standardize(path));
		if(inode == null) throw new ENOENTException(path);
		return inode;
	}

	protected Inode makeInode(String path, InodeMaker maker) {
		synchronized(inodesByPath) {
			Inode inode = new Inode();
			maker.make(inode);
			inodesByPath.put(FSPath.standardize(path), inode);
			return inode;
		}
	}

	protected void assertParentDirectory(String path) throws IOException {
		String parent = dirname(path);
		if(!lookup(parent).stat.isDirectory()) throw new EISNOTDIRException(parent);
	}

	protected SortedMap<String,Inode> descendants(String path) {
		if(path.isEmpty()) return inodesByPath.tailMap("", false);
		// '0' sorts immediately after '/'
		return inodesByPath.subMap(path + "/", path + "0");
	}

	protected Collection<String> childNames(String path) {
		String prefix = path.isEmpty() ? "" : path + "/";
		ArrayList<String> names = new ArrayList<>();
		for(String key : descendants(path).keySet()) {
			String rest = key.substring(prefix.length());
			if(rest.indexOf('/') == -1) names.add(rest);
		}

		return names;
	}
}
