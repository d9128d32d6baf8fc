package com.acrescrypto.assetfs.fs;

public class Stat {
	private int type;
	long size;

	public final static int TYPE_REGULAR_FILE = 0;
	public final static int TYPE_DIRECTORY = 1;

	public static Stat regularFile(long size) {
		Stat stat = new Stat();
		stat.makeRegularFile();
		stat.setSize(size);
		return stat;
	}

	/** For directories, size is the number of immediate entries. */
	public static Stat directory(long numEntries) {
		Stat stat = new Stat();
		stat.makeDirectory();
		stat.setSize(numEntries);
		return stat;
	}

	public Stat() {
	}

	public boolean isRegularFile() {
		return getType() == TYPE_REGULAR_FILE;
	}

	public boolean isDirectory() {
		return getType() == TYPE_DIRECTORY;
	}

	public void makeRegularFile() {
		setType(TYPE_REGULAR_FILE);
	}

	public void makeDirectory() {
		setType(TYPE_DIRECTORY);
	}

	public int getType() {
		return type;
	}

	public void setType(int type) {
		this.type = type;
	}

	public long getSize() {
		return size;
	}

	public void setSize(long size) {
		this.size = size;
	}

	public Stat clone() {
		Stat stat = new Stat();
		stat.type = type;
		stat.size = size;
		return stat;
	}

	@Override
	public boolean equals(Object other) {
		if(!(other instanceof Stat)) return false;
		Stat o = (Stat) other;
		return type == o.type && size == o.size;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(size) ^ (type << 24);
	}

	@Override
	public String toString() {
		return String.format("%s size=%d", isDirectory() ? "directory" : "file", size);
	}
}
