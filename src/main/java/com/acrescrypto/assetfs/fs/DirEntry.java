package com.acrescrypto.assetfs.fs;

/** One entry of a directory listing: the entry's own name (not a path) and its metadata. */
public class DirEntry {
	protected final String name;
	protected final Stat stat;

	public DirEntry(String name, Stat stat) {
		this.name = name;
		this.stat = stat;
	}

	public String getName() {
		return name;
	}

	public Stat getStat() {
		return stat;
	}

	public boolean isDirectory() {
		return stat.isDirectory();
	}

	public boolean isRegularFile() {
		return stat.isRegularFile();
	}

	@Override
	public boolean equals(Object other) {
		if(!(other instanceof DirEntry)) return false;
		DirEntry o = (DirEntry) other;
		return name.equals(o.name) && stat.equals(o.stat);
	}

	@Override
	public int hashCode() {
		return name.hashCode() ^ stat.hashCode();
	}

	@Override
	public String toString() {
		return name + " (" + stat + ")";
	}
}
