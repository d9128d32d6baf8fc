package com.acrescrypto.assetfs.fs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedList;

/** Snapshot of a directory listing taken when the directory was opened. Recursive operations go back to the
 * owning FS for subdirectories. */
public class Directory implements AutoCloseable {
	public interface DirectoryWalkCallback {
		void foundPath(String path, Stat stat) throws IOException;
	}

	public final static int LIST_OPT_OMIT_DIRECTORIES = 1 << 0;
	public final static int LIST_OPT_OMIT_FILES = 1 << 1;

	protected FS fs;
	protected String path;
	protected Collection<DirEntry> entries;

	public Directory(FS fs, String path, Collection<DirEntry> entries) {
		this.fs = fs;
		this.path = FSPath.standardize(path);
		this.entries = Collections.unmodifiableCollection(new ArrayList<>(entries));
	}

	public Collection<DirEntry> entries() {
		return entries;
	}

	public Collection<String> list() {
		return list(0);
	}

	public Collection<String> list(int opts) {
		LinkedList<String> names = new LinkedList<>();
		for(DirEntry entry : entries) {
			if(omitted(entry.getStat(), opts)) continue;
			names.add(entry.getName());
		}

		return names;
	}

	public boolean contains(String name) {
		for(DirEntry entry : entries) {
			if(entry.getName().equals(name)) return true;
		}

		return false;
	}

	/** Invoke the callback for every path beneath this directory, parents before their children. Paths given to
	 * the callback are relative to this directory. */
	public void walk(DirectoryWalkCallback cb) throws IOException {
		walk("", entries, cb);
	}

	public Collection<String> listRecursive() throws IOException {
		return listRecursive(0);
	}

	public Collection<String> listRecursive(int opts) throws IOException {
		LinkedList<String> paths = new LinkedList<>();
		walk((subpath, stat)->{
			if(omitted(stat, opts)) return;
			paths.add(subpath);
		});

		return paths;
	}

	public String getPath() {
		return path;
	}

	public FS getFS() {
		return fs;
	}

	@Override
	public void close() throws IOException {
	}

	protected void walk(String prefix, Collection<DirEntry> dirEntries, DirectoryWalkCallback cb) throws IOException {
		for(DirEntry entry : dirEntries) {
			String subpath = prefix.isEmpty() ? entry.getName() : prefix + "/" + entry.getName();
			cb.foundPath(subpath, entry.getStat());
			if(entry.isDirectory()) {
				walk(subpath, fs.readdir(FSPath.join(path, subpath).toPosix()), cb);
			}
		}
	}

	protected boolean omitted(Stat stat, int opts) {
		if((opts & LIST_OPT_OMIT_DIRECTORIES) != 0 && stat.isDirectory()) return true;
		if((opts & LIST_OPT_OMIT_FILES) != 0 && !stat.isDirectory()) return true;
		return false;
	}
}
