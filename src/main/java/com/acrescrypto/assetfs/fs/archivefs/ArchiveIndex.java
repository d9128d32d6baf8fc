package com.acrescrypto.assetfs.fs.archivefs;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.acrescrypto.assetfs.exceptions.InvalidArchiveHeaderException;
import com.acrescrypto.assetfs.fs.DirEntry;
import com.acrescrypto.assetfs.fs.FSPath;
import com.acrescrypto.assetfs.fs.Stat;

/** Map from logical file path to archive entry. Directories are not stored: a directory exists when some file
 * lies beneath it, and the root always exists. Lookups share a read lock; insertions take the write lock. */
public class ArchiveIndex {
	protected final TreeMap<String,ArchiveEntry> entries = new TreeMap<>();
	protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	/** Adds a file. Fails if the path names the root, is already present, or clashes with a file or directory
	 * implied by an earlier entry. */
	public void put(String path, ArchiveEntry entry) throws InvalidArchiveHeaderException {
		String standardized = FSPath.standardize(path);
		lock.writeLock().lock();
		try {
			String conflict = conflict(entries.navigableKeySet(), standardized);
			if(conflict != null) throw new InvalidArchiveHeaderException("path \"" + path + "\" " + conflict);
			entries.put(standardized, entry);
		} finally {
			lock.writeLock().unlock();
		}
	}

	/** Why a standardized path cannot be added alongside existing file paths, or null if it can. */
	public static String conflict(NavigableSet<String> paths, String standardized) {
		if(standardized.isEmpty()) return "names the archive root";
		if(paths.contains(standardized)) return "appears more than once";

		String prefix = standardized + "/";
		String next = paths.ceiling(prefix);
		if(next != null && next.startsWith(prefix)) return "is also a directory containing " + next;

		for(int slash = standardized.indexOf('/'); slash != -1; slash = standardized.indexOf('/', slash+1)) {
			String ancestor = standardized.substring(0, slash);
			if(paths.contains(ancestor)) return "lies beneath the file " + ancestor;
		}

		return null;
	}

	public ArchiveEntry get(String path) {
		lock.readLock().lock();
		try {
			return entries.get(FSPath.standardize(path));
		} finally {
			lock.readLock().unlock();
		}
	}

	public boolean containsFile(String path) {
		return get(path) != null;
	}

	public boolean containsDirectory(String path) {
		String standardized = FSPath.standardize(path);
		if(standardized.isEmpty()) return true;

		lock.readLock().lock();
		try {
			String prefix = standardized + "/";
			String next = entries.ceilingKey(prefix);
			return next != null && next.startsWith(prefix);
		} finally {
			lock.readLock().unlock();
		}
	}

	/** Immediate children of a directory. Subdirectory sizes are their own immediate entry counts. */
	public Collection<DirEntry> list(String path) {
		String standardized = FSPath.standardize(path);
		String prefix = standardized.isEmpty() ? "" : standardized + "/";
		LinkedHashMap<String,Stat> children = new LinkedHashMap<>();
		TreeMap<String,TreeSet<String>> grandchildren = new TreeMap<>();

		lock.readLock().lock();
		try {
			for(Map.Entry<String,ArchiveEntry> entry : entries.tailMap(prefix, true).entrySet()) {
				if(!entry.getKey().startsWith(prefix)) break;
				String rest = entry.getKey().substring(prefix.length());
				int slash = rest.indexOf('/');
				if(slash == -1) {
					children.put(rest, Stat.regularFile(entry.getValue().getSize()));
				} else {
					String child = rest.substring(0, slash);
					String rest2 = rest.substring(slash+1);
					int slash2 = rest2.indexOf('/');
					grandchildren.computeIfAbsent(child, (k)->new TreeSet<>())
						.add(slash2 == -1 ? rest2 : rest2.substring(0, slash2));
					children.putIfAbsent(child, null);
				}
			}
		} finally {
			lock.readLock().unlock();
		}

		ArrayList<DirEntry> listing = new ArrayList<>(children.size());
		for(Map.Entry<String,Stat> child : children.entrySet()) {
			Stat stat = child.getValue();
			if(stat == null) stat = Stat.directory(grandchildren.get(child.getKey()).size());
			listing.add(new DirEntry(child.getKey(), stat));
		}

		return listing;
	}

	public int countEntries(String path) {
		return list(path).size();
	}

	/** Consistent copy of every path and entry, in path order. */
	public TreeMap<String,ArchiveEntry> snapshot() {
		lock.readLock().lock();
		try {
			return new TreeMap<>(entries);
		} finally {
			lock.readLock().unlock();
		}
	}

	public int size() {
		lock.readLock().lock();
		try {
			return entries.size();
		} finally {
			lock.readLock().unlock();
		}
	}
}
