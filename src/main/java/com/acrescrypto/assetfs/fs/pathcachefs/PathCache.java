package com.acrescrypto.assetfs.fs.pathcachefs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.fs.DirEntry;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.FSPath;

/** Memo of real path casings learned from directory listings.
 *
 * Keys are lowercased parent paths joined to lowercased stems ("data/map001"); each key maps lowercased
 * extensions to cactus nodes holding the real names, so "data/map001" with extension "rxdata" resolves to
 * "Data/Map001.rxdata". A key with no extension variant matching the request can still resolve through its
 * first variant in extension order, which is how extensionless requests find their files.
 *
 * Not thread-safe; PathCacheFS serializes access. */
class PathCache {
	private Logger logger = LoggerFactory.getLogger(PathCache.class);

	protected final TreeMap<String,TreeMap<String,Integer>> trie = new TreeMap<>();
	protected final CactusStack cactus = new CactusStack();

	static String lower(String s) {
		return s.toLowerCase(Locale.ROOT);
	}

	static String key(String lowerParent, String lowerStem) {
		return lowerParent.isEmpty() ? lowerStem : lowerParent + "/" + lowerStem;
	}

	/** Real path for a request, or null if the cache cannot answer it. Never touches the backend. */
	String desensitize(String path) {
		FSPath lowered = FSPath.with(path).lowercase();
		if(lowered.isRoot()) return "";

		String parent = lowered.dirname().toPosix();
		TreeMap<String,Integer> variants = trie.get(key(parent, lowered.stem()));
		if(variants != null) {
			Integer index = variants.get(lowered.extension());
			if(index != null) return cactus.path(index);
		}

		// treat the whole name as a stem and accept whatever extension is cached for it
		variants = trie.get(key(parent, lowered.basename()));
		if(variants != null && !variants.isEmpty()) {
			return cactus.path(variants.firstEntry().getValue());
		}

		return null;
	}

	/** Learn enough about the backend to answer desensitize(path), if the path exists. Components already known
	 * are not listed again. */
	void regen(FS fs, String path) throws IOException {
		if(desensitize(path) != null) return;

		FSPath requested = FSPath.with(path);
		FSPath lowered = requested.lowercase();
		List<String> components = lowered.components();

		if(cloneExtensionSibling(fs, requested, lowered)) return;

		int resolved = 0, index = CactusStack.NONE;
		for(String comp : components) {
			String parent = lowered.prefix(resolved).toPosix();
			TreeMap<String,Integer> variants = trie.get(key(parent, FSPath.stemOf(comp)));
			Integer next = variants == null ? null : variants.get(FSPath.extensionOf(comp));
			if(next == null) break;

			index = next;
			resolved++;
		}

		logger.debug("PathCache: regen {}: {} of {} components cached", path, resolved, components.size());

		for(int i = resolved; i < components.size(); i++) {
			String lowerPrefix = lowered.prefix(i).toPosix();
			String realPrefix = index == CactusStack.NONE ? "" : cactus.path(index);
			String wanted = components.get(i);
			boolean last = i == components.size() - 1;
			int match = CactusStack.NONE;

			Collection<DirEntry> listing;
			try {
				listing = fs.readdir(realPrefix);
			} catch(EISNOTDIRException exc) {
				return; // cached prefix names a file, so the request cannot exist
			}

			for(DirEntry entry : listing) {
				int entryIndex = insert(lowerPrefix, index, entry.getName());
				if(!last && entry.isDirectory() && lower(entry.getName()).equals(wanted)) {
					match = entryIndex;
				}
			}

			if(last) return;
			if(match == CactusStack.NONE) return; // nothing further down can exist
			index = match;
		}
	}

	/** A request for "data/map.json" when "data/map.rxdata" is cached: check for the sibling directly instead of
	 * listing the directory again. */
	protected boolean cloneExtensionSibling(FS fs, FSPath requested, FSPath lowered) throws IOException {
		if(lowered.isRoot()) return false;

		TreeMap<String,Integer> variants = trie.get(key(lowered.dirname().toPosix(), lowered.stem()));
		if(variants == null || variants.isEmpty()) return false;
		if(variants.containsKey(lowered.extension())) return false;

		int siblingIndex = variants.firstEntry().getValue();
		String candidate = FSPath.with(cactus.path(siblingIndex)).withExtension(requested.extension()).toPosix();
		if(!fs.exists(candidate)) return false;

		CactusStack.CactusNode sibling = cactus.get(siblingIndex);
		String name = FSPath.with(candidate).basename();
		variants.put(lowered.extension(), cactus.insert(new CactusStack.CactusNode(name, sibling.getNext(), sibling.getLen())));
		logger.debug("PathCache: {} found next to cached sibling {}", candidate, cactus.path(siblingIndex));
		return true;
	}

	/** Record a directory entry beneath a parent. An entry already cached under the same key and extension keeps
	 * its node. */
	protected int insert(String lowerParent, int parentIndex, String name) {
		String lowerName = lower(name);
		TreeMap<String,Integer> variants = trie.computeIfAbsent(key(lowerParent, FSPath.stemOf(lowerName)), (k)->new TreeMap<>());
		String extension = FSPath.extensionOf(lowerName);
		Integer existing = variants.get(extension);
		if(existing != null) return existing;

		int index = cactus.push(name, parentIndex);
		variants.put(extension, index);
		return index;
	}

	/** Real path for the longest cached prefix of the request, followed by the remaining requested components
	 * as given. Used to name things that do not exist yet. */
	String resolvePrefix(String path) {
		FSPath requested = FSPath.with(path);
		FSPath lowered = requested.lowercase();
		List<String> components = lowered.components();

		int resolved = 0, index = CactusStack.NONE;
		for(String comp : components) {
			TreeMap<String,Integer> variants = trie.get(key(lowered.prefix(resolved).toPosix(), FSPath.stemOf(comp)));
			Integer next = variants == null ? null : variants.get(FSPath.extensionOf(comp));
			if(next == null) break;

			index = next;
			resolved++;
		}

		FSPath real = FSPath.with(index == CactusStack.NONE ? "" : cactus.path(index));
		for(String literal : requested.components().subList(resolved, components.size())) {
			real = real.join(literal);
		}

		return real.toPosix();
	}

	/** Forget a real path and everything cached beneath it. */
	void purge(String realPath) {
		FSPath lowered = FSPath.with(realPath).lowercase();
		if(lowered.isRoot()) {
			clear();
			return;
		}

		String key = key(lowered.dirname().toPosix(), lowered.stem());
		TreeMap<String,Integer> variants = trie.get(key);
		if(variants != null) {
			Integer index = variants.remove(lowered.extension());
			if(index != null) cactus.remove(index);
			if(variants.isEmpty()) trie.remove(key);
		}

		String prefix = lowered.toPosix() + "/";
		// '0' sorts immediately after '/'
		SortedMap<String,TreeMap<String,Integer>> beneath = trie.subMap(prefix, lowered.toPosix() + "0");
		int purged = 0;
		for(Iterator<Map.Entry<String,TreeMap<String,Integer>>> it = beneath.entrySet().iterator(); it.hasNext();) {
			for(int index : it.next().getValue().values()) {
				cactus.remove(index);
				purged++;
			}

			it.remove();
		}

		logger.debug("PathCache: purged {} and {} cached paths beneath it", realPath, purged);
	}

	void clear() {
		trie.clear();
		cactus.clear();
	}

	int size() {
		return cactus.size();
	}

	/** Every cached path in key order, for debugging. */
	List<String> cachedPaths() {
		ArrayList<String> paths = new ArrayList<>();
		for(TreeMap<String,Integer> variants : trie.values()) {
			for(int index : variants.values()) {
				paths.add(cactus.path(index));
			}
		}

		return paths;
	}
}
