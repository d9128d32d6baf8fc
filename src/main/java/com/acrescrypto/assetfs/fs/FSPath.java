package com.acrescrypto.assetfs.fs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/** Path relative to the root of an FS. Forward slashes and backslashes are both accepted as delimiters on input,
 * "." and ".." are collapsed (".." never climbs above the root), and the root itself is the empty path.
 * Output is always slash-delimited. */
public class FSPath {
	protected final ArrayList<String> components;

	public static FSPath with(String path) {
		return new FSPath(path);
	}

	public static FSPath join(String root, String... paths) {
		FSPath joined = new FSPath(root);
		for(String path : paths) {
			joined = joined.join(path);
		}

		return joined;
	}

	public static String standardize(String path) {
		return new FSPath(path).toPosix();
	}

	public FSPath(String path) {
		components = new ArrayList<>();
		if(path == null) return;

		for(String comp : path.split("[/\\\\]+")) {
			if(comp.isEmpty() || comp.equals(".")) continue;
			if(comp.equals("..")) {
				if(!components.isEmpty()) components.remove(components.size() - 1);
				continue;
			}

			components.add(comp);
		}
	}

	protected FSPath(List<String> components) {
		this.components = new ArrayList<>(components);
	}

	public List<String> components() {
		return Collections.unmodifiableList(components);
	}

	public int depth() {
		return components.size();
	}

	public boolean isRoot() {
		return components.isEmpty();
	}

	public FSPath join(String path) {
		return join(new FSPath(path));
	}

	public FSPath join(FSPath path) {
		ArrayList<String> joined = new ArrayList<>(components);
		joined.addAll(path.components);
		return new FSPath(joined);
	}

	/** Parent of this path. The parent of the root is the root. */
	public FSPath dirname() {
		if(components.isEmpty()) return this;
		return new FSPath(components.subList(0, components.size() - 1));
	}

	/** Last component, or "" for the root. */
	public String basename() {
		if(components.isEmpty()) return "";
		return components.get(components.size() - 1);
	}

	/** Text after the last dot of the basename. Dotfiles like ".hidden" and names without a dot have no extension. */
	public String extension() {
		return extensionOf(basename());
	}

	/** Basename with its extension (and the dot before it) removed. */
	public String stem() {
		return stemOf(basename());
	}

	/** Replace the extension of the basename; an empty extension removes it. */
	public FSPath withExtension(String extension) {
		if(components.isEmpty()) return this;
		String name = stem();
		if(!extension.isEmpty()) name += "." + extension;
		ArrayList<String> replaced = new ArrayList<>(components);
		replaced.set(replaced.size() - 1, name);
		return new FSPath(replaced);
	}

	/** The first n components of this path. */
	public FSPath prefix(int n) {
		return new FSPath(components.subList(0, Math.min(n, components.size())));
	}

	public FSPath lowercase() {
		ArrayList<String> lowered = new ArrayList<>(components.size());
		for(String comp : components) {
			lowered.add(comp.toLowerCase(Locale.ROOT));
		}

		return new FSPath(lowered);
	}

	public boolean descendsFrom(String path) {
		return descendsFrom(new FSPath(path));
	}

	public boolean descendsFrom(FSPath path) {
		if(path.components.size() > components.size()) return false;
		return components.subList(0, path.components.size()).equals(path.components);
	}

	public String toPosix() {
		return String.join("/", components);
	}

	public String toNative() {
		return String.join(java.io.File.separator, components);
	}

	public static String extensionOf(String name) {
		int idx = name.lastIndexOf('.');
		if(idx <= 0) return "";
		return name.substring(idx + 1);
	}

	public static String stemOf(String name) {
		int idx = name.lastIndexOf('.');
		if(idx <= 0) return name;
		return name.substring(0, idx);
	}

	@Override
	public boolean equals(Object other) {
		if(!(other instanceof FSPath)) return false;
		return components.equals(((FSPath) other).components);
	}

	@Override
	public int hashCode() {
		return components.hashCode();
	}

	@Override
	public String toString() {
		return toPosix();
	}
}
