package com.acrescrypto.assetfs.fs.pathcachefs;

import java.util.ArrayDeque;
import java.util.ArrayList;

/** Slab of path components linked towards the root, so paths sharing a prefix share its nodes. Indices stay
 * stable for the life of a node; freed slots are reused. */
public class CactusStack {
	public final static int NONE = -1;

	public static class CactusNode {
		protected final String value;
		protected final int next;
		protected final int len;

		public CactusNode(String value, int next, int len) {
			this.value = value;
			this.next = next;
			this.len = len;
		}

		/** This component, in its real casing. */
		public String getValue() {
			return value;
		}

		/** Index of the parent component, or NONE at the top level. */
		public int getNext() {
			return next;
		}

		/** Number of components in the path ending here. */
		public int getLen() {
			return len;
		}
	}

	protected final ArrayList<CactusNode> slots = new ArrayList<>();
	protected final ArrayDeque<Integer> freeSlots = new ArrayDeque<>();
	protected int count;

	/** Add a component below the node at index next (or at the top level for NONE). */
	public int push(String value, int next) {
		int len = next == NONE ? 1 : get(next).getLen() + 1;
		return insert(new CactusNode(value, next, len));
	}

	public int insert(CactusNode node) {
		count++;
		Integer free = freeSlots.poll();
		if(free != null) {
			slots.set(free, node);
			return free;
		}

		slots.add(node);
		return slots.size() - 1;
	}

	public CactusNode get(int index) {
		if(index < 0 || index >= slots.size()) return null;
		return slots.get(index);
	}

	public void remove(int index) {
		if(get(index) == null) return;
		slots.set(index, null);
		freeSlots.push(index);
		count--;
	}

	/** Full path ending at index, components joined with '/'. */
	public String path(int index) {
		CactusNode node = get(index);
		if(node == null) throw new IllegalArgumentException("no cactus node at index " + index);

		String[] components = new String[node.getLen()];
		for(int i = components.length - 1; i >= 0; i--) {
			components[i] = node.getValue();
			node = i > 0 ? get(node.getNext()) : null;
			if(i > 0 && node == null) {
				throw new IllegalStateException("broken cactus chain below index " + index);
			}
		}

		return String.join("/", components);
	}

	/** Live node count. */
	public int size() {
		return count;
	}

	/** Slots allocated, live or free. */
	public int capacity() {
		return slots.size();
	}

	public void clear() {
		slots.clear();
		freeSlots.clear();
		count = 0;
	}
}
