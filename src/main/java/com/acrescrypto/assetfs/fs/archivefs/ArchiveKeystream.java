package com.acrescrypto.assetfs.fs.archivefs;

/** The linear congruential keystream archives are obfuscated with. Every state transition is
 * magic = magic * 7 + 3 (mod 2^32).
 *
 * An instance tracks the header keystream of a v1/v2 archive, where each field consumes one step. File bodies
 * use a separate stream, see {@link BodyCipher}. */
public class ArchiveKeystream {
	public final static int MAGIC = 0xDEADCAFE;

	protected int magic;

	public static int step(int magic) {
		return magic * 7 + 3;
	}

	/** Magic after n steps from the given one, computed by squaring the affine map rather than iterating. */
	public static int jump(int magic, long n) {
		int mul = 1, add = 0; // accumulated map x -> mul*x + add
		int stepMul = 7, stepAdd = 3; // map for 2^k steps
		while(n > 0) {
			if((n & 1) != 0) {
				mul = stepMul * mul;
				add = stepMul * add + stepAdd;
			}

			stepAdd = stepMul * stepAdd + stepAdd;
			stepMul = stepMul * stepMul;
			n >>>= 1;
		}

		return mul * magic + add;
	}

	/** v3 archives store the base magic as (base - 3) / 9 mod 2^32. */
	public static int baseFromStored(int stored) {
		return stored * 9 + 3;
	}

	/** Inverse of {@link #baseFromStored(int)}. 954437177 is the inverse of 9 mod 2^32. */
	public static int storedFromBase(int base) {
		return (base - 3) * 954437177;
	}

	/** Key byte for the i-th byte of a v3 path. */
	public static byte pathKey(int base, int i) {
		return (byte) (base >>> (8*(i % 4)));
	}

	public ArchiveKeystream(int magic) {
		this.magic = magic;
	}

	/** Returns the current magic and steps the stream. */
	public int advance() {
		int old = magic;
		magic = step(magic);
		return old;
	}

	public int current() {
		return magic;
	}

	/** XOR transform for one file body. Byte i of the body is XORed with byte (i % 4) of the current word, taken
	 * little-endian; the word steps once every four bytes. The transform is its own inverse. */
	public static class BodyCipher {
		protected final int startMagic;
		protected long position;
		protected int magic;

		public BodyCipher(int startMagic) {
			this.startMagic = startMagic;
			this.magic = startMagic;
		}

		public void seek(long position) {
			if(position == this.position) return;
			this.position = position;
			this.magic = jump(startMagic, position/4);
		}

		public long position() {
			return position;
		}

		public void apply(byte[] buf, int offset, int length) {
			for(int i = 0; i < length; i++) {
				int j = (int) (position & 3);
				buf[offset + i] ^= (byte) (magic >>> (8*j));
				position++;
				if((position & 3) == 0) magic = step(magic);
			}
		}
	}
}
