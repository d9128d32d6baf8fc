package com.acrescrypto.assetfs.utility;

public class Util {
	public static String bytesToHex(byte[] b) {
		StringBuilder sb = new StringBuilder(2*b.length);
		for(byte x : b) sb.append(String.format("%02x", x));
		return sb.toString();
	}

	public static long unsignInt(int intVal) {
		return intVal & 0xffffffffL;
	}

	/** Little-endian encoding, as used by archive headers. */
	public static byte[] serializeIntLE(int x) {
		return new byte[] {
				(byte) x,
				(byte) (x >>> 8),
				(byte) (x >>> 16),
				(byte) (x >>> 24)
		};
	}

	public static int deserializeIntLE(byte[] b, int offset) {
		return (b[offset] & 0xff)
				| ((b[offset+1] & 0xff) << 8)
				| ((b[offset+2] & 0xff) << 16)
				| ((b[offset+3] & 0xff) << 24);
	}

	public static void setThreadName(String name) {
		Thread.currentThread().setName(name + " " + String.format("%08x", System.identityHashCode(Thread.currentThread())));
	}
}
