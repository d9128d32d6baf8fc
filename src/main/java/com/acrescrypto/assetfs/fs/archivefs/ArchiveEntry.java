package com.acrescrypto.assetfs.fs.archivefs;

/** Location of one file inside an archive. */
public class ArchiveEntry {
	protected final long size;
	protected final long headerOffset;
	protected final long bodyOffset;
	protected final int startMagic;

	public ArchiveEntry(long size, long headerOffset, long bodyOffset, int startMagic) {
		this.size = size;
		this.headerOffset = headerOffset;
		this.bodyOffset = bodyOffset;
		this.startMagic = startMagic;
	}

	public long getSize() {
		return size;
	}

	/** Offset of this file's record in the archive header. */
	public long getHeaderOffset() {
		return headerOffset;
	}

	public long getBodyOffset() {
		return bodyOffset;
	}

	/** Seed of the body keystream. */
	public int getStartMagic() {
		return startMagic;
	}

	@Override
	public boolean equals(Object other) {
		if(!(other instanceof ArchiveEntry)) return false;
		ArchiveEntry o = (ArchiveEntry) other;
		return size == o.size
				&& headerOffset == o.headerOffset
				&& bodyOffset == o.bodyOffset
				&& startMagic == o.startMagic;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(bodyOffset) ^ Long.hashCode(size) ^ startMagic;
	}

	@Override
	public String toString() {
		return String.format("ArchiveEntry size=%d header=%d body=%d magic=%08x", size, headerOffset, bodyOffset, startMagic);
	}
}
