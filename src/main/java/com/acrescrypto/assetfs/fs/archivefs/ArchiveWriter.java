package com.acrescrypto.assetfs.fs.archivefs;

import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.config.ConfigDefaults;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.FileInputStream;
import com.acrescrypto.assetfs.fs.FileOutputStream;
import com.acrescrypto.assetfs.fs.localfs.LocalFS;
import com.acrescrypto.assetfs.utility.GroupedThreadPool;
import com.acrescrypto.assetfs.utility.Util;

/** Writes a complete archive into a buffer file from a sequence of sources.
 *
 * Versions 1 and 2 interleave each header record with its body, so they are streamed straight into the buffer.
 * Version 3 keeps all records ahead of all bodies; bodies are spooled into a scratch file while the header is
 * written, appended afterwards, and the body offsets patched into the header at the end. */
public class ArchiveWriter {
	protected static GroupedThreadPool threadPool;

	/** Shared pool for asynchronous archive builds and extractions. */
	public static synchronized GroupedThreadPool threadPool() {
		if(threadPool == null) {
			int threads = ConfigDefaults.getActiveDefaults().getInt(ConfigDefaults.WORKER_THREADS);
			threadPool = GroupedThreadPool.newFixedThreadPool("ArchiveFS worker", threads);
		}

		return threadPool;
	}

	private Logger logger = LoggerFactory.getLogger(ArchiveWriter.class);

	protected final File buffer;
	protected final int version;
	protected int copyBufferSize;
	protected AtomicLong progress;
	protected FS scratchFS;
	protected SecureRandom random = new SecureRandom();

	protected class PendingEntry {
		String path;
		long size, headerOffset, relativeBodyOffset;
		int magic;

		PendingEntry(String path, long size, long headerOffset, long relativeBodyOffset, int magic) {
			this.path = path;
			this.size = size;
			this.headerOffset = headerOffset;
			this.relativeBodyOffset = relativeBodyOffset;
			this.magic = magic;
		}
	}

	public ArchiveWriter(File buffer, int version) {
		this.buffer = buffer;
		this.version = version;
		this.copyBufferSize = ConfigDefaults.getActiveDefaults().getInt(ConfigDefaults.COPY_BUFFER_SIZE);
	}

	public ArchiveWriter setProgressCounter(AtomicLong progress) {
		this.progress = progress;
		return this;
	}

	public ArchiveWriter setCopyBufferSize(int copyBufferSize) {
		this.copyBufferSize = copyBufferSize;
		return this;
	}

	/** FS holding the scratch file for version 3 bodies. Defaults to the configured scratch directory. */
	public ArchiveWriter setScratchFS(FS scratchFS) {
		this.scratchFS = scratchFS;
		return this;
	}

	public ArchiveFS write(Iterator<ArchiveSource> files) throws IOException {
		if(version < ArchiveFS.MIN_VERSION || version > ArchiveFS.MAX_VERSION) {
			throw new UnsupportedOperationException("cannot write version " + version + " archives");
		}

		try {
			buffer.truncate(0);
			buffer.seek(0, File.SEEK_SET);

			ArchiveFS archive = version == 3 ? writeV3(files) : writeV1(files);
			logger.info("ArchiveWriter: wrote version {} archive {} with {} files, {} bytes",
					version,
					buffer.getPath(),
					archive.fileCount(),
					buffer.getSize());
			return archive;
		} catch(IOException|RuntimeException exc) {
			logger.error("ArchiveWriter: aborted writing version {} archive {}", version, buffer.getPath(), exc);
			throw exc;
		}
	}

	protected ArchiveFS writeV1(Iterator<ArchiveSource> files) throws IOException {
		OutputStream out = new BufferedOutputStream(new FileOutputStream(buffer), copyBufferSize);
		writeHeader(out);

		ArchiveKeystream keystream = new ArchiveKeystream(ArchiveKeystream.MAGIC);
		ArchiveIndex index = new ArchiveIndex();
		long headerOffset = ArchiveFS.HEADER_SIZE;

		TreeSet<String> claimed = new TreeSet<>();
		for(int i = 0; files.hasNext(); i++) {
			ArchiveSource source = files.next();
			claimPath(i, source, claimed);
			byte[] pathBytes = encodePath(source.getPath());
			long size = checkedSize(source);

			try {
				writeInt(out, pathBytes.length ^ keystream.advance());
				for(byte b : pathBytes) {
					out.write(b ^ (byte) keystream.advance());
				}

				writeInt(out, (int) size ^ keystream.advance());
				int startMagic = keystream.current();
				copyBody(source, startMagic, out);

				long bodyOffset = headerOffset + pathBytes.length + 8;
				index.put(source.getPath(), new ArchiveEntry(size, headerOffset, bodyOffset, startMagic));
				headerOffset = bodyOffset + size;
			} catch(IOException exc) {
				throw new IOException(describeSource(i, source), exc);
			}

			if(progress != null) progress.incrementAndGet();
		}

		out.flush();
		return new ArchiveFS(buffer, index, version, ArchiveKeystream.MAGIC);
	}

	protected ArchiveFS writeV3(Iterator<ArchiveSource> files) throws IOException {
		FS scratch = scratchFS != null
				? scratchFS
				: new LocalFS(ConfigDefaults.getActiveDefaults().getString(ConfigDefaults.SCRATCH_DIR));
		byte[] nonce = new byte[8];
		random.nextBytes(nonce);
		String scratchPath = "assetfs-archive-" + Util.bytesToHex(nonce) + ".tmp";

		try(File scratchFile = scratch.open(scratchPath, File.O_RDWR|File.O_CREAT|File.O_TRUNC)) {
			return writeV3(files, scratchFile);
		} finally {
			try {
				if(scratch.exists(scratchPath)) scratch.unlink(scratchPath);
			} catch(IOException exc) {
				logger.warn("ArchiveWriter: unable to remove scratch file {} from {}", scratchPath, scratch, exc);
			}
		}
	}

	protected ArchiveFS writeV3(Iterator<ArchiveSource> files, File scratchFile) throws IOException {
		int base = random.nextInt();
		OutputStream out = new BufferedOutputStream(new FileOutputStream(buffer), copyBufferSize);
		OutputStream bodies = new BufferedOutputStream(new FileOutputStream(scratchFile), copyBufferSize);
		writeHeader(out);
		writeInt(out, ArchiveKeystream.storedFromBase(base));

		ArrayList<PendingEntry> pending = new ArrayList<>();
		long headerOffset = ArchiveFS.HEADER_SIZE + 4;
		long relativeBodyOffset = 0;

		TreeSet<String> claimed = new TreeSet<>();
		for(int i = 0; files.hasNext(); i++) {
			ArchiveSource source = files.next();
			claimPath(i, source, claimed);
			byte[] pathBytes = encodePath(source.getPath());
			long size = checkedSize(source);
			int magic = random.nextInt();

			try {
				writeInt(out, 0); // body offset, patched once the header size is known
				writeInt(out, (int) size ^ base);
				writeInt(out, magic ^ base);
				writeInt(out, pathBytes.length ^ base);
				for(int j = 0; j < pathBytes.length; j++) {
					out.write(pathBytes[j] ^ ArchiveKeystream.pathKey(base, j));
				}

				copyBody(source, magic, bodies);
			} catch(IOException exc) {
				throw new IOException(describeSource(i, source), exc);
			}

			pending.add(new PendingEntry(source.getPath(), size, headerOffset, relativeBodyOffset, magic));
			headerOffset += 16 + pathBytes.length;
			relativeBodyOffset += size;
			if(progress != null) progress.incrementAndGet();
		}

		// terminator record: an offset field that decodes to zero
		writeInt(out, base);
		long headerSize = headerOffset + 4;

		bodies.flush();
		scratchFile.seek(0, File.SEEK_SET);
		try(InputStream spooled = new FileInputStream(scratchFile)) {
			IOUtils.copyLarge(spooled, out, new byte[copyBufferSize]);
		}
		out.flush();

		ArchiveIndex index = new ArchiveIndex();
		for(PendingEntry entry : pending) {
			long bodyOffset = headerSize + entry.relativeBodyOffset;
			if(bodyOffset > 0xffffffffL) {
				throw new IOException(entry.path + ": body offset " + bodyOffset + " does not fit in a version 3 archive");
			}

			buffer.seek(entry.headerOffset, File.SEEK_SET);
			buffer.write(Util.serializeIntLE((int) bodyOffset ^ base));
			index.put(entry.path, new ArchiveEntry(entry.size, entry.headerOffset, bodyOffset, entry.magic));
		}

		buffer.flush();
		return new ArchiveFS(buffer, index, version, base);
	}

	protected void writeHeader(OutputStream out) throws IOException {
		out.write(ArchiveFS.HEADER);
		out.write(version);
	}

	protected void copyBody(ArchiveSource source, int startMagic, OutputStream out) throws IOException {
		ArchiveKeystream.BodyCipher cipher = new ArchiveKeystream.BodyCipher(startMagic);
		byte[] buf = new byte[(int) Math.max(1, Math.min(copyBufferSize, source.getSize()))];
		long remaining = source.getSize();

		try(InputStream in = source.open()) {
			while(remaining > 0) {
				int n = in.read(buf, 0, (int) Math.min(buf.length, remaining));
				if(n < 0) {
					throw new EOFException(source.getPath() + ": source ended after "
							+ (source.getSize() - remaining) + " of " + source.getSize() + " bytes");
				}

				cipher.apply(buf, 0, n);
				out.write(buf, 0, n);
				remaining -= n;
			}
		}
	}

	/** Refuse a source whose path would make the archive unreadable: the root, a repeat, or a file/directory clash. */
	protected void claimPath(int i, ArchiveSource source, TreeSet<String> claimed) {
		String conflict = ArchiveIndex.conflict(claimed, source.getPath());
		if(conflict != null) {
			throw new IllegalArgumentException(describeSource(i, source) + ": path " + conflict);
		}

		claimed.add(source.getPath());
	}

	protected String describeSource(int i, ArchiveSource source) {
		return String.format("While writing file #%d (%s, %d bytes) to version %d archive %s",
				i, source.getPath(), source.getSize(), version, buffer.getPath());
	}

	protected static long checkedSize(ArchiveSource source) throws IOException {
		if(source.getSize() < 0 || source.getSize() > 0xffffffffL) {
			throw new IOException(source.getPath() + ": " + source.getSize() + " bytes is too large for an archive");
		}

		return source.getSize();
	}

	protected static byte[] encodePath(String path) {
		return path.replace('/', '\\').getBytes(StandardCharsets.UTF_8);
	}

	protected static void writeInt(OutputStream out, int value) throws IOException {
		out.write(Util.serializeIntLE(value));
	}
}
