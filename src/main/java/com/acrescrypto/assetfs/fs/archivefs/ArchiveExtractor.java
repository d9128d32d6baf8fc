package com.acrescrypto.assetfs.fs.archivefs;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.config.ConfigDefaults;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.FSPath;
import com.acrescrypto.assetfs.fs.File;

/** Copies every file in an archive out to another FS, creating directories as needed. Existing files at the
 * destination are overwritten. */
public class ArchiveExtractor {
	private Logger logger = LoggerFactory.getLogger(ArchiveExtractor.class);

	protected ArchiveFS archive;
	protected FS destination;
	protected String destinationRoot = "";
	protected AtomicLong progress;
	protected int copyBufferSize;

	public ArchiveExtractor(ArchiveFS archive, FS destination) {
		this.archive = archive;
		this.destination = destination;
		this.copyBufferSize = ConfigDefaults.getActiveDefaults().getInt(ConfigDefaults.COPY_BUFFER_SIZE);
	}

	public ArchiveExtractor setDestinationRoot(String destinationRoot) {
		this.destinationRoot = FSPath.standardize(destinationRoot);
		return this;
	}

	/** Counter incremented after each extracted file. */
	public ArchiveExtractor setProgressCounter(AtomicLong progress) {
		this.progress = progress;
		return this;
	}

	public void extract() throws IOException {
		int count = 0;
		try {
			for(Map.Entry<String,ArchiveEntry> entry : archive.getIndex().snapshot().entrySet()) {
				extractFile(entry.getKey());
				count++;
				if(progress != null) progress.incrementAndGet();
			}
		} catch(IOException exc) {
			logger.error("ArchiveExtractor: aborted extracting {} after {} files", archive, count, exc);
			throw exc;
		}

		logger.info("ArchiveExtractor: extracted {} files from {} to {}", count, archive, destination);
	}

	public Future<Void> extractAsync() {
		return ArchiveWriter.threadPool().submit(()->{
			extract();
			return null;
		});
	}

	protected void extractFile(String path) throws IOException {
		String target = FSPath.join(destinationRoot, path).toPosix();
		String parent = destination.dirname(target);
		if(!parent.isEmpty()) destination.mkdirp(parent);

		try(File in = archive.open(path, File.O_RDONLY)) {
			try(File out = destination.open(target, File.O_WRONLY|File.O_CREAT|File.O_TRUNC)) {
				byte[] buf = new byte[(int) Math.max(1, Math.min(copyBufferSize, in.getSize()))];
				int n;
				while((n = in.read(buf, 0, buf.length)) > 0) {
					out.write(buf, 0, n);
				}

				out.flush();
			}
		}

		logger.trace("ArchiveExtractor: extracted {}", path);
	}
}
