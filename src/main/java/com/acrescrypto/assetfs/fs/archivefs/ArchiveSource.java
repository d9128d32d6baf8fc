package com.acrescrypto.assetfs.fs.archivefs;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import com.acrescrypto.assetfs.fs.Directory;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.FSPath;
import com.acrescrypto.assetfs.fs.FileInputStream;

/** A file to be placed in a new archive: its logical path, its exact length, and a way to open its contents.
 * Contents are opened only when the writer reaches this file. */
public class ArchiveSource {
	public interface StreamOpener {
		InputStream open() throws IOException;
	}

	protected final String path;
	protected final long size;
	protected final StreamOpener opener;

	public ArchiveSource(String path, long size, StreamOpener opener) {
		this.path = FSPath.standardize(path);
		if(this.path.isEmpty()) throw new IllegalArgumentException("archive source path \"" + path + "\" names the root");
		this.size = size;
		this.opener = opener;
	}

	public ArchiveSource(String path, byte[] contents) {
		this(path, contents.length, ()->new ByteArrayInputStream(contents));
	}

	public static ArchiveSource fromFS(FS fs, String fsPath, String archivePath) throws IOException {
		return new ArchiveSource(archivePath, fs.stat(fsPath).getSize(),
				()->new FileInputStream(fs.open(fsPath, com.acrescrypto.assetfs.fs.File.O_RDONLY)));
	}

	/** Every regular file beneath root, with archive paths relative to root. */
	public static List<ArchiveSource> fromDirectory(FS fs, String root) throws IOException {
		ArrayList<ArchiveSource> sources = new ArrayList<>();
		try(Directory dir = fs.opendir(root)) {
			for(String subpath : dir.listRecursive(Directory.LIST_OPT_OMIT_DIRECTORIES)) {
				sources.add(fromFS(fs, fs.join(root, subpath), subpath));
			}
		}

		return sources;
	}

	public String getPath() {
		return path;
	}

	public long getSize() {
		return size;
	}

	public InputStream open() throws IOException {
		return opener.open();
	}

	@Override
	public String toString() {
		return path + " (" + size + " bytes)";
	}
}
