package com.acrescrypto.assetfs.fs.localfs;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.EACCESException;
import com.acrescrypto.assetfs.exceptions.EEXISTSException;
import com.acrescrypto.assetfs.exceptions.EISDIRException;
import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.fs.*;

/** Backend over a directory of the host filesystem. Paths never escape the root directory. */
public class LocalFS extends FS {
    private Logger logger = LoggerFactory.getLogger(LocalFS.class);
    protected Path root;

    public LocalFS(String root) {
        this(Paths.get(root));
    }

    public LocalFS(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    public Path qualifiedPathNative(String path) {
        FSPath fsPath = FSPath.with(path);
        if(fsPath.isRoot()) return root;
        return root.resolve(fsPath.toNative());
    }

    @Override
    public Stat stat(String path) throws IOException {
        return statPath(path, qualifiedPathNative(path));
    }

    protected Stat statPath(String path, Path nativePath) throws IOException {
        try {
            BasicFileAttributes attr = Files.readAttributes(nativePath, BasicFileAttributes.class);
            if(attr.isDirectory()) {
                try(Stream<Path> children = Files.list(nativePath)) {
                    return Stat.directory(children.count());
                }
            }

            return Stat.regularFile(attr.size());
        } catch(NoSuchFileException exc) {
            throw new ENOENTException(path);
        } catch(AccessDeniedException exc) {
            throw new EACCESException(path);
        }
    }

    @Override
    public LocalFile open(String path, int mode) throws IOException {
        return new LocalFile(this, path, mode);
    }

    @Override
    public Collection<DirEntry> readdir(String path) throws IOException {
        Path nativePath = qualifiedPathNative(path);
        if(!Files.exists(nativePath)) throw new ENOENTException(path);
        if(!Files.isDirectory(nativePath)) throw new EISNOTDIRException(path);

        ArrayList<DirEntry> entries = new ArrayList<>();
        try(DirectoryStream<Path> stream = Files.newDirectoryStream(nativePath)) {
            for(Path child : stream) {
                String name = child.getFileName().toString();
                try {
                    entries.add(new DirEntry(name, statPath(join(path, name), child)));
                } catch(ENOENTException exc) {
                    // removed between listing and stat
                    logger.trace("LocalFS {}: {} vanished during readdir of {}", root, name, path);
                }
            }
        } catch(AccessDeniedException exc) {
            throw new EACCESException(path);
        }

        return entries;
    }

    @Override
    public void mv(String oldPath, String newPath) throws IOException {
        logger.debug("LocalFS {}: mv {} {}", root, oldPath, newPath);
        Path source = qualifiedPathNative(oldPath);
        Path target = qualifiedPathNative(newPath);
        if(!Files.exists(source)) throw new ENOENTException(oldPath);
        if(Files.isDirectory(target) && !Files.isDirectory(source)) throw new EISDIRException(newPath);

        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch(DirectoryNotEmptyException exc) {
            throw new EEXISTSException(newPath);
        } catch(NoSuchFileException exc) {
            throw new ENOENTException(newPath);
        }
    }

    @Override
    public void mkdir(String path) throws IOException {
        logger.debug("LocalFS {}: mkdir {}", root, path);
        try {
            Files.createDirectory(qualifiedPathNative(path));
        } catch(FileAlreadyExistsException exc) {
            throw new EEXISTSException(path);
        } catch(NoSuchFileException exc) {
            throw new ENOENTException(path);
        }
    }

    @Override
    public void mkdirp(String path) throws IOException {
        logger.debug("LocalFS {}: mkdirp {}", root, path);
        try {
            Files.createDirectories(qualifiedPathNative(path));
        } catch(FileAlreadyExistsException exc) {
            throw new EISNOTDIRException(path);
        }
    }

    @Override
    public void rmdir(String path) throws IOException {
        logger.debug("LocalFS {}: rmdir {}", root, path);
        Path p = qualifiedPathNative(path);
        if(!Files.exists(p)) throw new ENOENTException(path);
        if(!Files.isDirectory(p)) throw new EISNOTDIRException(path);
        if(p.equals(root)) throw new EACCESException(path);

        FileUtils.deleteDirectory(p.toFile());
    }

    @Override
    public void unlink(String path) throws IOException {
        logger.debug("LocalFS {}: unlink {}", root, path);
        Path p = qualifiedPathNative(path);
        if(Files.isDirectory(p)) throw new EISDIRException(path);

        try {
            Files.delete(p);
        } catch(NoSuchFileException exc) {
            throw new ENOENTException(path);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " " + root;
    }
}
