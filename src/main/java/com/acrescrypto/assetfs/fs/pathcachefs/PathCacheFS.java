package com.acrescrypto.assetfs.fs.pathcachefs;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.fs.DirEntry;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;

/** Case-insensitive view of another FS. Requests in any casing are mapped to the real casing the backend uses,
 * learning casings lazily from directory listings and remembering them until the tree is changed through this
 * FS or {@link #rebuild()} is called.
 *
 * A request without an extension resolves to a file with the same stem if there is one, so "Graphics/Titles/001"
 * opens "Graphics/Titles/001.png". */
public class PathCacheFS extends FS {
    private Logger logger = LoggerFactory.getLogger(PathCacheFS.class);

    protected final FS fs;
    protected final PathCache cache = new PathCache();
    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public PathCacheFS(FS fs) {
        this.fs = fs;
    }

    public FS getFS() {
        return fs;
    }

    /** Real path of an existing file or directory, in the backend's casing. */
    public String desensitize(String path) throws IOException {
        lock.writeLock().lock();
        try {
            return resolve(path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Forget everything learned so far. Use after the backend has been changed behind this FS's back. */
    public void rebuild() {
        lock.writeLock().lock();
        try {
            logger.debug("PathCacheFS {}: dropping {} cached paths", fs, cache.size());
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getCachedPathCount() {
        lock.readLock().lock();
        try {
            return cache.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getCachedPaths() {
        lock.readLock().lock();
        try {
            return cache.cachedPaths();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Stat stat(String path) throws IOException {
        String real = desensitize(path);
        return fs.stat(real);
    }

    @Override
    public boolean exists(String path) throws IOException {
        lock.writeLock().lock();
        try {
            cache.regen(fs, path);
            return cache.desensitize(path) != null;
        } catch(ENOENTException exc) {
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public File open(String path, int mode) throws IOException {
        lock.writeLock().lock();
        try {
            cache.regen(fs, path);
            String real = cache.desensitize(path);
            if(real != null) return fs.open(real, mode);
            if((mode & File.O_CREAT) == 0) throw new ENOENTException(path);

            real = cache.resolvePrefix(path);
            logger.debug("PathCacheFS {}: creating {} as {}", fs, path, real);
            File file = fs.open(real, mode);
            cache.regen(fs, real);
            return file;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Collection<DirEntry> readdir(String path) throws IOException {
        String real = desensitize(path);
        return fs.readdir(real);
    }

    @Override
    public void mkdir(String path) throws IOException {
        lock.writeLock().lock();
        try {
            cache.regen(fs, path);
            String real = cache.resolvePrefix(path);
            logger.debug("PathCacheFS {}: mkdir {} as {}", fs, path, real);
            fs.mkdir(real);
            cache.regen(fs, real);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void rmdir(String path) throws IOException {
        lock.writeLock().lock();
        try {
            String real = resolve(path);
            logger.debug("PathCacheFS {}: rmdir {} as {}", fs, path, real);
            fs.rmdir(real);
            cache.purge(real);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void unlink(String path) throws IOException {
        lock.writeLock().lock();
        try {
            String real = resolve(path);
            logger.debug("PathCacheFS {}: unlink {} as {}", fs, path, real);
            fs.unlink(real);
            cache.purge(real);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void mv(String oldPath, String newPath) throws IOException {
        lock.writeLock().lock();
        try {
            String realOld = resolve(oldPath);
            // literal destination name, so case-only renames take effect
            String newParent = dirname(newPath);
            cache.regen(fs, newParent);
            String realNew = join(cache.resolvePrefix(newParent), basename(newPath));
            logger.debug("PathCacheFS {}: mv {} {} as {} {}", fs, oldPath, newPath, realOld, realNew);
            fs.mv(realOld, realNew);
            cache.purge(realOld);
            cache.purge(realNew);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() throws IOException {
        fs.close();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " " + fs;
    }

    /** Caller holds the write lock. */
    protected String resolve(String path) throws IOException {
        cache.regen(fs, path);
        String real = cache.desensitize(path);
        if(real == null) throw new ENOENTException(path);
        return real;
    }
}
