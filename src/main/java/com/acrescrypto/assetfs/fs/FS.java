package com.acrescrypto.assetfs.fs;

import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;

import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.exceptions.ENOENTException;

/** A storage backend: a tree of files and directories addressed by slash-delimited paths relative to the
 * backend's root. Layered filesystems (overlays, path caches, archives) are themselves FS instances, so they
 * can be stacked freely. */
public abstract class FS implements AutoCloseable {
    protected static ConcurrentHashMap<File,Throwable> globalFileBacktraces = new ConcurrentHashMap<>();

    public static void addOpenFileHandle(File file, Throwable backtrace) {
        globalFileBacktraces.put(file, backtrace);
    }

    public static void removeOpenFileHandle(File file) {
        globalFileBacktraces.remove(file);
    }

    public static ConcurrentHashMap<File,Throwable> getGlobalOpenFiles() {
        return globalFileBacktraces;
    }

    public static boolean fileHandleTelemetryEnabled = false;

    public abstract Stat                  stat(String path) throws IOException;
    public abstract File                  open(String path, int mode) throws IOException;
    public abstract void                 mkdir(String path) throws IOException;
    /** Remove a directory and everything beneath it. */
    public abstract void                 rmdir(String path) throws IOException;
    public abstract void                unlink(String path) throws IOException;
    public abstract void                    mv(String oldPath, String newPath) throws IOException;
    public abstract Collection<DirEntry> readdir(String path) throws IOException;

    protected ConcurrentHashMap<File,Throwable> localFileBacktraces = new ConcurrentHashMap<>();

    public Directory opendir(String path) throws IOException {
        return new Directory(this, path, readdir(path));
    }

    /** True if something exists at the path. Only a missing path yields false; any other failure propagates. */
    public boolean exists(String path) throws IOException {
        try {
            stat(path);
            return true;
        } catch(ENOENTException exc) {
            return false;
        }
    }

    public long size(String path) throws IOException {
        return stat(path).getSize();
    }

    /** Create a directory and any missing parents. Existing directories along the way are left alone. */
    public void mkdirp(String path) throws IOException {
        FSPath fsPath = FSPath.with(path);
        for(int i = 1; i <= fsPath.depth(); i++) {
            String prefix = fsPath.prefix(i).toPosix();
            if(!exists(prefix)) {
                mkdir(prefix);
            } else if(!stat(prefix).isDirectory()) {
                throw new EISNOTDIRException(prefix);
            }
        }
    }

    /** Remove whatever is at the path, file or directory. */
    public void remove(String path) throws IOException {
        if(stat(path).isDirectory()) {
            rmdir(path);
        } else {
            unlink(path);
        }
    }

    public String join(String pathStart, String pathEnd) {
        return FSPath.with(pathStart).join(pathEnd).toPosix();
    }

    public void write(String path, byte[] contents) throws IOException {
        write(path, contents, 0, contents.length);
    }

    public void write(String path, byte[] contents, int offset, int length) throws IOException {
        try(File file = open(path, File.O_WRONLY|File.O_CREAT|File.O_TRUNC)) {
            file.write(contents, offset, length);
            file.flush();
        }
    }

    public byte[] read(String path) throws IOException {
        try(File file = open(path, File.O_RDONLY)) {
            byte[] bytes = file.read();
            return bytes;
        }
    }

    public void cp(String oldPath, String newPath) throws IOException {
        try(File in = open(oldPath, File.O_RDONLY)) {
            try(File out = open(newPath, File.O_WRONLY|File.O_CREAT|File.O_TRUNC)) {
                byte[] buf = new byte[(int) Math.max(1, Math.min(64*1024, in.getSize()))];
                while(in.hasData()) {
                    int readLen = in.read(buf, 0, buf.length);
                    if(readLen <= 0) break;
                    out.write(buf, 0, readLen);
                }
            }
        }
    }

    public String dirname(String path) {
        return FSPath.with(path).dirname().toPosix();
    }

    public String basename(String path) {
        return FSPath.with(path).basename();
    }

    /** Close any resources associated with keeping this FS access open. The FS object may not be reused. */
    public void close() throws IOException {}

    public void reportOpenFile(File file) {
        if(!fileHandleTelemetryEnabled) return;

        Throwable backtrace = new Throwable();
        addOpenFileHandle(file, backtrace);
        localFileBacktraces.put(file, backtrace);
    }

    public void reportClosedFile(File file) {
        if(!fileHandleTelemetryEnabled) return;

        removeOpenFileHandle(file);
        localFileBacktraces.remove(file);
    }

    public ConcurrentHashMap<File,Throwable> getOpenFiles() {
        return localFileBacktraces;
    }
}
