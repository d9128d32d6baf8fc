package com.acrescrypto.assetfs.fs.overlayfs;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.exceptions.EROFSException;
import com.acrescrypto.assetfs.fs.DirEntry;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;

/** Stack of filesystems presented as one namespace. Layers are ordered front to back and can only be appended.
 *
 * Lookups are served by the first layer that has the path; directory listings merge every layer, with names
 * from earlier layers hiding the same names further back. Anything that modifies the tree is sent to the first
 * layer alone. A write aimed at something that only exists in a later layer fails with EROFSException rather
 * than copying it forward. */
public class OverlayFS extends FS {
    private Logger logger = LoggerFactory.getLogger(OverlayFS.class);
    protected final CopyOnWriteArrayList<FS> layers = new CopyOnWriteArrayList<>();

    public OverlayFS(FS... layers) {
        for(FS layer : layers) {
            addLayer(layer);
        }
    }

    public void addLayer(FS layer) {
        logger.debug("OverlayFS: adding layer {} at depth {}", layer, layers.size());
        layers.add(layer);
    }

    public List<FS> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    /** The first layer holding the path, or null. */
    public FS layerFor(String path) throws IOException {
        for(FS layer : layers) {
            if(layer.exists(path)) return layer;
        }

        return null;
    }

    protected FS primary() {
        if(layers.isEmpty()) throw new IllegalStateException("OverlayFS has no layers");
        return layers.get(0);
    }

    @Override
    public Stat stat(String path) throws IOException {
        FS layer = layerFor(path);
        if(layer == null) throw new ENOENTException(path);
        Stat stat = layer.stat(path);
        if(!stat.isDirectory()) return stat;
        return Stat.directory(merge(path, null).size());
    }

    @Override
    public boolean exists(String path) throws IOException {
        return layerFor(path) != null;
    }

    @Override
    public File open(String path, int mode) throws IOException {
        if((mode & File.O_WRONLY) == 0) {
            FS layer = layerFor(path);
            if(layer == null) throw new ENOENTException(path);
            return layer.open(path, mode);
        }

        assertWritableInPrimary(path);
        return primary().open(path, mode);
    }

    @Override
    public Collection<DirEntry> readdir(String path) throws IOException {
        HashSet<String> spanning = new HashSet<>();
        LinkedHashMap<String,DirEntry> merged = merge(path, spanning);

        // subdirectories present in several layers are sized by their merged listing
        for(String name : spanning) {
            int count = merge(join(path, name), null).size();
            merged.put(name, new DirEntry(name, Stat.directory(count)));
        }

        return merged.values();
    }

    /** Merged listing of a directory across all layers. Names of subdirectories that appear as directories in more
     * than one layer are added to spanning, when it is supplied. */
    protected LinkedHashMap<String,DirEntry> merge(String path, Set<String> spanning) throws IOException {
        LinkedHashMap<String,DirEntry> merged = new LinkedHashMap<>();
        boolean found = false;

        for(FS layer : layers) {
            if(!layer.exists(path)) continue;
            if(!layer.stat(path).isDirectory()) {
                // a file in an earlier layer hides directories of the same name further back
                if(!found) throw new EISNOTDIRException(path);
                continue;
            }

            found = true;
            for(DirEntry entry : layer.readdir(path)) {
                DirEntry existing = merged.putIfAbsent(entry.getName(), entry);
                if(spanning != null
                        && existing != null
                        && existing.getStat().isDirectory()
                        && entry.getStat().isDirectory()) {
                    spanning.add(entry.getName());
                }
            }
        }

        if(!found) throw new ENOENTException(path);
        return merged;
    }

    @Override
    public void mkdir(String path) throws IOException {
        logger.debug("OverlayFS: mkdir {}", path);
        primary().mkdir(path);
    }

    @Override
    public void mkdirp(String path) throws IOException {
        logger.debug("OverlayFS: mkdirp {}", path);
        primary().mkdirp(path);
    }

    @Override
    public void rmdir(String path) throws IOException {
        logger.debug("OverlayFS: rmdir {}", path);
        assertWritableInPrimary(path);
        primary().rmdir(path);
    }

    @Override
    public void unlink(String path) throws IOException {
        logger.debug("OverlayFS: unlink {}", path);
        assertWritableInPrimary(path);
        primary().unlink(path);
    }

    @Override
    public void mv(String oldPath, String newPath) throws IOException {
        logger.debug("OverlayFS: mv {} {}", oldPath, newPath);
        assertWritableInPrimary(oldPath);
        primary().mv(oldPath, newPath);
    }

    @Override
    public void close() throws IOException {
        IOException firstException = null;
        for(FS layer : layers) {
            try {
                layer.close();
            } catch(IOException exc) {
                logger.warn("OverlayFS: caught exception closing layer {}", layer, exc);
                if(firstException == null) firstException = exc;
            }
        }

        if(firstException != null) throw firstException;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " " + layers;
    }

    /** Fails if the path exists only behind the first layer. Missing paths pass, and are left for the first layer
     * to create or reject. */
    protected void assertWritableInPrimary(String path) throws IOException {
        FS top = primary();
        if(top.exists(path)) return;

        for(FS layer : layers.subList(1, layers.size())) {
            if(layer.exists(path)) throw new EROFSException(path);
        }
    }
}
