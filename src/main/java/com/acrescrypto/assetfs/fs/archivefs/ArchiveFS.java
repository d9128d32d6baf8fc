package com.acrescrypto.assetfs.fs.archivefs;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.config.ConfigDefaults;
import com.acrescrypto.assetfs.exceptions.EEXISTSException;
import com.acrescrypto.assetfs.exceptions.EISDIRException;
import com.acrescrypto.assetfs.exceptions.EISNOTDIRException;
import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.exceptions.InvalidArchiveHeaderException;
import com.acrescrypto.assetfs.exceptions.InvalidArchiveVersionException;
import com.acrescrypto.assetfs.fs.DirEntry;
import com.acrescrypto.assetfs.fs.FS;
import com.acrescrypto.assetfs.fs.FSPath;
import com.acrescrypto.assetfs.fs.File;
import com.acrescrypto.assetfs.fs.Stat;
import com.acrescrypto.assetfs.utility.Util;

/** Read-mostly view of an RGSSAD archive (versions 1, 2 and 3) stored in a File.
 *
 * The header is scanned once when the archive is opened; file bodies are decoded lazily as they are read.
 * Every open ArchiveFile shares the one underlying stream, so each access to it seeks and reads while holding
 * {@link #archiveLock}. Archives cannot be restructured in place: new ones are built with
 * {@link #fromBufferAndFiles(File, int, Iterator)}. */
public class ArchiveFS extends FS {
    public final static byte[] HEADER = "RGSSAD\0".getBytes(StandardCharsets.US_ASCII);
    public final static int HEADER_SIZE = 8;
    public final static int MIN_VERSION = 1;
    public final static int MAX_VERSION = 3;

    private Logger logger = LoggerFactory.getLogger(ArchiveFS.class);

    protected final File archive;
    protected final ReentrantLock archiveLock = new ReentrantLock();
    protected final ArchiveIndex index;
    protected final int version;
    protected final int baseMagic;

    /** Build an archive from a sequence of files, writing it into buffer (which is truncated first). */
    public static ArchiveFS fromBufferAndFiles(File buffer, int version, Iterator<ArchiveSource> files) throws IOException {
        return new ArchiveWriter(buffer, version).write(files);
    }

    public static ArchiveFS fromBufferAndFiles(File buffer, int version, Iterator<ArchiveSource> files, AtomicLong progress) throws IOException {
        return new ArchiveWriter(buffer, version).setProgressCounter(progress).write(files);
    }

    public static ArchiveFS fromBufferAndFiles(File buffer, Iterator<ArchiveSource> files) throws IOException {
        int version = ConfigDefaults.getActiveDefaults().getInt(ConfigDefaults.DEFAULT_VERSION);
        return fromBufferAndFiles(buffer, version, files);
    }

    /** Build the archive on the shared archive worker pool. Progress is the number of files written so far. */
    public static Future<ArchiveFS> fromBufferAndFilesAsync(File buffer, int version, Iterator<ArchiveSource> files, AtomicLong progress) {
        ArchiveWriter writer = new ArchiveWriter(buffer, version).setProgressCounter(progress);
        return ArchiveWriter.threadPool().submit(()->writer.write(files));
    }

    public ArchiveFS(File archive) throws IOException {
        this.archive = archive;
        this.index = new ArchiveIndex();

        archiveLock.lock();
        try {
            HeaderReader reader = new HeaderReader(archive, 64*1024);
            byte[] header = new byte[HEADER_SIZE];
            try {
                reader.readFully(header);
            } catch(EOFException exc) {
                throw new InvalidArchiveHeaderException(archive.getPath() + ": archive is shorter than its header", exc);
            }

            if(!Arrays.equals(HEADER, Arrays.copyOfRange(header, 0, HEADER.length))) {
                throw new InvalidArchiveHeaderException(archive.getPath() + ": missing RGSSAD signature");
            }

            this.version = header[HEADER_SIZE-1] & 0xff;
            switch(version) {
            case 1:
            case 2:
                this.baseMagic = ArchiveKeystream.MAGIC;
                readIndexV1(reader);
                break;
            case 3:
                this.baseMagic = readIndexV3(reader);
                break;
            default:
                throw new InvalidArchiveVersionException(version);
            }
        } finally {
            archiveLock.unlock();
        }

        logger.info("ArchiveFS {}: opened version {} archive, {} files", archive.getPath(), version, index.size());
    }

    protected ArchiveFS(File archive, ArchiveIndex index, int version, int baseMagic) {
        this.archive = archive;
        this.index = index;
        this.version = version;
        this.baseMagic = baseMagic;
    }

    protected void readIndexV1(HeaderReader reader) throws IOException {
        ArchiveKeystream keystream = new ArchiveKeystream(ArchiveKeystream.MAGIC);
        long length = reader.length();

        for(int i = 0; ; i++) {
            long headerOffset = reader.position();
            long pathLen;
            try {
                pathLen = Util.unsignInt(reader.readInt() ^ keystream.advance());
            } catch(EOFException exc) {
                break;
            }

            String path;
            long size;
            try {
                if(pathLen > length - reader.position()) {
                    throw new InvalidArchiveHeaderException("path length " + pathLen + " runs past the end of the archive");
                }

                byte[] pathBytes = new byte[(int) pathLen];
                reader.readFully(pathBytes);
                for(int j = 0; j < pathBytes.length; j++) {
                    pathBytes[j] ^= (byte) keystream.advance();
                }

                path = decodePath(pathBytes);
                size = Util.unsignInt(reader.readInt() ^ keystream.advance());
            } catch(InvalidArchiveHeaderException exc) {
                throw new InvalidArchiveHeaderException(describeRecord(i, headerOffset) + ": " + exc.getMessage(), exc);
            } catch(IOException exc) {
                throw new IOException(describeRecord(i, headerOffset), exc);
            }

            long bodyOffset = reader.position();
            if(bodyOffset + size > length) {
                throw new InvalidArchiveHeaderException(describeRecord(i, headerOffset)
                        + ": body of " + size + " bytes runs past the end of the archive");
            }

            addEntry(i, headerOffset, path, new ArchiveEntry(size, headerOffset, bodyOffset, keystream.current()));
            reader.seek(bodyOffset + size);
        }
    }

    protected int readIndexV3(HeaderReader reader) throws IOException {
        int base;
        try {
            base = ArchiveKeystream.baseFromStored(reader.readInt());
        } catch(EOFException exc) {
            throw new InvalidArchiveHeaderException(archive.getPath() + ": version 3 archive ends before its base magic", exc);
        }

        long length = reader.length();
        for(int i = 0; ; i++) {
            long headerOffset = reader.position();
            long bodyOffset;
            try {
                bodyOffset = Util.unsignInt(reader.readInt() ^ base);
            } catch(EOFException exc) {
                break;
            }

            if(bodyOffset == 0) break;

            String path;
            long size;
            int magic;
            try {
                size = Util.unsignInt(reader.readInt() ^ base);
                magic = reader.readInt() ^ base;
                long pathLen = Util.unsignInt(reader.readInt() ^ base);
                if(pathLen > length - reader.position()) {
                    throw new InvalidArchiveHeaderException("path length " + pathLen + " runs past the end of the archive");
                }

                byte[] pathBytes = new byte[(int) pathLen];
                reader.readFully(pathBytes);
                for(int j = 0; j < pathBytes.length; j++) {
                    pathBytes[j] ^= ArchiveKeystream.pathKey(base, j);
                }

                path = decodePath(pathBytes);
            } catch(InvalidArchiveHeaderException exc) {
                throw new InvalidArchiveHeaderException(describeRecord(i, headerOffset) + ": " + exc.getMessage(), exc);
            } catch(IOException exc) {
                throw new IOException(describeRecord(i, headerOffset), exc);
            }

            if(bodyOffset + size > length) {
                throw new InvalidArchiveHeaderException(describeRecord(i, headerOffset)
                        + ": body of " + size + " bytes at offset " + bodyOffset + " runs past the end of the archive");
            }

            addEntry(i, headerOffset, path, new ArchiveEntry(size, headerOffset, bodyOffset, magic));
        }

        return base;
    }

    protected void addEntry(int i, long headerOffset, String path, ArchiveEntry entry) throws InvalidArchiveHeaderException {
        try {
            index.put(path, entry);
        } catch(InvalidArchiveHeaderException exc) {
            throw new InvalidArchiveHeaderException(describeRecord(i, headerOffset) + ": " + exc.getMessage(), exc);
        }
    }

    protected String describeRecord(int i, long offset) {
        return String.format("While reading file #%d at offset %d of version %d archive %s", i, offset, version, archive.getPath());
    }

    protected static String decodePath(byte[] pathBytes) throws InvalidArchiveHeaderException {
        for(int i = 0; i < pathBytes.length; i++) {
            if(pathBytes[i] == '\\') pathBytes[i] = '/';
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(pathBytes))
                    .toString();
        } catch(CharacterCodingException exc) {
            throw new InvalidArchiveHeaderException("path is not valid UTF-8", exc);
        }
    }

    public int getVersion() {
        return version;
    }

    /** MAGIC for version 1 and 2 archives, the per-archive base magic for version 3. */
    public int getBaseMagic() {
        return baseMagic;
    }

    public ArchiveEntry getEntry(String path) {
        return index.get(path);
    }

    public int fileCount() {
        return index.size();
    }

    public ArchiveIndex getIndex() {
        return index;
    }

    public File getArchiveFile() {
        return archive;
    }

    @Override
    public Stat stat(String path) throws IOException {
        ArchiveEntry entry = index.get(path);
        if(entry != null) return Stat.regularFile(entry.getSize());
        if(index.containsDirectory(path)) return Stat.directory(index.countEntries(path));
        throw new ENOENTException(path);
    }

    @Override
    public ArchiveFile open(String path, int mode) throws IOException {
        String standardized = FSPath.standardize(path);
        ArchiveEntry entry = index.get(standardized);
        if(entry == null) {
            if(index.containsDirectory(standardized)) throw new EISDIRException(path);
            if((mode & File.O_CREAT) != 0) {
                throw new UnsupportedOperationException(path + ": cannot add files to an existing archive");
            }

            throw new ENOENTException(path);
        }

        if((mode & (File.O_TRUNC|File.O_APPEND)) != 0 && (mode & File.O_WRONLY) != 0) {
            throw new UnsupportedOperationException(path + ": archived files cannot be truncated or appended to");
        }

        return new ArchiveFile(this, standardized, entry, mode);
    }

    @Override
    public Collection<DirEntry> readdir(String path) throws IOException {
        if(!index.containsDirectory(path)) {
            if(index.containsFile(path)) throw new EISNOTDIRException(path);
            throw new ENOENTException(path);
        }

        return index.list(path);
    }

    @Override
    public void mkdir(String path) throws IOException {
        if(exists(path)) throw new EEXISTSException(path);
        throw new UnsupportedOperationException(path + ": archives cannot be restructured in place");
    }

    /** Succeeds only when every component already exists as a directory, since archives cannot gain new ones. */
    @Override
    public void mkdirp(String path) throws IOException {
        FSPath target = FSPath.with(path);
        for(FSPath ancestor = target; !ancestor.isRoot(); ancestor = ancestor.dirname()) {
            if(index.containsFile(ancestor.toPosix())) throw new EISNOTDIRException(ancestor.toPosix());
        }

        if(index.containsDirectory(target.toPosix())) return;
        throw new UnsupportedOperationException(path + ": archives cannot be restructured in place");
    }

    @Override
    public void rmdir(String path) throws IOException {
        throw new UnsupportedOperationException(path + ": archives cannot be restructured in place");
    }

    @Override
    public void unlink(String path) throws IOException {
        throw new UnsupportedOperationException(path + ": archives cannot be restructured in place");
    }

    @Override
    public void mv(String oldPath, String newPath) throws IOException {
        throw new UnsupportedOperationException(oldPath + ": archives cannot be restructured in place");
    }

    @Override
    public void close() throws IOException {
        archiveLock.lock();
        try {
            archive.close();
        } finally {
            archiveLock.unlock();
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " " + archive.getPath() + " v" + version;
    }

    /** Read raw (still obfuscated) bytes at an absolute archive offset. */
    protected int readRaw(long offset, byte[] buf, int bufOffset, int length) throws IOException {
        archiveLock.lock();
        try {
            archive.seek(offset, File.SEEK_SET);
            int total = 0;
            while(total < length) {
                int n = archive.read(buf, bufOffset + total, length - total);
                if(n <= 0) break;
                total += n;
            }

            return total;
        } finally {
            archiveLock.unlock();
        }
    }

    protected void writeRaw(long offset, byte[] buf, int bufOffset, int length) throws IOException {
        archiveLock.lock();
        try {
            archive.seek(offset, File.SEEK_SET);
            archive.write(buf, bufOffset, length);
        } finally {
            archiveLock.unlock();
        }
    }

    protected void flushRaw() throws IOException {
        archiveLock.lock();
        try {
            archive.flush();
        } finally {
            archiveLock.unlock();
        }
    }
}
