package com.parallel.dnamatch.engine;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared result backed by a memory-mapped file, so that worker processes can merge into it.
 * <p>
 * Layout: two big-endian ints, position then count. Exclusion across processes uses an exclusive
 * {@link FileLock} over the record; threads of the same JVM are serialized first by a local lock,
 * since a JVM may hold only one lock on a given region.
 * <p>
 * The creating side owns the file and deletes it on {@link #close()}; attached sides only unmap.
 */
public final class MappedSharedResult implements SharedResult {

    static final int RECORD_SIZE = 2 * Integer.BYTES;
    private static final int POSITION_OFFSET = 0;
    private static final int COUNT_OFFSET = Integer.BYTES;

    private final Path path;
    private final FileChannel channel;
    private final MappedByteBuffer record;
    private final boolean owner;
    private final ReentrantLock localLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private FileLock fileLock;

    private MappedSharedResult(Path path, FileChannel channel, MappedByteBuffer record, boolean owner) {
        this.path = path;
        this.channel = channel;
        this.record = record;
        this.owner = owner;
    }

    /**
     * Creates the backing file, which must not exist yet, and initializes it to {@link SearchResult#NONE}.
     */
    public static MappedSharedResult create(Path path) throws ResourceException {
        FileChannel channel = null;
        try {
            channel = FileChannel.open(path,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
            MappedByteBuffer record = channel.map(FileChannel.MapMode.READ_WRITE, 0, RECORD_SIZE);
            record.putInt(POSITION_OFFSET, SearchResult.NONE.position());
            record.putInt(COUNT_OFFSET, SearchResult.NONE.count());
            record.force();
            return new MappedSharedResult(path, channel, record, true);
        } catch (IOException | RuntimeException e) {
            ResourceException failure = new ResourceException("Cannot create shared result at " + path, e);
            if (channel != null) {
                discard(path, channel, failure);
            }
            throw failure;
        }
    }

    /**
     * Maps a record previously created by {@link #create(Path)}, typically from a worker process.
     */
    public static MappedSharedResult attach(Path path) throws ResourceException {
        FileChannel channel = null;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
            if (channel.size() < RECORD_SIZE) {
                throw new IOException("Shared result file is truncated: " + channel.size() + " bytes");
            }
            MappedByteBuffer record = channel.map(FileChannel.MapMode.READ_WRITE, 0, RECORD_SIZE);
            return new MappedSharedResult(path, channel, record, false);
        } catch (IOException | RuntimeException e) {
            ResourceException failure = new ResourceException("Cannot attach shared result at " + path, e);
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
            }
            throw failure;
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public void acquire() throws ResourceException {
        if (closed.get()) {
            throw new ResourceException("Shared result used after release: " + path);
        }
        localLock.lock();
        try {
            fileLock = channel.lock(0, RECORD_SIZE, false);
        } catch (IOException | RuntimeException e) {
            localLock.unlock();
            throw new ResourceException("Cannot lock shared result " + path, e);
        }
    }

    @Override
    public void release() throws ResourceException {
        if (!localLock.isHeldByCurrentThread()) {
            throw new ResourceException("Lock released by a thread that does not hold it");
        }
        try {
            fileLock.release();
        } catch (IOException e) {
            throw new ResourceException("Cannot unlock shared result " + path, e);
        } finally {
            fileLock = null;
            localLock.unlock();
        }
    }

    @Override
    public SearchResult read() {
        return new SearchResult(record.getInt(POSITION_OFFSET), record.getInt(COUNT_OFFSET));
    }

    @Override
    public void write(SearchResult value) {
        record.putInt(POSITION_OFFSET, value.position());
        record.putInt(COUNT_OFFSET, value.count());
    }

    @Override
    public void close() throws ResourceException {
        if (!closed.compareAndSet(false, true)) {
            throw new IllegalStateException("Shared result already released: " + path);
        }
        ResourceException failure = new ResourceException("Cannot release shared result " + path);
        if (owner) {
            discard(path, channel, failure);
        } else {
            try {
                channel.close();
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
        if (failure.getSuppressed().length > 0) {
            throw failure;
        }
    }

    private static void discard(Path path, FileChannel channel, Exception failure) {
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
