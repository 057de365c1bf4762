package org.broadinstitute.varspace.workspace;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Readers-writer mutual exclusion per file path.
 * <p>
 * Any number of readers may hold a path at once; a mutation holds it alone. Acquisition waits at most the
 * configured time and then fails with {@link UserException.Busy}. A thread holding the exclusive permit on a
 * path may also take a shared permit on it.
 * </p>
 * <p>
 * A path is tracked only while some thread holds or waits for its lock.
 * </p>
 */
public final class OperationLock {

    private static final Logger logger = LogManager.getLogger(OperationLock.class);

    private final ConcurrentMap<Path, PathLock> locks = new ConcurrentHashMap<>();

    private final long readWaitMillis;
    private final long writeWaitMillis;

    public OperationLock(final long readWaitMillis, final long writeWaitMillis) {
        Utils.validateArg(readWaitMillis >= 0, "the read wait cannot be negative");
        Utils.validateArg(writeWaitMillis >= 0, "the write wait cannot be negative");
        this.readWaitMillis = readWaitMillis;
        this.writeWaitMillis = writeWaitMillis;
    }

    /**
     * Takes a shared permit, as needed to read a file.
     *
     * @param path   the file to lock.
     * @param fileId name reported in a {@link UserException.Busy} failure.
     */
    public Permit acquireShared(final Path path, final String fileId) {
        final Path key = key(path);
        return acquire(key, reference(key).lock.readLock(), readWaitMillis, fileId, "shared");
    }

    /**
     * Takes an exclusive permit, as needed to create, replace or delete a file.
     *
     * @param path   the file to lock.
     * @param fileId name reported in a {@link UserException.Busy} failure.
     */
    public Permit acquireExclusive(final Path path, final String fileId) {
        final Path key = key(path);
        return acquire(key, reference(key).lock.writeLock(), writeWaitMillis, fileId, "exclusive");
    }

    public boolean isWriteLockedByCurrentThread(final Path path) {
        final PathLock entry = locks.get(key(path));
        return entry != null && entry.lock.isWriteLockedByCurrentThread();
    }

    /**
     * Number of paths currently held or waited for.
     */
    @VisibleForTesting
    int trackedPaths() {
        return locks.size();
    }

    private PathLock reference(final Path key) {
        return locks.compute(key, (k, entry) -> {
            final PathLock referenced = entry == null ? new PathLock() : entry;
            referenced.references++;
            return referenced;
        });
    }

    private void dereference(final Path key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.references == 0 ? null : entry);
    }

    private static Path key(final Path path) {
        return Utils.nonNull(path, "the path cannot be null").toAbsolutePath().normalize();
    }

    private Permit acquire(final Path path, final Lock lock, final long waitMillis, final String fileId, final String mode) {
        try {
            if (!lock.tryLock(waitMillis, TimeUnit.MILLISECONDS)) {
                dereference(path);
                logger.debug("Could not take " + mode + " lock on " + path + " within " + waitMillis + " ms");
                throw new UserException.Busy(fileId);
            }
        } catch (final InterruptedException e) {
            dereference(path);
            Thread.currentThread().interrupt();
            throw new UserException.Busy(fileId, e);
        }
        logger.debug("Took " + mode + " lock on " + path);
        return new Permit(this, lock, path, mode);
    }

    /**
     * The lock of one path and the number of permits holding or waiting for it; guarded by the map.
     */
    private static final class PathLock {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
        private int references;
    }

    /**
     * A held lock; closing it releases the lock. Closing more than once has no further effect.
     */
    public static final class Permit implements AutoCloseable {
        private final OperationLock owner;
        private final Lock lock;
        private final Path path;
        private final String mode;
        private boolean released;

        private Permit(final OperationLock owner, final Lock lock, final Path path, final String mode) {
            this.owner = owner;
            this.lock = lock;
            this.path = path;
            this.mode = mode;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
                owner.dereference(path);
                logger.debug("Released " + mode + " lock on " + path);
            }
        }
    }
}
