package org.broadinstitute.varspace.workspace;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public final class OperationLockUnitTest extends BaseTest {

    private static final Path FILE = Paths.get("ws", "file.csv");

    private static <T> T onOtherThread(final Callable<T> task) throws Exception {
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            return executor.submit(task).get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testReadersShare() throws Exception {
        final OperationLock lock = new OperationLock(0, 0);
        try (final OperationLock.Permit first = lock.acquireShared(FILE, "file.csv")) {
            final boolean acquired = onOtherThread(() -> {
                try (final OperationLock.Permit second = lock.acquireShared(FILE, "file.csv")) {
                    return true;
                }
            });
            Assert.assertTrue(acquired);
        }
    }

    @Test
    public void testWriterExcludesWriterAndReaders() throws Exception {
        final OperationLock lock = new OperationLock(0, 0);
        try (final OperationLock.Permit writer = lock.acquireExclusive(FILE, "file.csv")) {
            Assert.assertTrue(lock.isWriteLockedByCurrentThread(FILE));
            final Class<?> writeFailure = onOtherThread(() -> {
                try (final OperationLock.Permit other = lock.acquireExclusive(FILE, "file.csv")) {
                    return null;
                } catch (final UserException.Busy e) {
                    Assert.assertEquals(e.getFileId(), "file.csv");
                    return e.getClass();
                }
            });
            Assert.assertEquals(writeFailure, UserException.Busy.class);
            final Class<?> readFailure = onOtherThread(() -> {
                try (final OperationLock.Permit other = lock.acquireShared(FILE, "file.csv")) {
                    return null;
                } catch (final UserException.Busy e) {
                    return e.getClass();
                }
            });
            Assert.assertEquals(readFailure, UserException.Busy.class);
        }
        Assert.assertFalse(lock.isWriteLockedByCurrentThread(FILE));
    }

    @Test
    public void testReaderBlocksWriter() throws Exception {
        final OperationLock lock = new OperationLock(0, 0);
        try (final OperationLock.Permit reader = lock.acquireShared(FILE, "file.csv")) {
            final boolean busy = onOtherThread(() -> {
                try (final OperationLock.Permit writer = lock.acquireExclusive(FILE, "file.csv")) {
                    return false;
                } catch (final UserException.Busy e) {
                    return true;
                }
            });
            Assert.assertTrue(busy);
        }
    }

    @Test
    public void testWriterMayAlsoRead() {
        final OperationLock lock = new OperationLock(0, 0);
        try (final OperationLock.Permit writer = lock.acquireExclusive(FILE, "file.csv");
             final OperationLock.Permit reader = lock.acquireShared(FILE, "file.csv")) {
            Assert.assertEquals(reader.getPath(), writer.getPath());
        }
    }

    @Test
    public void testPathsAreNormalized() throws Exception {
        final OperationLock lock = new OperationLock(0, 0);
        try (final OperationLock.Permit writer = lock.acquireExclusive(Paths.get("ws", "sub", "..", "file.csv"), "file.csv")) {
            Assert.assertTrue(lock.isWriteLockedByCurrentThread(FILE));
        }
    }

    @Test
    public void testWaitingWriterGetsLockWhenReleased() throws Exception {
        final OperationLock lock = new OperationLock(0, 10_000);
        final OperationLock.Permit reader = lock.acquireShared(FILE, "file.csv");
        final CompletableFuture<Boolean> writer = CompletableFuture.supplyAsync(() -> {
            try (final OperationLock.Permit permit = lock.acquireExclusive(FILE, "file.csv")) {
                return true;
            }
        });
        Thread.sleep(100);
        Assert.assertFalse(writer.isDone());
        reader.close();
        Assert.assertTrue(writer.get(10, TimeUnit.SECONDS));
    }

    @Test
    public void testClosingTwiceReleasesOnce() {
        final OperationLock lock = new OperationLock(0, 0);
        final OperationLock.Permit permit = lock.acquireExclusive(FILE, "file.csv");
        permit.close();
        permit.close();
        try (final OperationLock.Permit again = lock.acquireExclusive(FILE, "file.csv")) {
            Assert.assertTrue(lock.isWriteLockedByCurrentThread(FILE));
        }
    }

    @Test
    public void testReleasedPathsAreForgotten() throws Exception {
        final OperationLock lock = new OperationLock(0, 0);
        for (int i = 0; i < 50; i++) {
            try (final OperationLock.Permit permit = lock.acquireExclusive(Paths.get("ws", "merged_" + i + ".csv"), "merged.csv")) {
                Assert.assertEquals(lock.trackedPaths(), 1);
            }
        }
        Assert.assertEquals(lock.trackedPaths(), 0);

        try (final OperationLock.Permit writer = lock.acquireExclusive(FILE, "file.csv");
             final OperationLock.Permit reader = lock.acquireShared(FILE, "file.csv")) {
            final boolean busy = onOtherThread(() -> {
                try (final OperationLock.Permit other = lock.acquireShared(FILE, "file.csv")) {
                    return false;
                } catch (final UserException.Busy e) {
                    return true;
                }
            });
            Assert.assertTrue(busy);
            Assert.assertEquals(lock.trackedPaths(), 1);
        }
        Assert.assertEquals(lock.trackedPaths(), 0);
        Assert.assertFalse(lock.isWriteLockedByCurrentThread(FILE));
    }

    @Test
    public void testWaitingWriterKeepsPathTracked() throws Exception {
        final OperationLock lock = new OperationLock(0, 10_000);
        final OperationLock.Permit reader = lock.acquireShared(FILE, "file.csv");
        final CompletableFuture<Boolean> writer = CompletableFuture.supplyAsync(() -> {
            try (final OperationLock.Permit permit = lock.acquireExclusive(FILE, "file.csv")) {
                return lock.isWriteLockedByCurrentThread(FILE);
            }
        });
        Thread.sleep(100);
        Assert.assertFalse(writer.isDone());
        Assert.assertEquals(lock.trackedPaths(), 1);
        reader.close();
        Assert.assertTrue(writer.get(10, TimeUnit.SECONDS));
        Assert.assertEquals(lock.trackedPaths(), 0);
    }
}
