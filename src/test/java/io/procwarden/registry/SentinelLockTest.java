package io.procwarden.registry;

import io.procwarden.testing.FakeProcessTable;
import io.procwarden.testing.FakeTicker;
import io.procwarden.testing.TestFiles;
import io.procwarden.util.Ticker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

final class SentinelLockTest {

    @Test
    void lockFileHoldsOwnerPidWhileHeldAndIsRemovedAfter() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-basic-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path lockPath = SentinelLock.lockPathFor(root.resolve("processes.json"));
            SentinelLock lock = new SentinelLock(lockPath, LockSettings.defaults(), table, ticker);

            String seen = lock.withLock(() -> Files.readString(lockPath, StandardCharsets.UTF_8));

            Assertions.assertEquals(Long.toString(table.currentPid()), seen);
            Assertions.assertEquals("processes.json.lock", lockPath.getFileName().toString());
            Assertions.assertFalse(Files.exists(lockPath));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void lockOfDeadOwnerIsBrokenWithoutWaiting() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-dead-owner-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path lockPath = root.resolve("processes.json.lock");
            Files.writeString(lockPath, "99999", StandardCharsets.UTF_8);
            SentinelLock lock = new SentinelLock(lockPath, LockSettings.defaults(), table, ticker);

            Assertions.assertEquals("ok", lock.withLock(() -> "ok"));
            Assertions.assertEquals(0L, ticker.totalSleptMs());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void expiredLockOfLiveOwnerIsBroken() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-expired-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            table.add(700L, 1L, "procwarden reclaim");
            Path lockPath = root.resolve("processes.json.lock");
            Files.writeString(lockPath, "700", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(lockPath, FileTime.fromMillis(ticker.nowMs() - 60_000L));
            SentinelLock lock = new SentinelLock(lockPath, LockSettings.defaults(), table, ticker);

            Assertions.assertEquals("ok", lock.withLock(() -> "ok"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void freshLockOfLiveOwnerExhaustsRetries() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-busy-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            table.add(700L, 1L, "procwarden reclaim");
            Path lockPath = root.resolve("processes.json.lock");
            Files.writeString(lockPath, "700", StandardCharsets.UTF_8);
            SentinelLock lock = new SentinelLock(lockPath, new LockSettings(30_000L, 100L, 3), table, ticker);

            RegistryLockException error = Assertions.assertThrows(
                    RegistryLockException.class, () -> lock.withLock(() -> "never"));

            Assertions.assertEquals(lockPath, error.lockPath());
            Assertions.assertEquals(300L, ticker.totalSleptMs());
            Assertions.assertEquals("700", Files.readString(lockPath, StandardCharsets.UTF_8));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void releaseLeavesLockTakenOverByAnotherProcess() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-takeover-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path lockPath = root.resolve("spawned-pids.json.lock");
            SentinelLock lock = new SentinelLock(lockPath, LockSettings.defaults(), table, ticker);

            lock.withLock(() -> {
                Files.writeString(lockPath, "801", StandardCharsets.UTF_8);
                return null;
            });

            Assertions.assertEquals("801", Files.readString(lockPath, StandardCharsets.UTF_8));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void staleLockIsLeftAloneWhileAnotherBreakerWorks() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-breaker-busy-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path lockPath = root.resolve("processes.json.lock");
            Files.writeString(lockPath, "99999", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("processes.json.lock.break"), "801", StandardCharsets.UTF_8);
            SentinelLock lock = new SentinelLock(lockPath, new LockSettings(30_000L, 100L, 3), table, ticker);

            Assertions.assertThrows(RegistryLockException.class, () -> lock.withLock(() -> "never"));

            Assertions.assertEquals("99999", Files.readString(lockPath, StandardCharsets.UTF_8));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void abandonedBreakerIsClearedAndLockTaken() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-breaker-abandoned-");
        try {
            FakeTicker ticker = new FakeTicker();
            FakeProcessTable table = new FakeProcessTable(ticker);
            Path lockPath = root.resolve("processes.json.lock");
            Path breaker = root.resolve("processes.json.lock.break");
            Files.writeString(lockPath, "99999", StandardCharsets.UTF_8);
            Files.writeString(breaker, "801", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(breaker, FileTime.fromMillis(ticker.nowMs() - 60_000L));
            SentinelLock lock = new SentinelLock(lockPath, new LockSettings(30_000L, 100L, 3), table, ticker);

            Assertions.assertEquals("ok", lock.withLock(() -> "ok"));
            Assertions.assertFalse(Files.exists(breaker));
            Assertions.assertFalse(Files.exists(lockPath));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void concurrentBreakersNeverShareTheLock() throws Exception {
        Path root = Files.createTempDirectory("procwarden-lock-concurrent-break-");
        try {
            FakeProcessTable table = new FakeProcessTable(new FakeTicker());
            Path lockPath = root.resolve("processes.json.lock");
            LockSettings settings = new LockSettings(30_000L, 1L, 10_000);
            AtomicInteger inside = new AtomicInteger();
            AtomicInteger maxInside = new AtomicInteger();
            List<Throwable> errors = new CopyOnWriteArrayList<>();

            for (int round = 0; round < 100; round++) {
                Files.writeString(lockPath, "99999", StandardCharsets.UTF_8);
                CountDownLatch go = new CountDownLatch(1);
                List<Thread> threads = new ArrayList<>();
                for (int t = 0; t < 2; t++) {
                    SentinelLock lock = new SentinelLock(lockPath, settings, table, Ticker.SYSTEM);
                    threads.add(new Thread(() -> {
                        try {
                            go.await();
                            lock.withLock(() -> {
                                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                                LockSupport.parkNanos(200_000L);
                                inside.decrementAndGet();
                                return null;
                            });
                        } catch (Exception e) {
                            errors.add(e);
                        }
                    }));
                }
                threads.forEach(Thread::start);
                go.countDown();
                for (Thread thread : threads) {
                    thread.join(10_000L);
                }
            }

            Assertions.assertTrue(errors.isEmpty(), () -> "lock failures: " + errors);
            Assertions.assertEquals(1, maxInside.get());
            Assertions.assertFalse(Files.exists(lockPath));
            Assertions.assertFalse(Files.exists(root.resolve("processes.json.lock.break")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
