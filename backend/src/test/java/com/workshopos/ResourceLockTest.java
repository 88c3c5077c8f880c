package com.workshopos;

import com.workshopos.locking.LocalResourceLock;
import com.workshopos.locking.ResourceLock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceLockTest {

    private final ResourceLock lock = new LocalResourceLock();

    @Test
    void sameKey_neverRunsConcurrently() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> lock.withLock("portal:a", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    sleep(2);
                    inside.decrementAndGet();
                })));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void differentKeys_runConcurrently() throws Exception {
        CountDownLatch bothInside = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> a = pool.submit(() -> lock.withLock("portal:a", () -> awaitBoth(bothInside)));
            Future<Boolean> b = pool.submit(() -> lock.withLock("portal:b", () -> awaitBoth(bothInside)));
            assertThat(a.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(b.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void withLock_isReentrantAndReturnsValue() {
        String result = lock.withLock("portal:a", () -> lock.withLock("portal:a", () -> "inner"));
        assertThat(result).isEqualTo("inner");
    }

    @Test
    void withLock_releasesOnException() {
        assertThatThrownBy(() ->
            lock.withLock("portal:a", (Runnable) () -> { throw new IllegalStateException("boom"); })
        ).isInstanceOf(IllegalStateException.class);

        assertThat(lock.withLock("portal:a", () -> 42)).isEqualTo(42);
    }

    private static boolean awaitBoth(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(3, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
