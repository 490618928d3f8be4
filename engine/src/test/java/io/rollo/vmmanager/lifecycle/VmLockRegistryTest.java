package io.rollo.vmmanager.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class VmLockRegistryTest {

    private static final String VM_A = "5b5f5a1e-0000-4000-8000-00000000000a";
    private static final String VM_B = "5b5f5a1e-0000-4000-8000-00000000000b";

    private final VmLockRegistry registry = new VmLockRegistry();

    @Test
    void lockIsHeldOnlyDuringAction() {
        boolean heldInside = registry.withLock(VM_A, () -> registry.isLocked(VM_A));

        assertThat(heldInside).isTrue();
        assertThat(registry.isLocked(VM_A)).isFalse();
        assertThat(registry.isLocked(VM_B)).isFalse();
    }

    @Test
    void keysAreCaseInsensitive() {
        boolean held = registry.withLock(VM_A.toUpperCase(), () -> registry.isLocked(VM_A));

        assertThat(held).isTrue();
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        assertThatThrownBy(() -> registry.withLock(VM_A, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.isLocked(VM_A)).isFalse();
    }

    @Test
    void sameVmOperationsDoNotOverlap() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> registry.withLock(VM_A, () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleep(10);
                    inside.decrementAndGet();
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void differentVmsProceedInParallel() throws Exception {
        CountDownLatch aHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> registry.withLock(VM_A, () -> {
                aHeld.countDown();
                awaitQuietly(release);
                return null;
            }));
            assertThat(aHeld.await(2, TimeUnit.SECONDS)).isTrue();

            String result = registry.withLock(VM_B, () -> "done");

            assertThat(result).isEqualTo("done");
            assertThat(registry.isLocked(VM_A)).isTrue();
            release.countDown();
            holder.get(2, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void pairLocksAreTakenInKeyOrder() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> forward = executor.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    registry.withLocks(VM_A, VM_B, () -> null);
                }
            });
            Future<?> backward = executor.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    registry.withLocks(VM_B, VM_A, () -> null);
                }
            });

            forward.get(10, TimeUnit.SECONDS);
            backward.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.isLocked(VM_A)).isFalse();
        assertThat(registry.isLocked(VM_B)).isFalse();
    }

    @Test
    void pairWithSameKeyTakesOneLock() {
        boolean held = registry.withLocks(VM_A, VM_A.toUpperCase(), () -> registry.isLocked(VM_A));

        assertThat(held).isTrue();
        await().atMost(1, TimeUnit.SECONDS).until(() -> !registry.isLocked(VM_A));
    }

    @Test
    void retiredLockIsDroppedOnceIdle() {
        registry.withLock(VM_A, () -> null);
        registry.withLock(VM_B, () -> null);
        assertThat(registry.size()).isEqualTo(2);

        registry.retire(VM_A.toUpperCase());

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.isLocked(VM_A)).isFalse();
    }

    @Test
    void retiringWhileHeldKeepsExclusionForWaiters() throws Exception {
        CountDownLatch waiterQueued = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> waiter = registry.withLock(VM_A, () -> {
                Future<?> queued = executor.submit(() -> {
                    waiterQueued.countDown();
                    return registry.withLock(VM_A, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleep(20);
                        inside.decrementAndGet();
                        return null;
                    });
                });
                awaitQuietly(waiterQueued);
                sleep(20);
                registry.retire(VM_A);
                // a newcomer after retirement must still serialize with the queued waiter
                executor.submit(() -> registry.withLock(VM_A, () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleep(20);
                    inside.decrementAndGet();
                    return null;
                }));
                return queued;
            });

            waiter.get(5, TimeUnit.SECONDS);
            await().atMost(5, TimeUnit.SECONDS).until(() -> registry.size() == 0);
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
