package io.rollo.vmmanager.lifecycle;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-VM locks keyed by UUID.
 *
 * <p>A mutating operation holds the lock of its VM for its whole duration, so
 * at most one such operation runs per VM at a time. Locks are reentrant. The
 * lock of a deleted VM is {@linkplain #retire retired} and dropped once no
 * thread holds or waits for it.</p>
 */
public class VmLockRegistry {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Run an action while holding the lock of one VM.
     *
     * @param uuid VM UUID
     * @param action the work
     * @param <T> result type
     * @return the action result
     */
    public <T> T withLock(@Nonnull String uuid, @Nonnull Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        String key = key(uuid);
        LockEntry entry = acquireEntry(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            releaseEntry(key, entry);
        }
    }

    /**
     * Run an action while holding the locks of two VMs, acquired in key order.
     *
     * @param first first VM UUID
     * @param second second VM UUID
     * @param action the work
     * @param <T> result type
     * @return the action result
     */
    public <T> T withLocks(@Nonnull String first, @Nonnull String second, @Nonnull Supplier<T> action) {
        String a = key(first);
        String b = key(second);
        if (a.equals(b)) {
            return withLock(a, action);
        }
        String lower = a.compareTo(b) < 0 ? a : b;
        String upper = lower.equals(a) ? b : a;
        return withLock(lower, () -> withLock(upper, action));
    }

    /**
     * Check if some thread holds the lock of a VM.
     *
     * @param uuid VM UUID
     * @return true if locked
     */
    public boolean isLocked(@Nonnull String uuid) {
        LockEntry entry = locks.get(key(uuid));
        return entry != null && entry.lock.isLocked();
    }

    /**
     * Drop the lock of a VM that no longer exists. Threads holding or waiting
     * for it keep using it; the entry goes away when the last one releases it.
     *
     * @param uuid VM UUID
     */
    public void retire(@Nonnull String uuid) {
        locks.computeIfPresent(key(uuid), (k, entry) -> {
            entry.retired = true;
            return entry.users == 0 ? null : entry;
        });
    }

    int size() {
        return locks.size();
    }

    private LockEntry acquireEntry(String key) {
        return locks.compute(key, (k, entry) -> {
            LockEntry current = entry != null ? entry : new LockEntry();
            current.users++;
            return current;
        });
    }

    private void releaseEntry(String key, LockEntry released) {
        locks.computeIfPresent(key, (k, entry) -> {
            if (entry != released) {
                return entry;
            }
            entry.users--;
            return entry.users == 0 && entry.retired ? null : entry;
        });
    }

    private static String key(String uuid) {
        return Objects.requireNonNull(uuid, "uuid").toLowerCase(Locale.ROOT);
    }

    // users and retired are only touched inside the map's atomic compute calls
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
        private boolean retired;
    }
}
