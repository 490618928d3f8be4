package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a lifecycle operation.
 *
 * @param vmName resolved VM name
 * @param uuid resolved VM UUID, null when unknown
 * @param operation operation name (create, start, stop, ...)
 * @param status status token, see the constants of this class
 * @param details operation specific payload
 */
public record OperationResult(
        @Nonnull String vmName,
        @Nullable String uuid,
        @Nonnull String operation,
        @Nonnull String status,
        @Nonnull Map<String, Object> details) {

    public static final String CREATED = "created";
    public static final String STARTED = "started";
    public static final String ALREADY_RUNNING = "already_running";
    public static final String SHUTDOWN_REQUESTED = "shutdown_requested";
    public static final String DESTROYED = "destroyed";
    public static final String STOPPING = "stopping";
    public static final String ALREADY_STOPPED = "already_stopped";
    public static final String RESTARTED = "restarted";
    public static final String PAUSED = "paused";
    public static final String RESUMED = "resumed";
    public static final String INVALID_STATE = "invalid_state";
    public static final String DELETED = "deleted";
    public static final String CLONED = "cloned";
    public static final String RESIZED = "resized";
    public static final String LIMITS_SET = "limits_set";

    public static final String DETAIL_DELETED_DISKS = "deleted_disks";
    public static final String DETAIL_FAILED_DISKS = "failed_disks";
    public static final String DETAIL_STATE = "state";
    public static final String DETAIL_MESSAGE = "message";
    public static final String DETAIL_LIMITS = "limits";
    public static final String DETAIL_PENDING_RESTART = "pending_restart";

    public OperationResult {
        Objects.requireNonNull(vmName, "vmName");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(status, "status");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    @Nonnull
    public static OperationResult of(@Nonnull String vmName, @Nullable String uuid,
                                     @Nonnull String operation, @Nonnull String status) {
        return new OperationResult(vmName, uuid, operation, status, Map.of());
    }

    /**
     * Copy of this result with an extra detail entry.
     *
     * @param key detail key
     * @param value detail value
     * @return new result
     */
    @Nonnull
    public OperationResult withDetail(@Nonnull String key, @Nonnull Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new OperationResult(vmName, uuid, operation, status, copy);
    }

    /**
     * Check if the operation achieved (or already had) the requested outcome.
     *
     * @return false only for refused transitions
     */
    public boolean isSuccess() {
        return !INVALID_STATE.equals(status);
    }

    @Nullable
    public Object detail(@Nonnull String key) {
        return details.get(key);
    }

    /**
     * Read a detail that holds a list of strings, such as disk paths.
     *
     * @param key detail key
     * @return the list, empty when absent
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public List<String> detailList(@Nonnull String key) {
        Object value = details.get(key);
        return value instanceof List<?> ? (List<String>) value : List.of();
    }
}
