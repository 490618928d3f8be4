package io.rollo.vmmanager.event;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * Event fired when a host resource crosses its alert threshold.
 */
public class HostAlertEvent extends VmEvent {

    private final String alertId;
    private final AlertType alertType;
    private final Severity severity;
    private final String message;
    private final double value;
    private final double threshold;

    /**
     * Create a host alert.
     *
     * @param alertId unique alert identifier
     * @param alertType resource that crossed its threshold
     * @param severity alert severity
     * @param message human readable description
     * @param value observed usage ratio
     * @param threshold configured threshold ratio
     * @param timestamp when the alert was raised
     */
    public HostAlertEvent(
            @Nonnull String alertId,
            @Nonnull AlertType alertType,
            @Nonnull Severity severity,
            @Nonnull String message,
            double value,
            double threshold,
            @Nonnull Instant timestamp) {
        super(EventType.HOST_ALERT, timestamp);
        this.alertId = Objects.requireNonNull(alertId, "alertId");
        this.alertType = Objects.requireNonNull(alertType, "alertType");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = Objects.requireNonNull(message, "message");
        this.value = value;
        this.threshold = threshold;
    }

    @Nonnull
    public String getAlertId() {
        return alertId;
    }

    @Nonnull
    public AlertType getAlertType() {
        return alertType;
    }

    @Nonnull
    public Severity getSeverity() {
        return severity;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    public double getValue() {
        return value;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Resource an alert refers to.
     */
    public enum AlertType {
        MEMORY_ALLOCATION,
        CPU_ALLOCATION
    }

    public enum Severity {
        WARNING,
        CRITICAL
    }
}
