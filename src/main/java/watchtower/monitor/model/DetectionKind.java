package watchtower.monitor.model;

/**
 * Tag of a {@link Detection}. Each kind carries its own {@link DetectionDetails} payload.
 */
public enum DetectionKind {
    /** A scheduled occurrence produced no execution */
    MISSING_SCHEDULED_EXECUTION("missing_scheduled"),
    /** A manually started execution was not picked up in time */
    DELAYED_START("delayed_start"),
    /** A running execution stopped sending heartbeats */
    MISSING_HEARTBEAT("missing_heartbeat"),
    /** A service task has fewer live instances than required */
    INSUFFICIENT_INSTANCES("insufficient_service_executions"),
    /** An execution reached a terminal status worth reporting */
    STATUS_CHANGE("execution_status_change");

    private final String keyPrefix;

    DetectionKind(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    /** Stable prefix used in grouping keys. */
    public String keyPrefix() {
        return keyPrefix;
    }
}
