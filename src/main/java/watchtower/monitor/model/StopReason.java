package watchtower.monitor.model;

/**
 * Why an execution was stopped or given up on.
 */
public enum StopReason {
    MANUAL,
    MAX_EXECUTION_TIME_EXCEEDED,
    MISSING_HEARTBEAT,
    FAILED_TO_START
}
