package watchtower.monitor.model;

/**
 * Outcome of one alert sent to one target.
 */
public enum AlertSendStatus {
    /** Record created, send in flight */
    SENDING,
    /** Target accepted the alert */
    SUCCEEDED,
    /** Target raised an error */
    FAILED,
    /** A rate-limit tier refused the send */
    RATE_LIMITED
}
