package watchtower.monitor.exception;

/**
 * Thrown when a schedule string is neither a valid {@code cron(...)} nor a valid
 * {@code rate(...)} expression.
 */
public class InvalidScheduleException extends WatchtowerException {

    private final String schedule;

    public InvalidScheduleException(String schedule, String reason) {
        super("Invalid schedule '" + schedule + "': " + reason);
        this.schedule = schedule;
    }

    public InvalidScheduleException(String schedule, String reason, Throwable cause) {
        super("Invalid schedule '" + schedule + "': " + reason, cause);
        this.schedule = schedule;
    }

    public String getSchedule() {
        return schedule;
    }
}
