package watchtower.monitor.schedule;

/**
 * Supported schedule forms.
 */
public enum ScheduleForm {
    /** {@code cron(<fields>)}, evaluated in UTC */
    CRON,
    /** {@code rate(<n> <unit>)} */
    RATE
}
