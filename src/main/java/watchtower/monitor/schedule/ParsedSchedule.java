package watchtower.monitor.schedule;

/**
 * A successfully parsed schedule expression.
 */
public interface ParsedSchedule {

    /** Which form the schedule was written in. */
    ScheduleForm form();

    /** The original schedule string. */
    String expression();
}
