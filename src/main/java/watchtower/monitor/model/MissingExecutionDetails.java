package watchtower.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A scheduled occurrence that produced fewer executions than required.
 *
 * @param schedule              the schedule string at detection time
 * @param expectedExecutionAt   exact fire time for cron schedules, lower bound for rate schedules
 * @param missingExecutionCount instances still missing
 */
public record MissingExecutionDetails(String schedule, Instant expectedExecutionAt, int missingExecutionCount)
        implements DetectionDetails {

    public MissingExecutionDetails {
        Objects.requireNonNull(expectedExecutionAt, "expectedExecutionAt is required");
    }

    @Override
    public DetectionKind kind() {
        return DetectionKind.MISSING_SCHEDULED_EXECUTION;
    }
}
