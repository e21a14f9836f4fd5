package watchtower.monitor.alert;

import watchtower.monitor.model.Detection;
import watchtower.monitor.model.SchedulableKind;

import java.time.Instant;
import java.util.Locale;

/**
 * Builds grouping keys so transports can collapse repeated alerts about one condition into one
 * thread. Format: {@code <kind prefix>_<task|workflow>-<schedulable id>-<epoch minute>}.
 */
public final class GroupingKeys {

    private GroupingKeys() {
    }

    /**
     * Key of a detection. Pass the original detection, not a resolving one, so the resolution
     * lands in the same thread.
     */
    public static String forDetection(Detection detection) {
        return prefix(detection) + "-" + detection.schedulableId() + "-" + epochMinute(bucketTime(detection));
    }

    static String prefix(Detection detection) {
        return detection.kind().keyPrefix() + "_" + kindName(detection.schedulableKind());
    }

    private static Instant bucketTime(Detection detection) {
        return switch (detection.kind()) {
            case MISSING_SCHEDULED_EXECUTION -> detection.missingExecution().expectedExecutionAt();
            case DELAYED_START -> detection.delayedStart().expectedStartBy();
            case MISSING_HEARTBEAT -> detection.missingHeartbeat().expectedHeartbeatAt();
            case INSUFFICIENT_INSTANCES -> detection.insufficientInstances().intervalEnd();
            case STATUS_CHANGE -> detection.detectedAt();
        };
    }

    private static long epochMinute(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), 60);
    }

    private static String kindName(SchedulableKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
