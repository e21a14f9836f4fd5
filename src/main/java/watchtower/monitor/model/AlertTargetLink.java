package watchtower.monitor.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Association between a schedulable and an alert target, with the severity the target
 * should receive per condition. A missing entry means the target is not alerted.
 */
public record AlertTargetLink(String targetId, Map<AlertCondition, Severity> severities) {

    public AlertTargetLink {
        Objects.requireNonNull(targetId, "targetId is required");
        severities = severities == null || severities.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(severities));
    }

    public static AlertTargetLink of(String targetId, AlertCondition condition, Severity severity) {
        return new AlertTargetLink(targetId, Map.of(condition, severity));
    }

    public Severity severityFor(AlertCondition condition) {
        return severities.get(condition);
    }
}
