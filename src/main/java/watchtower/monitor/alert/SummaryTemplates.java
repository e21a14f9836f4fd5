package watchtower.monitor.alert;

import watchtower.monitor.model.Detection;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Human-readable one-line summaries of detections.
 *
 * <p>Placeholders: {@code {kind} {name} {id} {execution_id} {expected_at} {missing_count}
 * {detected} {required} {status}}. Placeholders a detection kind does not carry are left blank.
 */
public final class SummaryTemplates {

    public static final String MISSING_TASK = "Task '{name}' did not run as scheduled at {expected_at} ({missing_count} missing)";
    public static final String MISSING_WORKFLOW = "Workflow '{name}' did not run as scheduled at {expected_at}";

    private SummaryTemplates() {
    }

    public static String defaultTemplate(Detection detection) {
        if (detection.isResolution()) {
            return switch (detection.kind()) {
                case INSUFFICIENT_INSTANCES -> "{kind} '{name}' is back to {detected} of {required} required instances";
                case MISSING_HEARTBEAT -> "{kind} '{name}' execution {execution_id} resumed sending heartbeats";
                case DELAYED_START -> "{kind} '{name}' execution {execution_id} has started";
                case MISSING_SCHEDULED_EXECUTION -> "{kind} '{name}' ran for the occurrence expected at {expected_at}";
                case STATUS_CHANGE -> "{kind} '{name}' recovered";
            };
        }
        return switch (detection.kind()) {
            case MISSING_SCHEDULED_EXECUTION -> detection.schedulableKind() == SchedulableKind.WORKFLOW
                    ? MISSING_WORKFLOW
                    : MISSING_TASK;
            case DELAYED_START -> "{kind} '{name}' execution {execution_id} has not started yet";
            case MISSING_HEARTBEAT -> "{kind} '{name}' execution {execution_id} missed its heartbeat due at {expected_at}";
            case INSUFFICIENT_INSTANCES -> "{kind} '{name}' has {detected} of {required} required instances running";
            case STATUS_CHANGE -> "{kind} '{name}' execution {execution_id} finished with status {status}";
        };
    }

    public static String render(String template, Schedulable schedulable, Detection detection) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("kind", schedulable.kind() == SchedulableKind.WORKFLOW ? "Workflow" : "Task");
        values.put("name", schedulable.name() != null ? schedulable.name() : schedulable.id());
        values.put("id", schedulable.id());
        values.put("execution_id", nullToEmpty(detection.executionId()));

        switch (detection.kind()) {
            case MISSING_SCHEDULED_EXECUTION -> {
                values.put("expected_at", String.valueOf(detection.missingExecution().expectedExecutionAt()));
                values.put("missing_count", String.valueOf(detection.missingExecution().missingExecutionCount()));
            }
            case MISSING_HEARTBEAT ->
                    values.put("expected_at", String.valueOf(detection.missingHeartbeat().expectedHeartbeatAt()));
            case DELAYED_START ->
                    values.put("expected_at", String.valueOf(detection.delayedStart().expectedStartBy()));
            case INSUFFICIENT_INSTANCES -> {
                values.put("detected", String.valueOf(detection.insufficientInstances().detectedConcurrency()));
                values.put("required", String.valueOf(detection.insufficientInstances().requiredConcurrency()));
            }
            case STATUS_CHANGE -> values.put("status", detection.statusChange().status().name());
        }

        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace("{" + entry.getKey() + "}", entry.getValue());
        }
        return result.replaceAll("\\{[a-z_]+}", "");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
