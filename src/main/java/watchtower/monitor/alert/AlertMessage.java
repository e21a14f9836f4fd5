package watchtower.monitor.alert;

import com.fasterxml.jackson.databind.node.ObjectNode;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.model.Severity;

/**
 * Transport-neutral alert handed to an {@link AlertSender}.
 *
 * @param resolution true when the message reports that an earlier condition cleared
 * @param details    kind-specific fields of the detection
 */
public record AlertMessage(
        String detectionId,
        DetectionKind kind,
        SchedulableKind schedulableKind,
        String schedulableId,
        String schedulableName,
        Severity severity,
        String summary,
        String groupingKey,
        boolean resolution,
        ObjectNode details) {
}
