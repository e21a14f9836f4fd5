package watchtower.monitor.model;

import java.time.Instant;

/**
 * A manually started execution that has not started running.
 *
 * @param expectedStartBy when the start-alert threshold elapsed
 */
public record DelayedStartDetails(Instant expectedStartBy) implements DetectionDetails {

    @Override
    public DetectionKind kind() {
        return DetectionKind.DELAYED_START;
    }
}
