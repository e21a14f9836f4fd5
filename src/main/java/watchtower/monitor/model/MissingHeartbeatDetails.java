package watchtower.monitor.model;

import java.time.Instant;

/**
 * @param lastHeartbeatAt     last heartbeat seen, may be null if none was ever sent
 * @param expectedHeartbeatAt when the next heartbeat was due
 */
public record MissingHeartbeatDetails(Instant lastHeartbeatAt, Instant expectedHeartbeatAt)
        implements DetectionDetails {

    @Override
    public DetectionKind kind() {
        return DetectionKind.MISSING_HEARTBEAT;
    }
}
