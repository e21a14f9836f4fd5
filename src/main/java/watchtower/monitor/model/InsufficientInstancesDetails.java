package watchtower.monitor.model;

import java.time.Instant;

/**
 * Live instance count of a service task over a trailing window.
 */
public record InsufficientInstancesDetails(Instant intervalStart, Instant intervalEnd,
        int detectedConcurrency, int requiredConcurrency) implements DetectionDetails {

    @Override
    public DetectionKind kind() {
        return DetectionKind.INSUFFICIENT_INSTANCES;
    }
}
