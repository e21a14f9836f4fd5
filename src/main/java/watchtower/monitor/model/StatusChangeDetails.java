package watchtower.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal status of an execution, with its postponement state.
 *
 * <p>States: postponed ({@code postponedUntil} set, nothing else), triggered
 * ({@code triggeredAt} set) or resolved (owning detection's {@code resolvedAt} set). Triggered
 * and resolved are exclusive.
 *
 * @param sameStatusCount current streak of same-track failures while postponed, including the first
 * @param successCount    current streak of successes while postponed
 */
public record StatusChangeDetails(ExecutionStatus status, Instant postponedUntil, Instant triggeredAt,
        int sameStatusCount, int successCount) implements DetectionDetails {

    public StatusChangeDetails {
        Objects.requireNonNull(status, "status is required");
    }

    @Override
    public DetectionKind kind() {
        return DetectionKind.STATUS_CHANGE;
    }

    public boolean isTriggered() {
        return triggeredAt != null;
    }

    public StatusChangeDetails triggered(Instant at) {
        return new StatusChangeDetails(status, postponedUntil, at, sameStatusCount, successCount);
    }

    public StatusChangeDetails withSameStatusCount(int count) {
        return new StatusChangeDetails(status, postponedUntil, triggeredAt, count, successCount);
    }

    public StatusChangeDetails withSuccessCount(int count) {
        return new StatusChangeDetails(status, postponedUntil, triggeredAt, sameStatusCount, count);
    }
}
