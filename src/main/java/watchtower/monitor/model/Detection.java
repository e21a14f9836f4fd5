package watchtower.monitor.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted assertion that something expected did not happen, or that an execution reached a
 * status worth reporting. The {@link #kind()} tag selects the shape of {@link #details()}.
 *
 * <p>A detection with {@link #resolvesId()} set is a resolving detection: it records the
 * observation that cleared an earlier one of the same kind.
 */
public final class Detection {
    private final String id;
    private final SchedulableKind schedulableKind;
    private final String schedulableId;
    private final String executionId;
    private final Severity severity;
    private final Instant detectedAt;
    private final Instant resolvedAt;
    private final String resolvedById;
    private final String resolvesId;
    private final DetectionDetails details;

    private Detection(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.schedulableKind = Objects.requireNonNull(builder.schedulableKind, "schedulableKind is required");
        this.schedulableId = Objects.requireNonNull(builder.schedulableId, "schedulableId is required");
        this.executionId = builder.executionId;
        this.severity = Objects.requireNonNull(builder.severity, "severity is required");
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt is required");
        this.resolvedAt = builder.resolvedAt;
        this.resolvedById = builder.resolvedById;
        this.resolvesId = builder.resolvesId;
        this.details = Objects.requireNonNull(builder.details, "details are required");
    }

    public String id() {
        return id;
    }

    public DetectionKind kind() {
        return details.kind();
    }

    public SchedulableKind schedulableKind() {
        return schedulableKind;
    }

    public String schedulableId() {
        return schedulableId;
    }

    public String executionId() {
        return executionId;
    }

    public Severity severity() {
        return severity;
    }

    public Instant detectedAt() {
        return detectedAt;
    }

    public Instant resolvedAt() {
        return resolvedAt;
    }

    public String resolvedById() {
        return resolvedById;
    }

    public String resolvesId() {
        return resolvesId;
    }

    public DetectionDetails details() {
        return details;
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public boolean isResolution() {
        return resolvesId != null;
    }

    public MissingExecutionDetails missingExecution() {
        return detailsAs(MissingExecutionDetails.class);
    }

    public InsufficientInstancesDetails insufficientInstances() {
        return detailsAs(InsufficientInstancesDetails.class);
    }

    public MissingHeartbeatDetails missingHeartbeat() {
        return detailsAs(MissingHeartbeatDetails.class);
    }

    public DelayedStartDetails delayedStart() {
        return detailsAs(DelayedStartDetails.class);
    }

    public StatusChangeDetails statusChange() {
        return detailsAs(StatusChangeDetails.class);
    }

    /**
     * Condition whose per-target severity decides who receives this detection.
     */
    public AlertCondition alertCondition() {
        return switch (kind()) {
            case MISSING_SCHEDULED_EXECUTION -> AlertCondition.MISSING_EXECUTION;
            case DELAYED_START -> AlertCondition.DELAYED_START;
            case MISSING_HEARTBEAT -> AlertCondition.MISSING_HEARTBEAT;
            case INSUFFICIENT_INSTANCES -> AlertCondition.INSUFFICIENT_INSTANCES;
            case STATUS_CHANGE -> AlertCondition.forStatus(statusChange().status());
        };
    }

    /**
     * New resolving detection for this one, carrying the observation that cleared it.
     * The details must be of the same kind.
     */
    public Detection resolution(DetectionDetails observed, Instant at) {
        if (observed.kind() != kind()) {
            throw new IllegalArgumentException("Cannot resolve " + kind() + " with " + observed.kind());
        }
        return new Builder()
                .schedulableKind(schedulableKind)
                .schedulableId(schedulableId)
                .executionId(executionId)
                .severity(Severity.INFO)
                .detectedAt(at)
                .resolvesId(id)
                .details(observed)
                .build();
    }

    private <T extends DetectionDetails> T detailsAs(Class<T> type) {
        if (!type.isInstance(details)) {
            throw new IllegalStateException("Detection " + id + " is " + kind() + ", not " + type.getSimpleName());
        }
        return type.cast(details);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .schedulableKind(schedulableKind)
                .schedulableId(schedulableId)
                .executionId(executionId)
                .severity(severity)
                .detectedAt(detectedAt)
                .resolvedAt(resolvedAt)
                .resolvedById(resolvedById)
                .resolvesId(resolvesId)
                .details(details);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private SchedulableKind schedulableKind;
        private String schedulableId;
        private String executionId;
        private Severity severity;
        private Instant detectedAt;
        private Instant resolvedAt;
        private String resolvedById;
        private String resolvesId;
        private DetectionDetails details;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /** Copies kind and id of the owning schedulable. */
        public Builder schedulable(Schedulable schedulable) {
            this.schedulableKind = schedulable.kind();
            this.schedulableId = schedulable.id();
            return this;
        }

        public Builder schedulableKind(SchedulableKind schedulableKind) {
            this.schedulableKind = schedulableKind;
            return this;
        }

        public Builder schedulableId(String schedulableId) {
            this.schedulableId = schedulableId;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder resolvedById(String resolvedById) {
            this.resolvedById = resolvedById;
            return this;
        }

        public Builder resolvesId(String resolvesId) {
            this.resolvesId = resolvesId;
            return this;
        }

        public Builder details(DetectionDetails details) {
            this.details = details;
            return this;
        }

        public Detection build() {
            return new Detection(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detection detection))
            return false;
        return id.equals(detection.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Detection{id='" + id + "', kind=" + kind() + ", schedulableId='" + schedulableId
                + "', resolved=" + isResolved() + "}";
    }
}
