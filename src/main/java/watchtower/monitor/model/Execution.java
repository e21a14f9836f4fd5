package watchtower.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one run of a Task or Workflow.
 */
public final class Execution {
    private final String id;
    private final SchedulableKind kind;
    private final String schedulableId;
    private final ExecutionStatus status;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt; // set by the runner
    private final Instant markedDoneAt; // set by the health checker
    private final Instant lastHeartbeatAt;
    private final Integer heartbeatIntervalSeconds;
    private final StopReason stopReason;
    private final boolean skipEventGeneration;

    private Execution(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.schedulableId = Objects.requireNonNull(builder.schedulableId, "schedulableId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.markedDoneAt = builder.markedDoneAt;
        this.lastHeartbeatAt = builder.lastHeartbeatAt;
        this.heartbeatIntervalSeconds = builder.heartbeatIntervalSeconds;
        this.stopReason = builder.stopReason;
        this.skipEventGeneration = builder.skipEventGeneration;
    }

    public String id() {
        return id;
    }

    public SchedulableKind kind() {
        return kind;
    }

    public String schedulableId() {
        return schedulableId;
    }

    public ExecutionStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Instant markedDoneAt() {
        return markedDoneAt;
    }

    public Instant lastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public Integer heartbeatIntervalSeconds() {
        return heartbeatIntervalSeconds;
    }

    public StopReason stopReason() {
        return stopReason;
    }

    public boolean skipEventGeneration() {
        return skipEventGeneration;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .schedulableId(schedulableId)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .markedDoneAt(markedDoneAt)
                .lastHeartbeatAt(lastHeartbeatAt)
                .heartbeatIntervalSeconds(heartbeatIntervalSeconds)
                .stopReason(stopReason)
                .skipEventGeneration(skipEventGeneration);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private SchedulableKind kind = SchedulableKind.TASK;
        private String schedulableId;
        private ExecutionStatus status;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private Instant markedDoneAt;
        private Instant lastHeartbeatAt;
        private Integer heartbeatIntervalSeconds;
        private StopReason stopReason;
        private boolean skipEventGeneration;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(SchedulableKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder schedulableId(String schedulableId) {
            this.schedulableId = schedulableId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder markedDoneAt(Instant markedDoneAt) {
            this.markedDoneAt = markedDoneAt;
            return this;
        }

        public Builder lastHeartbeatAt(Instant lastHeartbeatAt) {
            this.lastHeartbeatAt = lastHeartbeatAt;
            return this;
        }

        public Builder heartbeatIntervalSeconds(Integer heartbeatIntervalSeconds) {
            this.heartbeatIntervalSeconds = heartbeatIntervalSeconds;
            return this;
        }

        public Builder stopReason(StopReason stopReason) {
            this.stopReason = stopReason;
            return this;
        }

        public Builder skipEventGeneration(boolean skipEventGeneration) {
            this.skipEventGeneration = skipEventGeneration;
            return this;
        }

        public Execution build() {
            return new Execution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Execution execution))
            return false;
        return id.equals(execution.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Execution{id='" + id + "', schedulableId='" + schedulableId + "', status=" + status + "}";
    }
}
