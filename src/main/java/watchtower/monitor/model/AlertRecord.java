package watchtower.monitor.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One attempted notification of one detection to one alert target.
 */
public final class AlertRecord {
    private final String id;
    private final String detectionId;
    private final String targetId;
    private final Severity severity;
    private final String groupingKey;
    private final Instant createdAt;
    private final AlertSendStatus sendStatus;
    private final String sendResult; // JSON
    private final String errorMessage;
    private final Integer rateLimitTierIndex;
    private final Instant completedAt;

    private AlertRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.detectionId = Objects.requireNonNull(builder.detectionId, "detectionId is required");
        this.targetId = Objects.requireNonNull(builder.targetId, "targetId is required");
        this.severity = builder.severity;
        this.groupingKey = builder.groupingKey;
        this.createdAt = builder.createdAt;
        this.sendStatus = Objects.requireNonNull(builder.sendStatus, "sendStatus is required");
        this.sendResult = builder.sendResult;
        this.errorMessage = builder.errorMessage;
        this.rateLimitTierIndex = builder.rateLimitTierIndex;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String detectionId() {
        return detectionId;
    }

    public String targetId() {
        return targetId;
    }

    public Severity severity() {
        return severity;
    }

    public String groupingKey() {
        return groupingKey;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public AlertSendStatus sendStatus() {
        return sendStatus;
    }

    public String sendResult() {
        return sendResult;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Integer rateLimitTierIndex() {
        return rateLimitTierIndex;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .detectionId(detectionId)
                .targetId(targetId)
                .severity(severity)
                .groupingKey(groupingKey)
                .createdAt(createdAt)
                .sendStatus(sendStatus)
                .sendResult(sendResult)
                .errorMessage(errorMessage)
                .rateLimitTierIndex(rateLimitTierIndex)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String detectionId;
        private String targetId;
        private Severity severity;
        private String groupingKey;
        private Instant createdAt;
        private AlertSendStatus sendStatus = AlertSendStatus.SENDING;
        private String sendResult;
        private String errorMessage;
        private Integer rateLimitTierIndex;
        private Instant completedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder detectionId(String detectionId) {
            this.detectionId = detectionId;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder groupingKey(String groupingKey) {
            this.groupingKey = groupingKey;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder sendStatus(AlertSendStatus sendStatus) {
            this.sendStatus = sendStatus;
            return this;
        }

        public Builder sendResult(String sendResult) {
            this.sendResult = sendResult;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder rateLimitTierIndex(Integer rateLimitTierIndex) {
            this.rateLimitTierIndex = rateLimitTierIndex;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public AlertRecord build() {
            return new AlertRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRecord that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
