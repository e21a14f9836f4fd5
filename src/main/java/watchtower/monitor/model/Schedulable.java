package watchtower.monitor.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a Task or Workflow as seen by the monitors.
 * Authoring and persistence of these settings belongs to the owning application.
 */
public final class Schedulable {
    private final String id;
    private final SchedulableKind kind;
    private final String name;
    private final String schedule; // cron(...) or rate(...), blank = unscheduled
    private final Instant scheduleUpdatedAt;
    private final boolean enabled;
    private final Instant createdAt;
    private final Integer scheduledInstanceCount;
    private final Integer maxConcurrency;
    private final Integer maxAgeSeconds;

    // Service tasks
    private final Integer minServiceInstanceCount;
    private final Instant serviceUpdatedAt; // last redeploy
    private final Integer serviceStartupGraceSeconds;

    // Execution health thresholds
    private final Integer manualStartAlertSeconds;
    private final Integer manualStartAbandonSeconds;
    private final Integer heartbeatAlertSeconds;
    private final Integer heartbeatAbandonSeconds;

    private final PostponementPolicy failurePostponement;
    private final PostponementPolicy timeoutPostponement;

    private final Map<AlertCondition, Severity> eventSeverities;
    private final List<AlertTargetLink> alertTargets;

    private Schedulable(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.name = builder.name;
        this.schedule = builder.schedule;
        this.scheduleUpdatedAt = builder.scheduleUpdatedAt;
        this.enabled = builder.enabled;
        this.createdAt = builder.createdAt;
        this.scheduledInstanceCount = builder.scheduledInstanceCount;
        this.maxConcurrency = builder.maxConcurrency;
        this.maxAgeSeconds = builder.maxAgeSeconds;
        this.minServiceInstanceCount = builder.minServiceInstanceCount;
        this.serviceUpdatedAt = builder.serviceUpdatedAt;
        this.serviceStartupGraceSeconds = builder.serviceStartupGraceSeconds;
        this.manualStartAlertSeconds = builder.manualStartAlertSeconds;
        this.manualStartAbandonSeconds = builder.manualStartAbandonSeconds;
        this.heartbeatAlertSeconds = builder.heartbeatAlertSeconds;
        this.heartbeatAbandonSeconds = builder.heartbeatAbandonSeconds;
        this.failurePostponement = builder.failurePostponement != null
                ? builder.failurePostponement
                : PostponementPolicy.NONE;
        this.timeoutPostponement = builder.timeoutPostponement != null
                ? builder.timeoutPostponement
                : PostponementPolicy.NONE;
        this.eventSeverities = builder.eventSeverities.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(builder.eventSeverities));
        this.alertTargets = List.copyOf(builder.alertTargets);
    }

    public String id() {
        return id;
    }

    public SchedulableKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public String schedule() {
        return schedule;
    }

    public Instant scheduleUpdatedAt() {
        return scheduleUpdatedAt;
    }

    public boolean enabled() {
        return enabled;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Integer scheduledInstanceCount() {
        return scheduledInstanceCount;
    }

    public Integer maxConcurrency() {
        return maxConcurrency;
    }

    public Integer maxAgeSeconds() {
        return maxAgeSeconds;
    }

    public Integer minServiceInstanceCount() {
        return minServiceInstanceCount;
    }

    public Instant serviceUpdatedAt() {
        return serviceUpdatedAt;
    }

    public Integer serviceStartupGraceSeconds() {
        return serviceStartupGraceSeconds;
    }

    public Integer manualStartAlertSeconds() {
        return manualStartAlertSeconds;
    }

    public Integer manualStartAbandonSeconds() {
        return manualStartAbandonSeconds;
    }

    public Integer heartbeatAlertSeconds() {
        return heartbeatAlertSeconds;
    }

    public Integer heartbeatAbandonSeconds() {
        return heartbeatAbandonSeconds;
    }

    public PostponementPolicy failurePostponement() {
        return failurePostponement;
    }

    public PostponementPolicy timeoutPostponement() {
        return timeoutPostponement;
    }

    public Map<AlertCondition, Severity> eventSeverities() {
        return eventSeverities;
    }

    public List<AlertTargetLink> alertTargets() {
        return alertTargets;
    }

    /** Has a non-blank schedule */
    public boolean isScheduled() {
        return schedule != null && !schedule.isBlank();
    }

    /** Configured as a long-running service */
    public boolean isService() {
        return minServiceInstanceCount != null;
    }

    /** Instances one scheduled occurrence must produce, at least 1 */
    public int requiredInstanceCount() {
        return scheduledInstanceCount == null ? 1 : Math.max(1, scheduledInstanceCount);
    }

    /** Configured event severity, or null if none */
    public Severity eventSeverity(AlertCondition condition) {
        return eventSeverities.get(condition);
    }

    /** Configured event severity, falling back to the condition's default */
    public Severity detectionSeverity(AlertCondition condition) {
        Severity configured = eventSeverities.get(condition);
        return configured != null ? configured : condition.defaultSeverity();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .name(name)
                .schedule(schedule)
                .scheduleUpdatedAt(scheduleUpdatedAt)
                .enabled(enabled)
                .createdAt(createdAt)
                .scheduledInstanceCount(scheduledInstanceCount)
                .maxConcurrency(maxConcurrency)
                .maxAgeSeconds(maxAgeSeconds)
                .minServiceInstanceCount(minServiceInstanceCount)
                .serviceUpdatedAt(serviceUpdatedAt)
                .serviceStartupGraceSeconds(serviceStartupGraceSeconds)
                .manualStartAlertSeconds(manualStartAlertSeconds)
                .manualStartAbandonSeconds(manualStartAbandonSeconds)
                .heartbeatAlertSeconds(heartbeatAlertSeconds)
                .heartbeatAbandonSeconds(heartbeatAbandonSeconds)
                .failurePostponement(failurePostponement)
                .timeoutPostponement(timeoutPostponement)
                .eventSeverities(eventSeverities)
                .alertTargets(alertTargets);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private SchedulableKind kind = SchedulableKind.TASK;
        private String name;
        private String schedule;
        private Instant scheduleUpdatedAt;
        private boolean enabled = true;
        private Instant createdAt;
        private Integer scheduledInstanceCount;
        private Integer maxConcurrency;
        private Integer maxAgeSeconds;
        private Integer minServiceInstanceCount;
        private Instant serviceUpdatedAt;
        private Integer serviceStartupGraceSeconds;
        private Integer manualStartAlertSeconds;
        private Integer manualStartAbandonSeconds;
        private Integer heartbeatAlertSeconds;
        private Integer heartbeatAbandonSeconds;
        private PostponementPolicy failurePostponement;
        private PostponementPolicy timeoutPostponement;
        private final Map<AlertCondition, Severity> eventSeverities = new EnumMap<>(AlertCondition.class);
        private List<AlertTargetLink> alertTargets = List.of();

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

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder scheduleUpdatedAt(Instant scheduleUpdatedAt) {
            this.scheduleUpdatedAt = scheduleUpdatedAt;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder scheduledInstanceCount(Integer scheduledInstanceCount) {
            this.scheduledInstanceCount = scheduledInstanceCount;
            return this;
        }

        public Builder maxConcurrency(Integer maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder maxAgeSeconds(Integer maxAgeSeconds) {
            this.maxAgeSeconds = maxAgeSeconds;
            return this;
        }

        public Builder minServiceInstanceCount(Integer minServiceInstanceCount) {
            this.minServiceInstanceCount = minServiceInstanceCount;
            return this;
        }

        public Builder serviceUpdatedAt(Instant serviceUpdatedAt) {
            this.serviceUpdatedAt = serviceUpdatedAt;
            return this;
        }

        public Builder serviceStartupGraceSeconds(Integer serviceStartupGraceSeconds) {
            this.serviceStartupGraceSeconds = serviceStartupGraceSeconds;
            return this;
        }

        public Builder manualStartAlertSeconds(Integer manualStartAlertSeconds) {
            this.manualStartAlertSeconds = manualStartAlertSeconds;
            return this;
        }

        public Builder manualStartAbandonSeconds(Integer manualStartAbandonSeconds) {
            this.manualStartAbandonSeconds = manualStartAbandonSeconds;
            return this;
        }

        public Builder heartbeatAlertSeconds(Integer heartbeatAlertSeconds) {
            this.heartbeatAlertSeconds = heartbeatAlertSeconds;
            return this;
        }

        public Builder heartbeatAbandonSeconds(Integer heartbeatAbandonSeconds) {
            this.heartbeatAbandonSeconds = heartbeatAbandonSeconds;
            return this;
        }

        public Builder failurePostponement(PostponementPolicy failurePostponement) {
            this.failurePostponement = failurePostponement;
            return this;
        }

        public Builder timeoutPostponement(PostponementPolicy timeoutPostponement) {
            this.timeoutPostponement = timeoutPostponement;
            return this;
        }

        public Builder eventSeverity(AlertCondition condition, Severity severity) {
            if (severity == null) {
                this.eventSeverities.remove(condition);
            } else {
                this.eventSeverities.put(condition, severity);
            }
            return this;
        }

        public Builder eventSeverities(Map<AlertCondition, Severity> severities) {
            this.eventSeverities.clear();
            this.eventSeverities.putAll(severities);
            return this;
        }

        public Builder alertTargets(List<AlertTargetLink> alertTargets) {
            this.alertTargets = alertTargets;
            return this;
        }

        public Schedulable build() {
            return new Schedulable(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schedulable that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Schedulable{id='" + id + "', kind=" + kind + ", schedule='" + schedule + "', enabled=" + enabled + "}";
    }
}
