package watchtower.monitor.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.exception.RateLimitExceededException;
import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.AlertRecord;
import watchtower.monitor.model.AlertSendStatus;
import watchtower.monitor.model.AlertTarget;
import watchtower.monitor.model.AlertTargetLink;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.Severity;
import watchtower.monitor.model.StatusChangeDetails;
import watchtower.monitor.repository.AlertRecordRepository;
import watchtower.monitor.repository.AlertTargetRepository;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.SchedulableRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sends a detection to every alert target of its schedulable that wants it, through the rate
 * limiter, and records one {@link AlertRecord} per target.
 *
 * <p>A target is alerted when it is enabled and its link carries a severity for the detection's
 * condition. Resolving detections go to the same targets at {@link Severity#INFO} under the
 * grouping key of the detection they resolve.
 *
 * <p>A failure for one target never prevents delivery to the others.
 */
public class AlertDispatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatchCoordinator.class);

    private final SchedulableRepository schedulableRepository;
    private final AlertTargetRepository targetRepository;
    private final DetectionRepository detectionRepository;
    private final AlertRecordRepository recordRepository;
    private final NotificationRateLimiter rateLimiter;
    private final MonitorConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public AlertDispatchCoordinator(SchedulableRepository schedulableRepository,
            AlertTargetRepository targetRepository,
            DetectionRepository detectionRepository,
            AlertRecordRepository recordRepository,
            NotificationRateLimiter rateLimiter,
            MonitorConfig config,
            Clock clock) {
        this.schedulableRepository = schedulableRepository;
        this.targetRepository = targetRepository;
        this.detectionRepository = detectionRepository;
        this.recordRepository = recordRepository;
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Dispatch with the default summary of the detection's kind.
     */
    public List<AlertRecord> dispatch(Detection detection) {
        return dispatch(detection, SummaryTemplates.defaultTemplate(detection));
    }

    /**
     * Dispatch a detection to its schedulable's targets.
     *
     * @param detection       a new detection or a resolving detection
     * @param summaryTemplate template rendered by {@link SummaryTemplates#render}
     * @return one record per target that was attempted
     */
    public List<AlertRecord> dispatch(Detection detection, String summaryTemplate) {
        Optional<Schedulable> found = schedulableRepository.findById(detection.schedulableId());
        if (found.isEmpty()) {
            log.warn("Not dispatching detection {}: schedulable {} not found", detection.id(), detection.schedulableId());
            return List.of();
        }
        Schedulable schedulable = found.get();

        Detection subject = detection.isResolution()
                ? detectionRepository.findById(detection.resolvesId()).orElse(detection)
                : detection;
        AlertCondition condition = subject.alertCondition();
        if (condition == null) {
            return List.of();
        }

        String groupingKey = GroupingKeys.forDetection(subject);
        String summary = SummaryTemplates.render(summaryTemplate, schedulable, detection);
        ObjectNode details = detailsOf(detection);

        List<AlertRecord> records = new ArrayList<>();
        for (AlertTargetLink link : schedulable.alertTargets()) {
            Severity targetSeverity = link.severityFor(condition);
            if (targetSeverity == null) {
                continue;
            }

            Optional<AlertTarget> target = targetRepository.findById(link.targetId());
            if (target.isEmpty()) {
                log.warn("Alert target {} of {} not found", link.targetId(), schedulable.id());
                continue;
            }
            if (!target.get().enabled()) {
                log.debug("Alert target {} disabled, skipping detection {}", link.targetId(), detection.id());
                continue;
            }

            Severity severity = detection.isResolution() ? Severity.INFO : targetSeverity;
            AlertMessage message = new AlertMessage(detection.id(), detection.kind(), schedulable.kind(),
                    schedulable.id(), schedulable.name(), severity, summary, groupingKey,
                    detection.isResolution(), details);

            records.add(sendToTarget(target.get(), message));
        }

        log.info("Dispatched {} {} to {} target(s)", detection.kind(), detection.id(), records.size());
        return records;
    }

    private AlertRecord sendToTarget(AlertTarget target, AlertMessage message) {
        AlertRecord record = AlertRecord.builder()
                .detectionId(message.detectionId())
                .targetId(target.id())
                .severity(message.severity())
                .groupingKey(message.groupingKey())
                .createdAt(clock.instant())
                .sendStatus(AlertSendStatus.SENDING)
                .build();

        AlertRecord.Builder outcome = record.toBuilder();
        SendResult result = null;
        try {
            recordRepository.save(record);
            result = rateLimiter.sendIfNotRateLimited(target.id(), message);
            outcome.sendStatus(AlertSendStatus.SUCCEEDED);
        } catch (RateLimitExceededException e) {
            outcome.sendStatus(AlertSendStatus.RATE_LIMITED)
                    .rateLimitTierIndex(e.getTierIndex())
                    .errorMessage(truncate(e.getMessage()));
        } catch (Exception e) {
            log.warn("Failed to send detection {} to target {}: {}", message.detectionId(), target.id(), e.toString());
            outcome.sendStatus(AlertSendStatus.FAILED).errorMessage(truncate(e.toString()));
        }
        if (result != null) {
            outcome.sendResult(resultJson(result));
        }

        AlertRecord completed = outcome.completedAt(clock.instant()).build();
        try {
            recordRepository.updateOutcome(completed);
        } catch (StoreException e) {
            log.error("Failed to store outcome {} of alert {} for target {}", completed.sendStatus(),
                    completed.id(), target.id(), e);
        }
        return completed;
    }

    String truncate(String message) {
        if (message == null) {
            return null;
        }
        int max = config.errorMessageMaxLength();
        return message.length() <= max ? message : message.substring(0, max);
    }

    /**
     * Serialized send result, or its text form when it does not serialize.
     */
    String resultJson(SendResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize send result {}: {}", result, e.toString());
            return String.valueOf(result);
        }
    }

    private ObjectNode detailsOf(Detection detection) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("detectionId", detection.id());
        node.put("kind", detection.kind().name());
        node.put("detectedAt", detection.detectedAt().toString());
        if (detection.executionId() != null) {
            node.put("executionId", detection.executionId());
        }
        if (detection.resolvesId() != null) {
            node.put("resolves", detection.resolvesId());
        }

        switch (detection.kind()) {
            case MISSING_SCHEDULED_EXECUTION -> {
                node.put("schedule", detection.missingExecution().schedule());
                node.put("expectedExecutionAt", text(detection.missingExecution().expectedExecutionAt()));
                node.put("missingExecutionCount", detection.missingExecution().missingExecutionCount());
            }
            case DELAYED_START -> node.put("expectedStartBy", text(detection.delayedStart().expectedStartBy()));
            case MISSING_HEARTBEAT -> {
                node.put("lastHeartbeatAt", text(detection.missingHeartbeat().lastHeartbeatAt()));
                node.put("expectedHeartbeatAt", text(detection.missingHeartbeat().expectedHeartbeatAt()));
            }
            case INSUFFICIENT_INSTANCES -> {
                node.put("intervalStart", text(detection.insufficientInstances().intervalStart()));
                node.put("intervalEnd", text(detection.insufficientInstances().intervalEnd()));
                node.put("detectedConcurrency", detection.insufficientInstances().detectedConcurrency());
                node.put("requiredConcurrency", detection.insufficientInstances().requiredConcurrency());
            }
            case STATUS_CHANGE -> {
                StatusChangeDetails status = detection.statusChange();
                node.put("status", status.status().name());
                node.put("postponedUntil", text(status.postponedUntil()));
                node.put("triggeredAt", text(status.triggeredAt()));
                node.put("sameStatusCount", status.sameStatusCount());
            }
        }
        return node;
    }

    private static String text(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
