package watchtower.monitor.service;

import watchtower.monitor.alert.SummaryTemplates;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.MissingExecutionDetails;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.ExecutionRepository;
import watchtower.monitor.repository.SchedulableRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Schedule adapter for tasks. A task execution that was created but has not started yet
 * still occupies a concurrency slot.
 */
public class TaskScheduleAdapter implements SchedulableAdapter {

    private final SchedulableRepository schedulableRepository;
    private final ExecutionRepository executionRepository;
    private final DetectionRepository detectionRepository;

    public TaskScheduleAdapter(SchedulableRepository schedulableRepository,
            ExecutionRepository executionRepository,
            DetectionRepository detectionRepository) {
        this.schedulableRepository = schedulableRepository;
        this.executionRepository = executionRepository;
        this.detectionRepository = detectionRepository;
    }

    @Override
    public SchedulableKind kind() {
        return SchedulableKind.TASK;
    }

    @Override
    public List<Schedulable> enumerateCheckable() {
        return schedulableRepository.findEnabledScheduled(SchedulableKind.TASK);
    }

    @Override
    public Optional<Detection> existingDetectionFor(Schedulable task, Instant expectedAt) {
        return detectionRepository.findUnresolvedMissingExecution(task.id(), expectedAt);
    }

    @Override
    public Optional<Detection> latestDetectionFor(Schedulable task) {
        return detectionRepository.findLatestMissingExecution(task.id());
    }

    @Override
    public int executionsStartedBetween(Schedulable task, Instant from, Instant to) {
        return executionRepository.countStartedBetween(task.id(), from, to);
    }

    @Override
    public int concurrencyAt(Schedulable task, Instant at) {
        return executionRepository.countConcurrentAt(task.id(), at, true);
    }

    @Override
    public Detection makeDetection(Schedulable task, Instant expectedAt, int missingCount, Instant detectedAt) {
        return Detection.builder()
                .schedulable(task)
                .severity(task.detectionSeverity(AlertCondition.MISSING_EXECUTION))
                .detectedAt(detectedAt)
                .details(new MissingExecutionDetails(task.schedule(), expectedAt, missingCount))
                .build();
    }

    @Override
    public String summaryTemplate() {
        return SummaryTemplates.MISSING_TASK;
    }
}
