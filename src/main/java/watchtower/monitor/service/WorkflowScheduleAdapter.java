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
 * Schedule adapter for workflows. Only started workflow runs count toward concurrency.
 */
public class WorkflowScheduleAdapter implements SchedulableAdapter {

    private final SchedulableRepository schedulableRepository;
    private final ExecutionRepository executionRepository;
    private final DetectionRepository detectionRepository;

    public WorkflowScheduleAdapter(SchedulableRepository schedulableRepository,
            ExecutionRepository executionRepository,
            DetectionRepository detectionRepository) {
        this.schedulableRepository = schedulableRepository;
        this.executionRepository = executionRepository;
        this.detectionRepository = detectionRepository;
    }

    @Override
    public SchedulableKind kind() {
        return SchedulableKind.WORKFLOW;
    }

    @Override
    public List<Schedulable> enumerateCheckable() {
        return schedulableRepository.findEnabledScheduled(SchedulableKind.WORKFLOW);
    }

    @Override
    public Optional<Detection> existingDetectionFor(Schedulable workflow, Instant expectedAt) {
        return detectionRepository.findUnresolvedMissingExecution(workflow.id(), expectedAt);
    }

    @Override
    public Optional<Detection> latestDetectionFor(Schedulable workflow) {
        return detectionRepository.findLatestMissingExecution(workflow.id());
    }

    @Override
    public int executionsStartedBetween(Schedulable workflow, Instant from, Instant to) {
        return executionRepository.countStartedBetween(workflow.id(), from, to);
    }

    @Override
    public int concurrencyAt(Schedulable workflow, Instant at) {
        return executionRepository.countConcurrentAt(workflow.id(), at, false);
    }

    @Override
    public Detection makeDetection(Schedulable workflow, Instant expectedAt, int missingCount, Instant detectedAt) {
        return Detection.builder()
                .schedulable(workflow)
                .severity(workflow.detectionSeverity(AlertCondition.MISSING_EXECUTION))
                .detectedAt(detectedAt)
                .details(new MissingExecutionDetails(workflow.schedule(), expectedAt, missingCount))
                .build();
    }

    @Override
    public String summaryTemplate() {
        return SummaryTemplates.MISSING_WORKFLOW;
    }
}
