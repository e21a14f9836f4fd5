package watchtower.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.alert.AlertDispatchCoordinator;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.StatusChangeDetails;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.SchedulableRepository;
import watchtower.monitor.store.Database;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Triggers postponed status-change events whose window elapsed without them being resolved or
 * triggered early. Events of a disabled schedulable stay postponed.
 */
public class PostponedEventChecker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PostponedEventChecker.class);

    private final Database db;
    private final SchedulableRepository schedulableRepository;
    private final DetectionRepository detectionRepository;
    private final AlertDispatchCoordinator dispatcher;
    private final Clock clock;

    public PostponedEventChecker(Database db,
            SchedulableRepository schedulableRepository,
            DetectionRepository detectionRepository,
            AlertDispatchCoordinator dispatcher,
            Clock clock) {
        this.db = db;
        this.schedulableRepository = schedulableRepository;
        this.detectionRepository = detectionRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            checkAll();
        } catch (Exception e) {
            log.error("Postponed event check error", e);
        }
    }

    public int checkAll() {
        return checkAll(clock.instant());
    }

    /**
     * @return number of events triggered
     */
    public int checkAll(Instant asOf) {
        List<Detection> due = detectionRepository.findDuePostponed(asOf);
        int triggered = 0;
        for (Detection detection : due) {
            try {
                if (trigger(detection, asOf).isPresent()) {
                    triggered++;
                }
            } catch (Exception e) {
                log.error("Failed to trigger postponed event {}", detection.id(), e);
            }
        }
        return triggered;
    }

    Optional<Detection> trigger(Detection detection, Instant asOf) {
        Optional<Detection> triggered = db.inTransaction(() -> {
            // the coordinator updates postponed events under the same lock
            Schedulable schedulable = schedulableRepository.lockForUpdate(detection.schedulableId()).orElse(null);
            if (schedulable == null || !schedulable.enabled()) {
                log.debug("Postponed event {} left untriggered, schedulable {} missing or disabled",
                        detection.id(), detection.schedulableId());
                return Optional.<Detection>empty();
            }
            Detection current = detectionRepository.findById(detection.id()).orElse(null);
            if (current == null || current.isResolved()) {
                return Optional.<Detection>empty();
            }
            StatusChangeDetails details = current.statusChange();
            if (details.isTriggered() || details.postponedUntil() == null || details.postponedUntil().isAfter(asOf)) {
                return Optional.<Detection>empty();
            }

            StatusChangeDetails updated = details.triggered(asOf);
            detectionRepository.updateStatusChange(current.id(), updated);
            log.info("Postponed {} event {} triggered, window ended {}", details.status(), current.id(),
                    details.postponedUntil());
            return Optional.of(current.toBuilder().details(updated).build());
        });

        triggered.ifPresent(dispatcher::dispatch);
        return triggered;
    }
}
