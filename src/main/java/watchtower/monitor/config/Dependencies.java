package watchtower.monitor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.alert.AlertDispatchCoordinator;
import watchtower.monitor.alert.AlertSenderRegistry;
import watchtower.monitor.alert.LoggingAlertSender;
import watchtower.monitor.alert.NotificationRateLimiter;
import watchtower.monitor.repository.AlertRecordRepository;
import watchtower.monitor.repository.AlertTargetRepository;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.ExecutionRepository;
import watchtower.monitor.repository.SchedulableRepository;
import watchtower.monitor.schedule.ScheduleExpressionEvaluator;
import watchtower.monitor.scheduler.MonitorScheduler;
import watchtower.monitor.service.EventPostponementCoordinator;
import watchtower.monitor.service.ExecutionHealthChecker;
import watchtower.monitor.service.ExecutionProgressHandler;
import watchtower.monitor.service.PostponedEventChecker;
import watchtower.monitor.service.ScheduleComplianceChecker;
import watchtower.monitor.service.ServiceConcurrencyMonitor;
import watchtower.monitor.service.TaskScheduleAdapter;
import watchtower.monitor.service.WorkflowScheduleAdapter;
import watchtower.monitor.store.Database;
import watchtower.monitor.store.JdbcAlertRecordRepository;
import watchtower.monitor.store.JdbcAlertTargetRepository;
import watchtower.monitor.store.JdbcDetectionRepository;
import watchtower.monitor.store.JdbcExecutionRepository;
import watchtower.monitor.store.JdbcSchedulableRepository;

import java.time.Clock;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires the store, the alerting chain and every checker.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(MonitorConfig.fromEnv());
 * deps.startScheduler(); // start the polling loop
 * deps.postponementCoordinator().handleStatusChange(execution); // from the execution write path
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final MonitorConfig config;
    private final Clock clock;
    private final Database database;

    private final SchedulableRepository schedulableRepository;
    private final ExecutionRepository executionRepository;
    private final DetectionRepository detectionRepository;
    private final AlertTargetRepository alertTargetRepository;
    private final AlertRecordRepository alertRecordRepository;

    private final AlertSenderRegistry senderRegistry;
    private final NotificationRateLimiter rateLimiter;
    private final AlertDispatchCoordinator dispatcher;

    private final ScheduleComplianceChecker scheduleComplianceChecker;
    private final EventPostponementCoordinator postponementCoordinator;
    private final ExecutionHealthChecker executionHealthChecker;
    private final ServiceConcurrencyMonitor serviceConcurrencyMonitor;
    private final PostponedEventChecker postponedEventChecker;
    private final ExecutionProgressHandler executionProgressHandler;

    // Scheduler (lazy-initialized)
    private MonitorScheduler scheduler;

    private Dependencies(MonitorConfig config, Clock clock, AlertSenderRegistry senderRegistry) {
        this.config = config;
        this.clock = clock;
        this.senderRegistry = senderRegistry;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.schedulableRepository = new JdbcSchedulableRepository(database);
        this.executionRepository = new JdbcExecutionRepository(database);
        this.detectionRepository = new JdbcDetectionRepository(database);
        this.alertTargetRepository = new JdbcAlertTargetRepository(database);
        this.alertRecordRepository = new JdbcAlertRecordRepository(database);

        // Alerting
        this.rateLimiter = new NotificationRateLimiter(database, alertTargetRepository, senderRegistry, clock);
        this.dispatcher = new AlertDispatchCoordinator(schedulableRepository, alertTargetRepository,
                detectionRepository, alertRecordRepository, rateLimiter, config, clock);

        // Checkers
        this.scheduleComplianceChecker = new ScheduleComplianceChecker(database, schedulableRepository,
                detectionRepository,
                List.of(new TaskScheduleAdapter(schedulableRepository, executionRepository, detectionRepository),
                        new WorkflowScheduleAdapter(schedulableRepository, executionRepository, detectionRepository)),
                new ScheduleExpressionEvaluator(), dispatcher, config, clock);
        this.postponementCoordinator = new EventPostponementCoordinator(database, schedulableRepository,
                executionRepository, detectionRepository, dispatcher, clock);
        this.executionHealthChecker = new ExecutionHealthChecker(database, schedulableRepository,
                executionRepository, detectionRepository, postponementCoordinator, dispatcher, config, clock);
        this.serviceConcurrencyMonitor = new ServiceConcurrencyMonitor(database, schedulableRepository,
                executionRepository, detectionRepository, dispatcher, config, clock);
        this.postponedEventChecker = new PostponedEventChecker(database, schedulableRepository,
                detectionRepository, dispatcher, clock);
        this.executionProgressHandler = new ExecutionProgressHandler(database, schedulableRepository,
                executionRepository, detectionRepository, dispatcher, config, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, the UTC system clock and the logging transport.
     */
    public static Dependencies create(MonitorConfig config) {
        return create(config, Clock.systemUTC(),
                new AlertSenderRegistry().register(LoggingAlertSender.TRANSPORT, new LoggingAlertSender()));
    }

    /**
     * Create dependencies with an explicit clock and delivery transports.
     */
    public static Dependencies create(MonitorConfig config, Clock clock, AlertSenderRegistry senderRegistry) {
        return new Dependencies(config, clock, senderRegistry);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(MonitorConfig.fromEnv());
    }

    // Getters
    public MonitorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public SchedulableRepository schedulableRepository() {
        return schedulableRepository;
    }

    public ExecutionRepository executionRepository() {
        return executionRepository;
    }

    public DetectionRepository detectionRepository() {
        return detectionRepository;
    }

    public AlertTargetRepository alertTargetRepository() {
        return alertTargetRepository;
    }

    public AlertRecordRepository alertRecordRepository() {
        return alertRecordRepository;
    }

    public AlertSenderRegistry senderRegistry() {
        return senderRegistry;
    }

    public NotificationRateLimiter rateLimiter() {
        return rateLimiter;
    }

    public AlertDispatchCoordinator dispatcher() {
        return dispatcher;
    }

    public ScheduleComplianceChecker scheduleComplianceChecker() {
        return scheduleComplianceChecker;
    }

    public EventPostponementCoordinator postponementCoordinator() {
        return postponementCoordinator;
    }

    public ExecutionHealthChecker executionHealthChecker() {
        return executionHealthChecker;
    }

    public ServiceConcurrencyMonitor serviceConcurrencyMonitor() {
        return serviceConcurrencyMonitor;
    }

    public PostponedEventChecker postponedEventChecker() {
        return postponedEventChecker;
    }

    public ExecutionProgressHandler executionProgressHandler() {
        return executionProgressHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public MonitorScheduler scheduler() {
        if (scheduler == null) {
            scheduler = new MonitorScheduler(config)
                    .register("schedule-compliance", scheduleComplianceChecker)
                    .register("execution-health", executionHealthChecker)
                    .register("service-concurrency", serviceConcurrencyMonitor)
                    .register("postponed-events", postponedEventChecker);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
