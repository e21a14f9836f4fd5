package watchtower.monitor.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.config.MonitorConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polling loop that runs every registered checker once per poll interval:
 * - ScheduleComplianceChecker: missing scheduled executions
 * - ExecutionHealthChecker: late starts, timeouts, stuck stops, missed heartbeats
 * - ServiceConcurrencyMonitor: services below their minimum instance count
 * - PostponedEventChecker: postponed events whose window elapsed
 *
 * Uses a single-threaded executor, so checkers never overlap each other.
 */
public class MonitorScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<String, Runnable> checkers = new LinkedHashMap<>();
    private final MonitorConfig config;

    private volatile boolean running = false;

    public MonitorScheduler(MonitorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "watchtower-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.config = config;
    }

    /**
     * Register a checker. Must be called before {@link #start()}.
     *
     * @param name    name used in logs
     * @param checker one polling pass
     */
    public MonitorScheduler register(String name, Runnable checker) {
        if (running) {
            throw new IllegalStateException("Scheduler already started");
        }
        checkers.put(name, checker);
        return this;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.pollInterval().toMillis();
        for (Map.Entry<String, Runnable> entry : checkers.entrySet()) {
            executor.scheduleAtFixedRate(
                    wrapRunnable(entry.getKey(), entry.getValue()),
                    0,
                    intervalMs,
                    TimeUnit.MILLISECONDS);
            log.info("{} scheduled every {}ms", entry.getKey(), intervalMs);
        }

        log.info("Scheduler started with {} checker(s)", checkers.size());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run every checker once on the calling thread, in registration order.
     */
    public void runOnce() {
        checkers.forEach((name, checker) -> wrapRunnable(name, checker).run());
    }

    /**
     * Wrap a runnable with error handling so a failure never cancels later runs.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
