package watchtower.monitor.scheduler;

import org.junit.jupiter.api.Test;
import watchtower.monitor.config.MonitorConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MonitorSchedulerTest {

    @Test
    void runOnceKeepsGoingAfterAFailingChecker() {
        List<String> ran = new ArrayList<>();
        MonitorScheduler scheduler = new MonitorScheduler(MonitorConfig.defaults())
                .register("first", () -> ran.add("first"))
                .register("broken", () -> {
                    throw new IllegalStateException("boom");
                })
                .register("last", () -> ran.add("last"));

        scheduler.runOnce();

        assertEquals(List.of("first", "last"), ran);
        scheduler.close();
    }

    @Test
    void startRunsCheckersUntilStopped() throws Exception {
        CountDownLatch runs = new CountDownLatch(3);
        MonitorScheduler scheduler = new MonitorScheduler(
                MonitorConfig.defaults().withPollInterval(Duration.ofMillis(20)));
        scheduler.register("counter", runs::countDown);

        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertTrue(runs.await(5, TimeUnit.SECONDS));

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void registerAfterStartIsRejected() {
        MonitorScheduler scheduler = new MonitorScheduler(MonitorConfig.defaults());
        scheduler.start();
        try {
            assertThrows(IllegalStateException.class, () -> scheduler.register("late", () -> {
            }));
        } finally {
            scheduler.stop();
        }
    }
}
