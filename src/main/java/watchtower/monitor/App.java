package watchtower.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.config.Dependencies;
import watchtower.monitor.config.MonitorConfig;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Loads config, starts the polling loop and runs until the JVM is asked to
 * shut down.
 *
 * Config comes from the INI file named by {@code WATCHTOWER_CONFIG} when it is set, and from
 * {@code WATCHTOWER_*} environment variables otherwise.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        MonitorConfig config = loadConfig();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping monitors...");
            deps.close();
            stopped.countDown();
        }, "watchtower-shutdown"));

        deps.startScheduler();
        log.info("Watchtower monitors running, polling every {}s", config.pollInterval().toSeconds());
        stopped.await();
    }

    static MonitorConfig loadConfig() {
        String path = System.getenv("WATCHTOWER_CONFIG");
        if (path != null && !path.isBlank()) {
            log.info("Loading config from {}", path);
            return MonitorConfig.fromIni(Path.of(path));
        }
        return MonitorConfig.fromEnv();
    }
}
