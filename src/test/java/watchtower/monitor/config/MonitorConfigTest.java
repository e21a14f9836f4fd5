package watchtower.monitor.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import watchtower.monitor.exception.WatchtowerException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonitorConfigTest {

    @Test
    void defaults() {
        MonitorConfig config = MonitorConfig.defaults();

        assertEquals(Duration.ofSeconds(60), config.pollInterval());
        assertEquals(Duration.ofSeconds(300), config.minConfirmDelay());
        assertEquals(Duration.ofSeconds(60), config.earlyWindow());
        assertEquals(Duration.ofSeconds(600), config.lateWindow());
        assertEquals(Duration.ofSeconds(1800), config.maxScheduledLateness());
        assertEquals(Duration.ofSeconds(600), config.maxStoppingDuration());
        assertEquals(Duration.ofSeconds(300), config.serviceLookback());
        assertEquals(50_000, config.errorMessageMaxLength());
    }

    @Test
    void fluentSettersOverrideDefaults() {
        MonitorConfig config = MonitorConfig.defaults()
                .withPollInterval(Duration.ofSeconds(5))
                .withLateWindow(Duration.ofSeconds(900))
                .withErrorMessageMaxLength(100);

        assertEquals(Duration.ofSeconds(5), config.pollInterval());
        assertEquals(Duration.ofSeconds(900), config.lateWindow());
        assertEquals(100, config.errorMessageMaxLength());
    }

    @Test
    void everySettingHasASetterAndShowsInToString() {
        MonitorConfig config = MonitorConfig.defaults()
                .withMaxScheduledLateness(Duration.ofSeconds(900))
                .withMaxEarlyStartup(Duration.ofSeconds(30))
                .withDefaultManualStartAlert(Duration.ofSeconds(120))
                .withDefaultManualStartAbandon(Duration.ofSeconds(600))
                .withDefaultServiceStartupGrace(Duration.ofSeconds(45));

        assertEquals(Duration.ofSeconds(900), config.maxScheduledLateness());
        assertEquals(Duration.ofSeconds(30), config.maxEarlyStartup());
        assertEquals(Duration.ofSeconds(120), config.defaultManualStartAlert());
        assertEquals(Duration.ofSeconds(600), config.defaultManualStartAbandon());

        String text = config.toString();
        for (String name : List.of("databaseUrl", "databasePoolSize", "pollInterval", "minConfirmDelay",
                "earlyWindow", "lateWindow", "maxScheduledLateness", "maxEarlyStartup", "maxStoppingDuration",
                "defaultManualStartAlert", "defaultManualStartAbandon", "serviceLookback",
                "defaultServiceStartupGrace", "errorMessageMaxLength")) {
            assertTrue(text.contains(name + "="), name);
        }
        assertTrue(text.contains("maxEarlyStartup=PT30S"));
        assertTrue(text.contains("defaultServiceStartupGrace=PT45S"));
    }

    @Test
    void fromIniOverridesOnlyGivenKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("watchtower.ini");
        Files.writeString(file, """
                [database]
                url = jdbc:h2:mem:from-ini
                poolSize = 3

                [schedule]
                lateWindowSeconds = 900

                [health]
                maxStoppingSeconds = 120

                [alert]
                errorMessageMaxLength = 2000
                """);

        MonitorConfig config = MonitorConfig.fromIni(file);

        assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals(Duration.ofSeconds(900), config.lateWindow());
        assertEquals(Duration.ofSeconds(60), config.earlyWindow());
        assertEquals(Duration.ofSeconds(120), config.maxStoppingDuration());
        assertEquals(Duration.ofSeconds(60), config.pollInterval());
        assertEquals(2000, config.errorMessageMaxLength());
    }

    @Test
    void fromIniMissingFile(@TempDir Path dir) {
        assertThrows(WatchtowerException.class, () -> MonitorConfig.fromIni(dir.resolve("absent.ini")));
    }
}
