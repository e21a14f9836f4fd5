package watchtower.monitor.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import watchtower.monitor.exception.WatchtowerException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the monitoring core.
 * All settings have defaults; override them from the environment, an INI file, or fluent setters.
 */
public final class MonitorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/watchtower;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Polling loop
    private Duration pollInterval = Duration.ofSeconds(60);

    // Schedule compliance
    private Duration minConfirmDelay = Duration.ofSeconds(300);
    private Duration earlyWindow = Duration.ofSeconds(60);
    private Duration lateWindow = Duration.ofSeconds(600);
    private Duration maxScheduledLateness = Duration.ofSeconds(1800);
    private Duration maxEarlyStartup = Duration.ofSeconds(60);

    // Execution health
    private Duration maxStoppingDuration = Duration.ofSeconds(600);
    private Duration defaultManualStartAlert = Duration.ofSeconds(300);
    private Duration defaultManualStartAbandon = Duration.ofSeconds(1800);

    // Service concurrency
    private Duration serviceLookback = Duration.ofSeconds(300);
    private Duration defaultServiceStartupGrace = Duration.ofSeconds(120);

    // Alerts
    private int errorMessageMaxLength = 50_000;

    private MonitorConfig() {
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig();
    }

    public static MonitorConfig fromEnv() {
        MonitorConfig config = new MonitorConfig();

        String dbUrl = System.getenv("WATCHTOWER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("WATCHTOWER_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize);
        }

        String poll = System.getenv("WATCHTOWER_POLL_INTERVAL_SECONDS");
        if (poll != null && !poll.isBlank()) {
            config.pollInterval = Duration.ofSeconds(Long.parseLong(poll));
        }

        return config;
    }

    /**
     * Load settings from an INI file. Missing sections and keys keep their defaults.
     */
    public static MonitorConfig fromIni(Path file) {
        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new WatchtowerException("Failed to read config file: " + file, e);
        }

        MonitorConfig config = new MonitorConfig();

        Profile.Section db = ini.get("database");
        if (db != null) {
            config.databaseUrl = string(db, "url", config.databaseUrl);
            config.databasePoolSize = integer(db, "poolSize", config.databasePoolSize);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            config.pollInterval = seconds(scheduler, "pollIntervalSeconds", config.pollInterval);
        }

        Profile.Section schedule = ini.get("schedule");
        if (schedule != null) {
            config.minConfirmDelay = seconds(schedule, "minConfirmDelaySeconds", config.minConfirmDelay);
            config.earlyWindow = seconds(schedule, "earlyWindowSeconds", config.earlyWindow);
            config.lateWindow = seconds(schedule, "lateWindowSeconds", config.lateWindow);
            config.maxScheduledLateness = seconds(schedule, "maxScheduledLatenessSeconds", config.maxScheduledLateness);
            config.maxEarlyStartup = seconds(schedule, "maxEarlyStartupSeconds", config.maxEarlyStartup);
        }

        Profile.Section health = ini.get("health");
        if (health != null) {
            config.maxStoppingDuration = seconds(health, "maxStoppingSeconds", config.maxStoppingDuration);
            config.defaultManualStartAlert = seconds(health, "manualStartAlertSeconds", config.defaultManualStartAlert);
            config.defaultManualStartAbandon = seconds(health, "manualStartAbandonSeconds",
                    config.defaultManualStartAbandon);
        }

        Profile.Section service = ini.get("service");
        if (service != null) {
            config.serviceLookback = seconds(service, "lookbackSeconds", config.serviceLookback);
            config.defaultServiceStartupGrace = seconds(service, "startupGraceSeconds",
                    config.defaultServiceStartupGrace);
        }

        Profile.Section alert = ini.get("alert");
        if (alert != null) {
            config.errorMessageMaxLength = integer(alert, "errorMessageMaxLength", config.errorMessageMaxLength);
        }

        return config;
    }

    private static String string(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int integer(Profile.Section section, String key, int fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : Integer.parseInt(value.trim());
    }

    private static Duration seconds(Profile.Section section, String key, Duration fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : Duration.ofSeconds(Long.parseLong(value.trim()));
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration minConfirmDelay() {
        return minConfirmDelay;
    }

    public Duration earlyWindow() {
        return earlyWindow;
    }

    public Duration lateWindow() {
        return lateWindow;
    }

    public Duration maxScheduledLateness() {
        return maxScheduledLateness;
    }

    public Duration maxEarlyStartup() {
        return maxEarlyStartup;
    }

    public Duration maxStoppingDuration() {
        return maxStoppingDuration;
    }

    public Duration defaultManualStartAlert() {
        return defaultManualStartAlert;
    }

    public Duration defaultManualStartAbandon() {
        return defaultManualStartAbandon;
    }

    public Duration serviceLookback() {
        return serviceLookback;
    }

    public Duration defaultServiceStartupGrace() {
        return defaultServiceStartupGrace;
    }

    public int errorMessageMaxLength() {
        return errorMessageMaxLength;
    }

    // Fluent setters for testing/customization
    public MonitorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public MonitorConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public MonitorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public MonitorConfig withMinConfirmDelay(Duration delay) {
        this.minConfirmDelay = delay;
        return this;
    }

    public MonitorConfig withEarlyWindow(Duration window) {
        this.earlyWindow = window;
        return this;
    }

    public MonitorConfig withLateWindow(Duration window) {
        this.lateWindow = window;
        return this;
    }

    public MonitorConfig withMaxScheduledLateness(Duration lateness) {
        this.maxScheduledLateness = lateness;
        return this;
    }

    public MonitorConfig withMaxEarlyStartup(Duration early) {
        this.maxEarlyStartup = early;
        return this;
    }

    public MonitorConfig withMaxStoppingDuration(Duration duration) {
        this.maxStoppingDuration = duration;
        return this;
    }

    public MonitorConfig withDefaultManualStartAlert(Duration alertAfter) {
        this.defaultManualStartAlert = alertAfter;
        return this;
    }

    public MonitorConfig withDefaultManualStartAbandon(Duration abandonAfter) {
        this.defaultManualStartAbandon = abandonAfter;
        return this;
    }

    public MonitorConfig withServiceLookback(Duration lookback) {
        this.serviceLookback = lookback;
        return this;
    }

    public MonitorConfig withDefaultServiceStartupGrace(Duration grace) {
        this.defaultServiceStartupGrace = grace;
        return this;
    }

    public MonitorConfig withErrorMessageMaxLength(int length) {
        this.errorMessageMaxLength = length;
        return this;
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", databasePoolSize=" + databasePoolSize +
                ", pollInterval=" + pollInterval +
                ", minConfirmDelay=" + minConfirmDelay +
                ", earlyWindow=" + earlyWindow +
                ", lateWindow=" + lateWindow +
                ", maxScheduledLateness=" + maxScheduledLateness +
                ", maxEarlyStartup=" + maxEarlyStartup +
                ", maxStoppingDuration=" + maxStoppingDuration +
                ", defaultManualStartAlert=" + defaultManualStartAlert +
                ", defaultManualStartAbandon=" + defaultManualStartAbandon +
                ", serviceLookback=" + serviceLookback +
                ", defaultServiceStartupGrace=" + defaultServiceStartupGrace +
                ", errorMessageMaxLength=" + errorMessageMaxLength +
                '}';
    }
}
