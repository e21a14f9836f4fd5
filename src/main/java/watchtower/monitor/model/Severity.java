package watchtower.monitor.model;

import java.util.Comparator;

/**
 * Alert severity. Higher {@link #value()} means more urgent.
 */
public enum Severity {
    CRITICAL(600),
    ERROR(500),
    WARNING(400),
    INFO(300),
    DEBUG(200),
    TRACE(100);

    /** Orders severities from least to most urgent. */
    public static final Comparator<Severity> BY_URGENCY = Comparator.comparingInt(Severity::value);

    private final int value;

    Severity(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public boolean isMoreUrgentThan(Severity other) {
        return value > other.value;
    }
}
