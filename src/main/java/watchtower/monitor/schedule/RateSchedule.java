package watchtower.monitor.schedule;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * A rate-form schedule: every {@code amount} calendar {@code unit}s.
 * Month and year offsets follow calendar arithmetic in UTC, clamping to the last valid day.
 */
public final class RateSchedule implements ParsedSchedule {

    private final String expression;
    private final long amount;
    private final ChronoUnit unit;

    RateSchedule(String expression, long amount, ChronoUnit unit) {
        this.expression = expression;
        this.amount = amount;
        this.unit = unit;
    }

    @Override
    public ScheduleForm form() {
        return ScheduleForm.RATE;
    }

    @Override
    public String expression() {
        return expression;
    }

    public long amount() {
        return amount;
    }

    public ChronoUnit unit() {
        return unit;
    }

    /** One period before {@code instant}. */
    public Instant before(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).minus(amount, unit).toInstant();
    }

    /** One period after {@code instant}. */
    public Instant after(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).plus(amount, unit).toInstant();
    }
}
