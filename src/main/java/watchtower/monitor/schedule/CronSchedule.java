package watchtower.monitor.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.time.ExecutionTime;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A cron-form schedule.
 */
public final class CronSchedule implements ParsedSchedule {

    private final String expression;
    private final Cron cron;
    private final ExecutionTime executionTime;

    CronSchedule(String expression, Cron cron) {
        this.expression = expression;
        this.cron = cron;
        this.executionTime = ExecutionTime.forCron(cron);
    }

    @Override
    public ScheduleForm form() {
        return ScheduleForm.CRON;
    }

    @Override
    public String expression() {
        return expression;
    }

    public String cronExpression() {
        return cron.asString();
    }

    /**
     * Most recent fire time strictly before {@code now}, in UTC.
     *
     * @return the fire time, or empty if the expression never fired before {@code now}
     */
    public Optional<Instant> lastFireBefore(Instant now) {
        return executionTime.lastExecution(ZonedDateTime.ofInstant(now, ZoneOffset.UTC))
                .map(ZonedDateTime::toInstant);
    }

    /**
     * Time elapsed since the most recent fire, never negative.
     *
     * @return the elapsed time, or empty if nothing is expected yet
     */
    public Optional<Duration> sinceLastFire(Instant now) {
        return lastFireBefore(now).map(fired -> {
            Duration ago = Duration.between(fired, now);
            return ago.isNegative() ? Duration.ZERO : ago;
        });
    }
}
