package watchtower.monitor.schedule;

import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import watchtower.monitor.exception.InvalidScheduleException;

import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code cron(...)} and {@code rate(...)} schedule strings.
 *
 * <p>Cron expressions have five fields (minute, hour, day of month, month, day of week) and an
 * optional sixth year field. Day of week is 0-7 with both 0 and 7 meaning Sunday; {@code ?} is
 * accepted in either day field. Rate units are second, minute, hour, day, month and year, each
 * optionally pluralized.
 *
 * <p>Instances are thread-safe.
 */
public final class ScheduleExpressionEvaluator {

    private static final Pattern CRON = Pattern.compile("^\\s*cron\\s*\\(([^)]+)\\)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RATE = Pattern.compile("^\\s*rate\\s*\\(\\s*(\\d+)\\s+([A-Za-z]+)\\s*\\)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, ChronoUnit> RATE_UNITS = Map.of(
            "second", ChronoUnit.SECONDS,
            "minute", ChronoUnit.MINUTES,
            "hour", ChronoUnit.HOURS,
            "day", ChronoUnit.DAYS,
            "month", ChronoUnit.MONTHS,
            "year", ChronoUnit.YEARS);

    private static final CronDefinition CRON_DEFINITION = CronDefinitionBuilder.defineCron()
            .withMinutes().withValidRange(0, 59).and()
            .withHours().withValidRange(0, 23).and()
            .withDayOfMonth().withValidRange(1, 31).supportsL().supportsW().supportsLW().supportsQuestionMark().and()
            .withMonth().withValidRange(1, 12).and()
            .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1)
                    .supportsHash().supportsL().supportsQuestionMark().withIntMapping(7, 0).and()
            .withYear().withValidRange(1970, 2099).optional().and()
            .instance();

    private final CronParser cronParser = new CronParser(CRON_DEFINITION);

    /**
     * Classify and parse a schedule string.
     *
     * @param schedule the schedule string
     * @return a {@link CronSchedule} or a {@link RateSchedule}
     * @throws InvalidScheduleException if the string is blank, of an unknown form, or malformed
     */
    public ParsedSchedule parse(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(schedule), "schedule is blank");
        }

        Matcher cron = CRON.matcher(schedule);
        if (cron.matches()) {
            return parseCron(schedule, cron.group(1).trim());
        }

        Matcher rate = RATE.matcher(schedule);
        if (rate.matches()) {
            return parseRate(schedule, rate.group(1), rate.group(2));
        }

        throw new InvalidScheduleException(schedule, "expected cron(...) or rate(...)");
    }

    private CronSchedule parseCron(String schedule, String expression) {
        try {
            return new CronSchedule(schedule, cronParser.parse(expression));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(schedule, e.getMessage(), e);
        }
    }

    private static RateSchedule parseRate(String schedule, String amountText, String unitText) {
        String unitName = unitText.toLowerCase(Locale.ROOT);
        if (unitName.endsWith("s")) {
            unitName = unitName.substring(0, unitName.length() - 1);
        }

        ChronoUnit unit = RATE_UNITS.get(unitName);
        if (unit == null) {
            throw new InvalidScheduleException(schedule, "unknown rate unit '" + unitText + "'");
        }

        long amount;
        try {
            amount = Long.parseLong(amountText);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException(schedule, "rate amount out of range", e);
        }
        if (amount <= 0) {
            throw new InvalidScheduleException(schedule, "rate amount must be positive");
        }

        return new RateSchedule(schedule, amount, unit);
    }
}
