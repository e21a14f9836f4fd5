package watchtower.monitor.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One rate-limit bucket of an alert target.
 *
 * @param index                  position among the target's tiers, 0-based
 * @param maxRequestsPerPeriod   sends allowed per period; null leaves the tier unconfigured
 * @param requestPeriodSeconds   period length; null leaves the tier unconfigured
 * @param maxSeverity            ceiling on urgency, null applies to every severity
 * @param requestPeriodStartedAt start of the current period, null if never used
 * @param requestCountInPeriod   sends counted in the current period
 */
public record RateLimitTier(int index, Integer maxRequestsPerPeriod, Integer requestPeriodSeconds,
        Severity maxSeverity, Instant requestPeriodStartedAt, int requestCountInPeriod) {

    /** Maximum number of tiers per target. */
    public static final int MAX_TIERS = 8;

    public static RateLimitTier of(int index, int maxRequests, int periodSeconds, Severity maxSeverity) {
        return new RateLimitTier(index, maxRequests, periodSeconds, maxSeverity, null, 0);
    }

    public boolean isConfigured() {
        return maxRequestsPerPeriod != null && requestPeriodSeconds != null;
    }

    /** True if the current period has elapsed (or never started) as of {@code now}. */
    public boolean isExpired(Instant now) {
        return requestPeriodStartedAt == null
                || Duration.between(requestPeriodStartedAt, now).getSeconds() >= requestPeriodSeconds;
    }

    public boolean isExhausted(Instant now) {
        return !isExpired(now) && requestCountInPeriod >= maxRequestsPerPeriod;
    }

    /** Count one send, starting a new period first if the current one has elapsed. */
    public RateLimitTier consume(Instant now) {
        if (isExpired(now)) {
            return new RateLimitTier(index, maxRequestsPerPeriod, requestPeriodSeconds, maxSeverity, now, 1);
        }
        return new RateLimitTier(index, maxRequestsPerPeriod, requestPeriodSeconds, maxSeverity,
                requestPeriodStartedAt, requestCountInPeriod + 1);
    }
}
