package watchtower.monitor.alert;

import watchtower.monitor.model.RateLimitTier;
import watchtower.monitor.model.Severity;

/**
 * Decides whether a rate-limit tier governs an event of a given severity.
 *
 * <p>A tier's max severity is a ceiling on urgency: the tier only counts and limits events that
 * are no more urgent than the ceiling. More urgent events pass it untouched. A tier without a
 * ceiling governs every event.
 */
public final class SeverityGate {

    private SeverityGate() {
    }

    public static boolean applies(Severity ceiling, Severity eventSeverity) {
        return ceiling == null || !eventSeverity.isMoreUrgentThan(ceiling);
    }

    public static boolean applies(RateLimitTier tier, Severity eventSeverity) {
        return tier.isConfigured() && applies(tier.maxSeverity(), eventSeverity);
    }
}
