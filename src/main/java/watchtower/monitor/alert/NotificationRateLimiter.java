package watchtower.monitor.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.exception.RateLimitExceededException;
import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.AlertTarget;
import watchtower.monitor.model.RateLimitTier;
import watchtower.monitor.model.Severity;
import watchtower.monitor.repository.AlertTargetRepository;
import watchtower.monitor.store.Database;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Enforces the rate-limit tiers of each alert target.
 *
 * <p>Every tier is independent. A tier whose severity gate does not match an event is neither
 * checked nor counted for it. An elapsed period only restarts when a send is counted, never on a
 * plain check.
 *
 * <p>The check and the counter update happen in one transaction under the target's row lock; the
 * transport call happens after that transaction commits.
 */
public class NotificationRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(NotificationRateLimiter.class);

    private final Database db;
    private final AlertTargetRepository targetRepository;
    private final AlertSenderRegistry senders;
    private final Clock clock;

    public NotificationRateLimiter(Database db, AlertTargetRepository targetRepository,
            AlertSenderRegistry senders, Clock clock) {
        this.db = db;
        this.targetRepository = targetRepository;
        this.senders = senders;
        this.clock = clock;
    }

    /**
     * Check whether a send at {@code severity} would be refused right now.
     */
    public boolean willBeRateLimited(AlertTarget target, Severity severity) {
        return limitingTier(target, severity, clock.instant()).isPresent();
    }

    /**
     * First tier that would refuse an event of {@code severity} at {@code now}.
     */
    public static OptionalInt limitingTier(AlertTarget target, Severity severity, Instant now) {
        for (RateLimitTier tier : target.tiers()) {
            if (SeverityGate.applies(tier, severity) && tier.isExhausted(now)) {
                return OptionalInt.of(tier.index());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Count one send at {@code now} against every tier gated for {@code severity}.
     * Tiers the gate excludes are returned unchanged.
     */
    public static List<RateLimitTier> consume(List<RateLimitTier> tiers, Severity severity, Instant now) {
        List<RateLimitTier> updated = new ArrayList<>(tiers.size());
        for (RateLimitTier tier : tiers) {
            updated.add(SeverityGate.applies(tier, severity) ? tier.consume(now) : tier);
        }
        return updated;
    }

    /**
     * Reserve a slot in every gated tier and deliver the message.
     *
     * @return what the transport reported
     * @throws RateLimitExceededException if a tier is exhausted; nothing is sent or counted
     */
    public SendResult sendIfNotRateLimited(String targetId, AlertMessage message) throws RateLimitExceededException {
        Instant now = clock.instant();
        Severity severity = message.severity();

        Reservation reservation = db.inTransaction(() -> {
            AlertTarget target = targetRepository.lockForUpdate(targetId)
                    .orElseThrow(() -> new StoreException("Alert target not found: " + targetId, null));

            OptionalInt refusing = limitingTier(target, severity, now);
            if (refusing.isPresent()) {
                return new Reservation(target, refusing.getAsInt());
            }

            List<RateLimitTier> updated = consume(target.tiers(), severity, now);
            targetRepository.updateTiers(targetId, updated);
            return new Reservation(target.withTiers(updated), null);
        });

        if (reservation.refusingTier() != null) {
            log.warn("Alert {} to target {} refused by rate limit tier {}",
                    message.detectionId(), targetId, reservation.refusingTier());
            throw new RateLimitExceededException(targetId, message.detectionId(), reservation.refusingTier());
        }

        AlertTarget target = reservation.target();
        return senders.senderFor(target).send(target, message);
    }

    private record Reservation(AlertTarget target, Integer refusingTier) {
    }
}
