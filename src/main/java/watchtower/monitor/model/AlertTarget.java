package watchtower.monitor.model;

import java.util.List;
import java.util.Objects;

/**
 * A configured delivery target (an email list, a pager service, a webhook).
 * The {@code transport} name selects the sender that delivers to it.
 */
public final class AlertTarget {
    private final String id;
    private final String name;
    private final boolean enabled;
    private final String transport;
    private final List<RateLimitTier> tiers;

    public AlertTarget(String id, String name, boolean enabled, String transport, List<RateLimitTier> tiers) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.name = name;
        this.enabled = enabled;
        this.transport = Objects.requireNonNull(transport, "transport is required");
        if (tiers.size() > RateLimitTier.MAX_TIERS) {
            throw new IllegalArgumentException("At most " + RateLimitTier.MAX_TIERS + " rate limit tiers allowed, got "
                    + tiers.size());
        }
        this.tiers = List.copyOf(tiers);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public boolean enabled() {
        return enabled;
    }

    public String transport() {
        return transport;
    }

    public List<RateLimitTier> tiers() {
        return tiers;
    }

    public AlertTarget withTiers(List<RateLimitTier> newTiers) {
        return new AlertTarget(id, name, enabled, transport, newTiers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertTarget that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AlertTarget{id='" + id + "', transport='" + transport + "', tiers=" + tiers.size() + "}";
    }
}
