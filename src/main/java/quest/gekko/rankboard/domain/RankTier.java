package quest.gekko.rankboard.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * The ten ladder tiers, lowest first. The top three share one divisionless point pool.
 */
public enum RankTier {
    IRON,
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM,
    EMERALD,
    DIAMOND,
    MASTER,
    GRANDMASTER,
    CHALLENGER;

    public boolean isApex() {
        return ordinal() >= MASTER.ordinal();
    }

    public static Optional<RankTier> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
