package quest.gekko.rankboard.domain;

import java.util.Optional;

/**
 * A single rank reading. Division is always null for apex tiers and never null below them.
 */
public record RankObservation(RankTier tier, Division division, int points) {

    public RankObservation {
        if (tier == null) throw new IllegalArgumentException("tier is required");
        if (tier.isApex()) {
            division = null;
        } else if (division == null) {
            division = Division.IV;
        }
        points = Math.max(0, points);
    }

    public static RankObservation of(RankTier tier, Division division, int points) {
        return new RankObservation(tier, division, points);
    }

    public static RankObservation apex(RankTier tier, int points) {
        return new RankObservation(tier, null, points);
    }

    /**
     * Lenient parse of stored or externally supplied values. An unknown tier yields empty, never an exception.
     */
    public static Optional<RankObservation> parse(String tier, String division, Integer points) {
        return RankTier.parse(tier)
                .map(t -> new RankObservation(t, Division.parse(division).orElse(null), points == null ? 0 : points));
    }

    public String divisionName() {
        return division == null ? null : division.name();
    }

    @Override
    public String toString() {
        return division == null ? tier + " " + points + "LP" : tier + " " + division + " " + points + "LP";
    }
}
