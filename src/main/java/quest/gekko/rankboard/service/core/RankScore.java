package quest.gekko.rankboard.service.core;

import quest.gekko.rankboard.domain.Division;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.RankTier;

/**
 * Maps a rank onto one comparable scalar and back.
 *
 * Scale:
 *   IRON..DIAMOND   base = 400 * tier index (0..2400), divisions IV/III/II/I add 0/100/200/300
 *   MASTER+         one shared pool starting at 2800, divisions ignored
 *   score           base + division offset + points
 *
 * Points must lie in [0,100) below the apex tiers for the inverse to recover the same rank.
 * The inverse is only approximate for synthetic scores such as averages.
 */
public class RankScore {

    public static final int TIER_BLOCK = 400;
    public static final int DIVISION_BLOCK = 100;
    public static final int APEX_BASE = RankTier.DIAMOND.ordinal() * TIER_BLOCK + TIER_BLOCK;

    private static final Division[] DIVISIONS = Division.values();
    private static final RankTier[] TIERS = RankTier.values();

    private final int grandmasterMinPoints;
    private final int challengerMinPoints;

    public RankScore(int grandmasterMinPoints, int challengerMinPoints) {
        if (grandmasterMinPoints < 0 || challengerMinPoints < grandmasterMinPoints) {
            throw new IllegalArgumentException("apex cutoffs must satisfy 0 <= grandmaster <= challenger, got "
                    + grandmasterMinPoints + "/" + challengerMinPoints);
        }
        this.grandmasterMinPoints = grandmasterMinPoints;
        this.challengerMinPoints = challengerMinPoints;
    }

    public double score(RankObservation rank) {
        return tierBase(rank.tier()) + divisionOffset(rank) + rank.points();
    }

    public RankObservation scoreToRank(double score) {
        if (score >= APEX_BASE) {
            int pool = (int) Math.floor(score - APEX_BASE);
            if (pool >= challengerMinPoints) return RankObservation.apex(RankTier.CHALLENGER, pool);
            if (pool >= grandmasterMinPoints) return RankObservation.apex(RankTier.GRANDMASTER, pool);
            return RankObservation.apex(RankTier.MASTER, pool);
        }
        double clamped = Math.max(0, score);
        int tierIndex = (int) Math.floor(clamped / TIER_BLOCK);
        double inTier = clamped - tierIndex * TIER_BLOCK;
        int divisionIndex = Math.min(DIVISIONS.length - 1, (int) Math.floor(inTier / DIVISION_BLOCK));
        int points = (int) Math.floor(inTier - divisionIndex * DIVISION_BLOCK);
        return RankObservation.of(TIERS[tierIndex], DIVISIONS[divisionIndex], points);
    }

    private static int tierBase(RankTier tier) {
        return tier.isApex() ? APEX_BASE : tier.ordinal() * TIER_BLOCK;
    }

    private static int divisionOffset(RankObservation rank) {
        return rank.division() == null ? 0 : rank.division().offset();
    }
}
