package quest.gekko.rankboard.service.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import quest.gekko.rankboard.domain.Division;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.RankTier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RankScore")
class RankScoreTest {

    private final RankScore rankScore = new RankScore(300, 700);

    @Nested
    @DisplayName("score")
    class Score {

        @Test
        @DisplayName("IRON IV 0LP is the bottom of the scale")
        void ironFloor() {
            assertEquals(0.0, rankScore.score(RankObservation.of(RankTier.IRON, Division.IV, 0)));
        }

        @Test
        @DisplayName("tier, division and points add up")
        void composes() {
            assertEquals(1600 + 200 + 50, rankScore.score(RankObservation.of(RankTier.PLATINUM, Division.II, 50)));
            assertEquals(2400 + 300 + 99, rankScore.score(RankObservation.of(RankTier.DIAMOND, Division.I, 99)));
        }

        @Test
        @DisplayName("apex tiers share one pool and ignore the tier name")
        void apexPool() {
            assertEquals(2800 + 450, rankScore.score(RankObservation.apex(RankTier.MASTER, 450)));
            assertEquals(2800 + 450, rankScore.score(RankObservation.apex(RankTier.CHALLENGER, 450)));
        }

        @Test
        @DisplayName("strictly increasing over the non-apex ladder")
        void monotonic() {
            List<RankObservation> ladder = new ArrayList<>();
            for (RankTier tier : RankTier.values()) {
                if (tier.isApex()) continue;
                for (Division division : Division.values()) {
                    ladder.add(RankObservation.of(tier, division, 0));
                    ladder.add(RankObservation.of(tier, division, 99));
                }
            }
            ladder.add(RankObservation.apex(RankTier.MASTER, 0));

            for (int i = 1; i < ladder.size(); i++) {
                assertTrue(rankScore.score(ladder.get(i)) > rankScore.score(ladder.get(i - 1)),
                        ladder.get(i) + " should outscore " + ladder.get(i - 1));
            }
        }
    }

    @Nested
    @DisplayName("scoreToRank")
    class Inverse {

        @Test
        @DisplayName("recovers every non-apex rank it scored")
        void roundTrip() {
            for (RankTier tier : RankTier.values()) {
                if (tier.isApex()) continue;
                for (Division division : Division.values()) {
                    for (int lp : new int[]{0, 42, 99}) {
                        RankObservation rank = RankObservation.of(tier, division, lp);
                        assertEquals(rank, rankScore.scoreToRank(rankScore.score(rank)));
                    }
                }
            }
        }

        @Test
        @DisplayName("apex scores map by points against the cutoffs")
        void apexCutoffs() {
            assertEquals(RankObservation.apex(RankTier.MASTER, 299), rankScore.scoreToRank(2800 + 299));
            assertEquals(RankObservation.apex(RankTier.GRANDMASTER, 300), rankScore.scoreToRank(2800 + 300));
            assertEquals(RankObservation.apex(RankTier.GRANDMASTER, 699), rankScore.scoreToRank(2800 + 699));
            assertEquals(RankObservation.apex(RankTier.CHALLENGER, 700), rankScore.scoreToRank(2800 + 700));
        }

        @Test
        @DisplayName("fractional averages floor into the containing block")
        void fractional() {
            assertEquals(RankObservation.of(RankTier.BRONZE, Division.III, 50), rankScore.scoreToRank(550.7));
            assertEquals(RankObservation.of(RankTier.DIAMOND, Division.I, 99), rankScore.scoreToRank(2799.9));
        }

        @Test
        @DisplayName("negative scores clamp to the bottom")
        void negative() {
            assertEquals(RankObservation.of(RankTier.IRON, Division.IV, 0), rankScore.scoreToRank(-25));
        }
    }

    @Test
    @DisplayName("rejects cutoffs out of order")
    void invalidCutoffs() {
        assertThrows(IllegalArgumentException.class, () -> new RankScore(800, 700));
        assertThrows(IllegalArgumentException.class, () -> new RankScore(-1, 700));
    }
}
