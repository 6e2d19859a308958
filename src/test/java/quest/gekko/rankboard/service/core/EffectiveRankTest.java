package quest.gekko.rankboard.service.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import quest.gekko.rankboard.domain.Division;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.RankTier;
import quest.gekko.rankboard.domain.ViewerRank;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EffectiveRank")
class EffectiveRankTest {

    private static final RankObservation CURRENT = RankObservation.of(RankTier.GOLD, Division.IV, 10);
    private static final RankObservation PEAK = RankObservation.of(RankTier.DIAMOND, Division.II, 60);

    @Test
    @DisplayName("shows the peak only when opted in and present")
    void select() {
        assertEquals(Optional.of(PEAK), EffectiveRank.select(true, Optional.of(PEAK), Optional.of(CURRENT)));
        assertEquals(Optional.of(CURRENT), EffectiveRank.select(false, Optional.of(PEAK), Optional.of(CURRENT)));
        assertEquals(Optional.of(CURRENT), EffectiveRank.select(true, Optional.empty(), Optional.of(CURRENT)));
    }

    @Test
    @DisplayName("unparseable current rank yields empty")
    void unparseable() {
        ViewerRank row = new ViewerRank();
        row.setRankTier("UNRANKED");
        assertTrue(EffectiveRank.of(row).isEmpty());
    }

    @Test
    @DisplayName("reads the stored columns of a row")
    void fromRow() {
        ViewerRank row = new ViewerRank();
        row.setCurrent(CURRENT);
        row.setPeak(PEAK);
        row.setShowPeak(true);
        assertEquals(Optional.of(PEAK), EffectiveRank.of(row));
    }
}
