package quest.gekko.rankboard.service.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import quest.gekko.rankboard.domain.Division;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.RankTier;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RankCandidateSelector")
class RankCandidateSelectorTest {

    private final RankCandidateSelector selector = new RankCandidateSelector(new RankScore(300, 700));

    @Test
    @DisplayName("empty input has no winner")
    void empty() {
        assertTrue(selector.selectHighest(List.of()).isEmpty());
    }

    @Test
    @DisplayName("picks the highest scoring candidate")
    void highest() {
        RankObservation emerald = RankObservation.of(RankTier.EMERALD, Division.III, 20);
        List<RankObservation> history = List.of(
                RankObservation.of(RankTier.GOLD, Division.I, 99),
                emerald,
                RankObservation.of(RankTier.PLATINUM, Division.I, 75));

        assertSame(emerald, selector.selectHighest(history).orElseThrow());
    }

    @Test
    @DisplayName("equal scores keep the first candidate")
    void tieKeepsFirst() {
        RankObservation first = RankObservation.apex(RankTier.MASTER, 400);
        RankObservation second = RankObservation.apex(RankTier.GRANDMASTER, 400);

        assertSame(first, selector.selectHighest(List.of(first, second)).orElseThrow());
    }

    @Test
    @DisplayName("null entries are ignored")
    void nullsIgnored() {
        RankObservation silver = RankObservation.of(RankTier.SILVER, Division.IV, 0);
        assertSame(silver, selector.selectHighest(Arrays.asList(null, silver, null)).orElseThrow());
    }
}
