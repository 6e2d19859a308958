package quest.gekko.rankboard.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.rankboard.domain.Division;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.RankTier;
import quest.gekko.rankboard.domain.ViewerRank;
import quest.gekko.rankboard.repository.ViewerRankRepository;
import quest.gekko.rankboard.web.dto.RankWriteRequest;
import quest.gekko.rankboard.web.dto.ViewerRankDTO;

import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RankService")
class RankServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ViewerRankRepository rankRepository;

    @Mock
    private WindowClock windowClock;

    private RankService service;

    @BeforeEach
    void setUp() {
        service = new RankService(rankRepository, new PeakTracker(), windowClock);
    }

    private static RankWriteRequest request(String tier, String division, Integer lp) {
        return new RankWriteRequest("puuid-1", "SomeViewer", "Some#EUW", "euw1", tier, division, lp,
                null, null, null, false);
    }

    private static ViewerRank stored(RankObservation current, RankObservation peak) {
        ViewerRank row = new ViewerRank();
        row.setViewerId("puuid-1");
        row.setDisplayName("someviewer");
        row.setCurrent(current);
        if (peak != null) row.setPeak(peak);
        return row;
    }

    @Nested
    @DisplayName("storeRank")
    class StoreRank {

        @Test
        @DisplayName("new viewer gets the reading as peak")
        void firstReading() {
            when(windowClock.now()).thenReturn(NOW);
            when(rankRepository.findById("puuid-1")).thenReturn(Optional.empty());

            PeakUpdate update = service.storeRank(request("gold", "II", 30));

            assertEquals(PeakUpdate.RANK_COMPARISON, update);
            ArgumentCaptor<ViewerRank> row = ArgumentCaptor.forClass(ViewerRank.class);
            verify(rankRepository).upsert(row.capture());
            assertEquals("someviewer", row.getValue().getDisplayName());
            assertEquals("GOLD", row.getValue().getRankTier());
            assertEquals("GOLD", row.getValue().getPeakTier());
            assertEquals(NOW, row.getValue().getLastUpdated());
        }

        @Test
        @DisplayName("lower reading keeps the stored peak")
        void lowerReading() {
            when(windowClock.now()).thenReturn(NOW);
            RankObservation peak = RankObservation.of(RankTier.DIAMOND, Division.III, 20);
            when(rankRepository.findById("puuid-1"))
                    .thenReturn(Optional.of(stored(RankObservation.of(RankTier.EMERALD, Division.I, 0), peak)));

            assertEquals(PeakUpdate.UNCHANGED, service.storeRank(request("EMERALD", "II", 10)));

            ArgumentCaptor<ViewerRank> row = ArgumentCaptor.forClass(ViewerRank.class);
            verify(rankRepository).upsert(row.capture());
            assertEquals(peak, row.getValue().peak().orElseThrow());
            assertEquals(RankObservation.of(RankTier.EMERALD, Division.II, 10), row.getValue().current().orElseThrow());
        }

        @Test
        @DisplayName("explicit peak overrides without comparison")
        void explicitPeak() {
            when(windowClock.now()).thenReturn(NOW);
            when(rankRepository.findById("puuid-1")).thenReturn(Optional.of(
                    stored(RankObservation.of(RankTier.GOLD, Division.I, 0), RankObservation.apex(RankTier.MASTER, 10))));
            RankWriteRequest request = new RankWriteRequest("puuid-1", "someviewer", null, "euw1",
                    "GOLD", "I", 5, "PLATINUM", "IV", 0, false);

            assertEquals(PeakUpdate.EXPLICIT_OVERRIDE, service.storeRank(request));

            ArgumentCaptor<ViewerRank> row = ArgumentCaptor.forClass(ViewerRank.class);
            verify(rankRepository).upsert(row.capture());
            assertEquals(RankObservation.of(RankTier.PLATINUM, Division.IV, 0), row.getValue().peak().orElseThrow());
        }

        @Test
        @DisplayName("unknown tier is rejected before anything is stored")
        void unknownTier() {
            assertThrows(IllegalArgumentException.class, () -> service.storeRank(request("UNRANKED", null, 0)));
            verify(rankRepository, never()).upsert(any());
        }

        @Test
        @DisplayName("missing identity is rejected")
        void missingIdentity() {
            RankWriteRequest request = new RankWriteRequest(" ", "name", null, null, "GOLD", "I", 0,
                    null, null, null, false);
            assertThrows(IllegalArgumentException.class, () -> service.storeRank(request));
        }
    }

    @Nested
    @DisplayName("findEffectiveRank")
    class FindEffectiveRank {

        @Test
        @DisplayName("shows the peak when the viewer opted in")
        void peakShown() {
            ViewerRank row = stored(RankObservation.of(RankTier.SILVER, Division.I, 10),
                    RankObservation.of(RankTier.PLATINUM, Division.II, 70));
            row.setShowPeak(true);
            when(rankRepository.findFirstByDisplayNameOrderByLastUpdatedDesc("someviewer")).thenReturn(Optional.of(row));

            ViewerRankDTO dto = service.findEffectiveRank("SomeViewer").orElseThrow();

            assertEquals("PLATINUM", dto.tier());
            assertEquals("II", dto.division());
            assertTrue(dto.peak());
        }

        @Test
        @DisplayName("falls back to the current rank")
        void currentShown() {
            when(rankRepository.findFirstByDisplayNameOrderByLastUpdatedDesc("someviewer")).thenReturn(Optional.of(
                    stored(RankObservation.of(RankTier.SILVER, Division.I, 10), null)));

            ViewerRankDTO dto = service.findEffectiveRank("someviewer").orElseThrow();

            assertEquals("SILVER", dto.tier());
            assertFalse(dto.peak());
        }

        @Test
        @DisplayName("a name held by two viewers resolves to the most recently updated one")
        void sharedName() {
            ViewerRank renamed = stored(RankObservation.of(RankTier.DIAMOND, Division.IV, 5), null);
            renamed.setViewerId("puuid-2");
            renamed.setLastUpdated(NOW);
            when(rankRepository.findFirstByDisplayNameOrderByLastUpdatedDesc("someviewer"))
                    .thenReturn(Optional.of(renamed));

            ViewerRankDTO dto = service.findEffectiveRank(" SomeViewer ").orElseThrow();

            assertEquals("DIAMOND", dto.tier());
            verify(rankRepository).findFirstByDisplayNameOrderByLastUpdatedDesc("someviewer");
            verifyNoMoreInteractions(rankRepository);
        }
    }

    @Test
    @DisplayName("overridePeak reports whether a row was touched")
    void overridePeak() {
        when(rankRepository.updatePeak("puuid-1", "MASTER", null, 120)).thenReturn(1);
        when(rankRepository.updatePeak("gone", "MASTER", null, 120)).thenReturn(0);

        RankObservation master = RankObservation.apex(RankTier.MASTER, 120);
        assertEquals(PeakUpdate.EXPLICIT_OVERRIDE, service.overridePeak("puuid-1", master));
        assertEquals(PeakUpdate.UNCHANGED, service.overridePeak("gone", master));
    }

    @Test
    @DisplayName("deleting an unknown viewer is a not-found")
    void deleteUnknown() {
        when(rankRepository.existsById("nobody")).thenReturn(false);
        assertThrows(NoSuchElementException.class, () -> service.delete("nobody"));
        verify(rankRepository, never()).deleteById(any());
    }
}
