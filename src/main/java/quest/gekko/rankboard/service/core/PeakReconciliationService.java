package quest.gekko.rankboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.ViewerRank;
import quest.gekko.rankboard.repository.ViewerRankRepository;
import quest.gekko.rankboard.service.integration.connector.RankHistoryConnector;
import quest.gekko.rankboard.service.integration.connector.RankSourceUnavailableException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Seeds a viewer's peak from their season history. Runs off the request thread; a miss never touches the
 * stored peak.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeakReconciliationService {

    private final ViewerRankRepository rankRepository;
    private final RankHistoryConnector historyConnector;
    private final RankCandidateSelector candidateSelector;
    private final RankService rankService;

    @Async("reconciliationExecutor")
    public CompletableFuture<PeakUpdate> reconcileAsync(String viewerId) {
        return CompletableFuture.completedFuture(reconcile(viewerId));
    }

    public PeakUpdate reconcile(String viewerId) {
        try {
            return seedPeak(viewerId);
        } catch (RuntimeException e) {
            log.warn("[PeakSeed] Reconciliation failed for {}", viewerId, e);
            return PeakUpdate.UNCHANGED;
        }
    }

    private PeakUpdate seedPeak(String viewerId) {
        Optional<ViewerRank> row = rankRepository.findById(viewerId);
        if (row.isEmpty()) {
            log.warn("[PeakSeed] Viewer {} vanished before reconciliation", viewerId);
            return PeakUpdate.UNCHANGED;
        }

        List<RankObservation> history;
        try {
            history = historyConnector.fetchHistory(row.get());
        } catch (RankSourceUnavailableException e) {
            log.warn("[PeakSeed] History unavailable for {}: {}", row.get().getDisplayName(), e.getMessage());
            return PeakUpdate.UNCHANGED;
        }

        Optional<RankObservation> highest = candidateSelector.selectHighest(history);
        if (highest.isEmpty()) {
            log.warn("[PeakSeed] No historical ranks found for {}", row.get().getDisplayName());
            return PeakUpdate.UNCHANGED;
        }

        PeakUpdate update = rankService.overridePeak(viewerId, highest.get());
        log.info("[PeakSeed] {} -> peak {} ({})", row.get().getDisplayName(), highest.get(), update);
        return update;
    }
}
