package quest.gekko.rankboard.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.rankboard.config.RankBoardProperties;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.ViewerRank;
import quest.gekko.rankboard.repository.ViewerRankRepository;
import quest.gekko.rankboard.service.integration.connector.CurrentRankSource;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Pulls current ranks from the live source. An unranked answer leaves the stored row alone.
 */
@Service
@Slf4j
public class RankRefreshService {

    public enum Outcome { REFRESHED, UNRANKED }

    public record RefreshReport(int attempted, int refreshed, int unranked, int failed) {}

    private final ViewerRankRepository rankRepository;
    private final CurrentRankSource rankSource;
    private final RankService rankService;
    private final WindowClock windowClock;
    private final RankBoardProperties.Riot riot;

    public RankRefreshService(ViewerRankRepository rankRepository,
                              CurrentRankSource rankSource,
                              RankService rankService,
                              WindowClock windowClock,
                              RankBoardProperties.Riot riot) {
        if (riot.refreshBatchSize() < 1) {
            throw new IllegalArgumentException("refresh batch size must be positive, got " + riot.refreshBatchSize());
        }
        this.rankRepository = rankRepository;
        this.rankSource = rankSource;
        this.rankService = rankService;
        this.windowClock = windowClock;
        this.riot = riot;
    }

    public Outcome refresh(String viewerId) {
        ViewerRank row = rankRepository.findById(viewerId)
                .orElseThrow(() -> new NoSuchElementException("No rank stored for " + viewerId));
        return refresh(row);
    }

    /** Refreshes every row older than the stale threshold, one group at a time. Failures are counted. */
    public RefreshReport refreshStale() {
        Instant cutoff = windowClock.now().minus(riot.staleAfter());
        List<ViewerRank> stale = rankRepository.findByLastUpdatedBeforeOrderByLastUpdatedAsc(cutoff);
        log.info("[RankRefresh] {} ranks not updated since {}", stale.size(), cutoff);

        int refreshed = 0;
        int unranked = 0;
        int failed = 0;
        int batchSize = riot.refreshBatchSize();
        for (int i = 0; i < stale.size(); i += batchSize) {
            for (ViewerRank row : stale.subList(i, Math.min(stale.size(), i + batchSize))) {
                try {
                    if (refresh(row) == Outcome.REFRESHED) refreshed++;
                    else unranked++;
                } catch (RuntimeException e) {
                    failed++;
                    log.error("[RankRefresh] Failed to refresh {}: {}", row.getDisplayName(), e.getMessage());
                }
            }
            log.info("[RankRefresh] Batch {} done ({} refreshed, {} unranked, {} failed)",
                    i / batchSize + 1, refreshed, unranked, failed);
        }
        return new RefreshReport(stale.size(), refreshed, unranked, failed);
    }

    private Outcome refresh(ViewerRank row) {
        Optional<RankObservation> current = rankSource.fetchCurrentRank(row.getViewerId(), row.getRegion());
        if (current.isEmpty()) {
            log.info("[RankRefresh] {} is unranked in solo queue, keeping stored rank", row.getDisplayName());
            return Outcome.UNRANKED;
        }
        PeakUpdate update = rankService.recordReading(row, current.get());
        log.debug("[RankRefresh] {} -> {} (peak: {})", row.getDisplayName(), current.get(), update);
        return Outcome.REFRESHED;
    }
}
