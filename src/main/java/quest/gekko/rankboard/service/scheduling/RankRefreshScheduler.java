package quest.gekko.rankboard.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.rankboard.service.core.RankRefreshService;

@Service
@RequiredArgsConstructor
@Slf4j
public class RankRefreshScheduler {
    private final RankRefreshService refreshService;

    // 04:30 UTC daily
    @Scheduled(cron = "${rankboard.riot.refresh-cron:0 30 4 * * *}", zone = "UTC")
    public void refreshStaleRanks() {
        try {
            RankRefreshService.RefreshReport report = refreshService.refreshStale();
            log.info("[RankRefresh] Done: {} stale, {} refreshed, {} unranked, {} failed",
                    report.attempted(), report.refreshed(), report.unranked(), report.failed());
        } catch (RuntimeException e) {
            log.error("[RankRefresh] Run aborted", e);
        }
    }
}
