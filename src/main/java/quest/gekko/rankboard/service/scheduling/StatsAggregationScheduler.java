package quest.gekko.rankboard.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.rankboard.service.core.StatsCycleService;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatsAggregationScheduler {
    private final StatsCycleService statsCycleService;

    // xx:10 UTC every three hours
    @Scheduled(cron = "${rankboard.stats.cron:0 10 */3 * * *}", zone = "UTC")
    public void runAggregation() {
        try {
            StatsCycleService.CycleReport report = statsCycleService.runCycle();
            log.info("[StatsCycle] Finished {}: {}/{} channels, {} errors",
                    report.statDate(), report.processed(), report.channels(), report.failed());
        } catch (RuntimeException e) {
            log.error("[StatsCycle] Cycle aborted", e);
        }
    }
}
