package quest.gekko.rankboard.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import quest.gekko.rankboard.config.CacheConfig;
import quest.gekko.rankboard.config.RankBoardProperties;
import quest.gekko.rankboard.repository.ChannelStatsRepository;
import quest.gekko.rankboard.repository.ChannelViewerDailyRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one aggregation cycle over every channel that has ever had a qualified viewer.
 *
 * Channels are processed in fixed-size groups: all channels of a group run concurrently, groups run one
 * after another. A failing channel is logged and counted and never stops the cycle. Only failing to list
 * the channels or to capture the exclusion snapshot aborts it.
 */
@Service
@Slf4j
public class StatsCycleService {

    private final ChannelViewerDailyRepository viewerRepository;
    private final ChannelStatsRepository statsRepository;
    private final AggregationEngine aggregationEngine;
    private final WindowClock windowClock;
    private final Executor statsExecutor;
    private final int batchSize;

    public StatsCycleService(ChannelViewerDailyRepository viewerRepository,
                             ChannelStatsRepository statsRepository,
                             AggregationEngine aggregationEngine,
                             WindowClock windowClock,
                             @Qualifier("statsExecutor") Executor statsExecutor,
                             RankBoardProperties.Stats statsProperties) {
        if (statsProperties.batchSize() < 1) {
            throw new IllegalArgumentException("batch size must be positive, got " + statsProperties.batchSize());
        }
        this.viewerRepository = viewerRepository;
        this.statsRepository = statsRepository;
        this.aggregationEngine = aggregationEngine;
        this.windowClock = windowClock;
        this.statsExecutor = statsExecutor;
        this.batchSize = statsProperties.batchSize();
    }

    @CacheEvict(cacheNames = {CacheConfig.LEADERBOARD, CacheConfig.CHANNEL_STATS, CacheConfig.CHANNEL_TREND}, allEntries = true)
    public CycleReport runCycle() {
        return runCycle(windowClock.statDate());
    }

    @CacheEvict(cacheNames = {CacheConfig.LEADERBOARD, CacheConfig.CHANNEL_STATS, CacheConfig.CHANNEL_TREND}, allEntries = true)
    public CycleReport runCycle(LocalDate statDate) {
        List<String> channels = viewerRepository.findAllChannelLogins();
        log.info("[StatsCycle] stat_date={}: {} channels with lifetime viewer data", statDate, channels.size());
        if (channels.isEmpty()) {
            return new CycleReport(statDate, 0, 0, 0);
        }

        ExclusionSnapshot snapshot = ExclusionSnapshot.of(statsRepository.findEligibleChannelLogins());
        log.info("[StatsCycle] Excluding viewers named after {} eligible channels", snapshot.size());

        int processed = 0;
        int failed = 0;
        int batches = (channels.size() + batchSize - 1) / batchSize;

        for (int i = 0; i < channels.size(); i += batchSize) {
            List<String> batch = channels.subList(i, Math.min(channels.size(), i + batchSize));

            List<CompletableFuture<Boolean>> futures = batch.stream()
                    .map(channel -> submit(channel, statDate, snapshot)
                            .handle((result, ex) -> {
                                if (ex != null) {
                                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                                    log.error("[StatsCycle] Error processing {}", channel, cause);
                                    return false;
                                }
                                return true;
                            }))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (CompletableFuture<Boolean> future : futures) {
                if (future.join()) processed++;
                else failed++;
            }
            log.info("[StatsCycle] Batch {}/{} complete ({} processed, {} errors)",
                    i / batchSize + 1, batches, processed, failed);
        }

        log.info("[StatsCycle] Aggregation complete: {} channels processed, {} errors", processed, failed);
        return new CycleReport(statDate, channels.size(), processed, failed);
    }

    private CompletableFuture<ChannelAggregation> submit(String channel, LocalDate statDate, ExclusionSnapshot snapshot) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> aggregationEngine.aggregateChannel(channel, statDate, snapshot), statsExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public record CycleReport(LocalDate statDate, int channels, int processed, int failed) {}
}
