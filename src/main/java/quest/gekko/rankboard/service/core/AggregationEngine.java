package quest.gekko.rankboard.service.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.rankboard.config.RankBoardProperties;
import quest.gekko.rankboard.domain.Channel;
import quest.gekko.rankboard.domain.ChannelDailySnapshot;
import quest.gekko.rankboard.domain.ChannelStats;
import quest.gekko.rankboard.domain.RankAggregate;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.StatWindow;
import quest.gekko.rankboard.domain.TopViewer;
import quest.gekko.rankboard.domain.ViewerRank;
import quest.gekko.rankboard.domain.ViewerScoreEntry;
import quest.gekko.rankboard.repository.ChannelDailySnapshotRepository;
import quest.gekko.rankboard.repository.ChannelRepository;
import quest.gekko.rankboard.repository.ChannelStatsRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Computes and stores the statistics of one channel for the all-time window and the cycle's day window.
 *
 * Flow per channel:
 * 1. Resolve the qualifying viewers of the window (de-duplicated, streamer exclusions applied).
 * 2. Score each viewer's effective rank; viewers without a valid rank are skipped.
 * 3. Summarize: mean, median, both mapped back to a display rank, top N, eligibility.
 * 4. Upsert the all-time row, always, even in the zero-viewer state.
 * 5. Upsert the day row with the all-time figures attached, unless nobody qualified that day.
 *
 * Rows are replaced whole and carry no wall-clock values, so identical inputs give identical rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationEngine {

    private final ChannelRepository channelRepository;
    private final ExclusionFilter exclusionFilter;
    private final RankScore rankScore;
    private final ChannelStatsRepository statsRepository;
    private final ChannelDailySnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;
    private final RankBoardProperties.Stats statsProperties;

    @Transactional
    public ChannelAggregation aggregateChannel(String channelLogin, LocalDate statDate, ExclusionSnapshot snapshot) {
        Optional<Channel> channel = channelRepository.findById(channelLogin);
        String linkedViewerId = channel.map(Channel::getLinkedViewerId).orElse(null);
        String displayName = channel.map(Channel::getDisplayName).orElse(channelLogin);

        WindowStats allTime = computeWindow(channelLogin, linkedViewerId, StatWindow.ALL_TIME, snapshot);
        statsRepository.upsert(toChannelStats(channelLogin, displayName, statDate, allTime));

        WindowStats daily = computeWindow(channelLogin, linkedViewerId, StatWindow.day(statDate), snapshot);
        if (daily.isEmpty()) {
            log.debug("{}: no qualifying viewers on {}, daily snapshot skipped", channelLogin, statDate);
            daily = null;
        } else {
            snapshotRepository.upsert(toDailySnapshot(channelLogin, statDate, daily, allTime));
        }

        if (log.isDebugEnabled()) {
            log.debug("{}: {} viewers, mean={}, median={}", channelLogin, allTime.viewerCount(),
                    allTime.meanRank(), allTime.medianRank());
        }
        return new ChannelAggregation(channelLogin, statDate, allTime, daily);
    }

    public WindowStats computeWindow(String channelLogin, String linkedViewerId, StatWindow window, ExclusionSnapshot snapshot) {
        List<ViewerRank> viewers = exclusionFilter.resolve(channelLogin, linkedViewerId, window, snapshot);
        return summarize(score(viewers));
    }

    public List<ViewerScoreEntry> score(List<ViewerRank> viewers) {
        List<ViewerScoreEntry> entries = new ArrayList<>(viewers.size());
        for (ViewerRank viewer : viewers) {
            Optional<RankObservation> effective = EffectiveRank.of(viewer);
            if (effective.isEmpty()) {
                log.debug("Skipping viewer {} with unreadable rank {}/{}", viewer.getViewerId(),
                        viewer.getRankTier(), viewer.getRankDivision());
                continue;
            }
            RankObservation rank = effective.get();
            entries.add(new ViewerScoreEntry(viewer.getViewerId(), viewer.getDisplayName(), rank, rankScore.score(rank)));
        }
        return entries;
    }

    /**
     * Pure summary of scored viewers. Top viewers are ordered by descending score; equal scores keep the
     * order in which the entries were supplied.
     */
    public WindowStats summarize(List<ViewerScoreEntry> entries) {
        if (entries.isEmpty()) return WindowStats.EMPTY;

        int count = entries.size();
        double[] sorted = entries.stream().mapToDouble(ViewerScoreEntry::score).sorted().toArray();
        double sum = 0;
        for (double s : sorted) sum += s;
        double mean = sum / count;
        double median = count % 2 == 1
                ? sorted[count / 2]
                : (sorted[count / 2 - 1] + sorted[count / 2]) / 2.0;

        List<TopViewer> top = entries.stream()
                .sorted(Comparator.comparingDouble(ViewerScoreEntry::score).reversed())
                .limit(statsProperties.topViewers())
                .map(e -> new TopViewer(e.displayName(), e.rank().tier().name(), e.rank().divisionName(),
                        e.rank().points(), Math.round(e.score() * 10) / 10.0))
                .toList();

        return new WindowStats(count, mean, median, rankScore.scoreToRank(mean), rankScore.scoreToRank(median),
                top, count >= statsProperties.eligibleMinViewers());
    }

    private ChannelStats toChannelStats(String channelLogin, String displayName, LocalDate statDate, WindowStats stats) {
        ChannelStats row = new ChannelStats();
        row.setChannelLogin(channelLogin);
        row.setDisplayName(displayName);
        row.setAggregate(toAggregate(stats));
        row.setLastComputedStatDate(statDate);
        return row;
    }

    private ChannelDailySnapshot toDailySnapshot(String channelLogin, LocalDate statDate, WindowStats daily, WindowStats allTime) {
        ChannelDailySnapshot row = new ChannelDailySnapshot();
        row.setId(new ChannelDailySnapshot.Key(statDate, channelLogin));
        row.setAggregate(toAggregate(daily));
        row.setAlltimeViewerCount(allTime.viewerCount());
        row.setAlltimeMeanScore(allTime.meanScore());
        row.setAlltimeMedianScore(allTime.medianScore());
        return row;
    }

    private RankAggregate toAggregate(WindowStats stats) {
        RankAggregate aggregate = new RankAggregate();
        aggregate.setViewerCount(stats.viewerCount());
        aggregate.setMeanScore(stats.meanScore());
        aggregate.setMedianScore(stats.medianScore());
        if (stats.meanRank() != null) {
            aggregate.setMeanTier(stats.meanRank().tier().name());
            aggregate.setMeanDivision(stats.meanRank().divisionName());
            aggregate.setMeanPoints(stats.meanRank().points());
        }
        if (stats.medianRank() != null) {
            aggregate.setMedianTier(stats.medianRank().tier().name());
            aggregate.setMedianDivision(stats.medianRank().divisionName());
            aggregate.setMedianPoints(stats.medianRank().points());
        }
        aggregate.setTopViewersJson(writeTopViewers(stats.topViewers()));
        aggregate.setEligible(stats.eligible());
        return aggregate;
    }

    private String writeTopViewers(List<TopViewer> topViewers) {
        try {
            return objectMapper.writeValueAsString(topViewers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize top viewers", e);
        }
    }
}
