package quest.gekko.rankboard.service.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.rankboard.config.CacheConfig;
import quest.gekko.rankboard.domain.ChannelDailySnapshot;
import quest.gekko.rankboard.domain.ChannelStats;
import quest.gekko.rankboard.domain.RankAggregate;
import quest.gekko.rankboard.domain.TopViewer;
import quest.gekko.rankboard.repository.ChannelDailySnapshotRepository;
import quest.gekko.rankboard.repository.ChannelStatsRepository;
import quest.gekko.rankboard.web.dto.ChannelStatsDTO;
import quest.gekko.rankboard.web.dto.LeaderboardEntryDTO;
import quest.gekko.rankboard.web.dto.LeaderboardPageDTO;
import quest.gekko.rankboard.web.dto.TrendPointDTO;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the stored statistics. Results are cached until the next aggregation cycle evicts them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class LeaderboardService {

    public static final int MAX_LIMIT = 500;
    public static final int MAX_TREND_DAYS = 365;

    private static final TypeReference<List<TopViewer>> TOP_VIEWERS = new TypeReference<>() {};

    private final ChannelStatsRepository statsRepository;
    private final ChannelDailySnapshotRepository snapshotRepository;
    private final WindowClock windowClock;
    private final ObjectMapper objectMapper;

    @Cacheable(value = CacheConfig.LEADERBOARD, key = "#limit + ':' + #offset")
    public LeaderboardPageDTO leaderboard(int limit, int offset) {
        int pageLimit = Math.max(1, Math.min(MAX_LIMIT, limit));
        int pageOffset = Math.max(0, offset);

        List<ChannelStats> rows = statsRepository.findLeaderboard(pageLimit, pageOffset);
        long total = statsRepository.countByAggregateEligibleTrue();

        List<LeaderboardEntryDTO> entries = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ChannelStats row = rows.get(i);
            RankAggregate a = row.getAggregate();
            entries.add(new LeaderboardEntryDTO(pageOffset + i + 1, row.getChannelLogin(), row.getDisplayName(),
                    a.getViewerCount(), a.getMeanScore(), a.getMeanTier(), a.getMeanDivision(), a.getMeanPoints()));
        }
        return new LeaderboardPageDTO(entries, total, pageLimit, pageOffset, pageOffset + rows.size() < total);
    }

    @Cacheable(value = CacheConfig.CHANNEL_STATS, key = "#login")
    public Optional<ChannelStatsDTO> channelStats(String login) {
        return statsRepository.findById(login).map(row -> {
            RankAggregate a = row.getAggregate();
            Long position = a.isEligible() && a.getMeanScore() != null
                    ? statsRepository.countEligibleAbove(a.getMeanScore()) + 1
                    : null;
            return new ChannelStatsDTO(row.getChannelLogin(), row.getDisplayName(), a.getViewerCount(),
                    a.getMeanScore(), a.getMeanTier(), a.getMeanDivision(), a.getMeanPoints(),
                    a.getMedianScore(), a.getMedianTier(), a.getMedianDivision(), a.getMedianPoints(),
                    readTopViewers(row.getChannelLogin(), a.getTopViewersJson()), a.isEligible(), position,
                    row.getLastComputedStatDate());
        });
    }

    @Cacheable(value = CacheConfig.CHANNEL_TREND, key = "#login + ':' + #days")
    public List<TrendPointDTO> trend(String login, int days) {
        int window = Math.max(1, Math.min(MAX_TREND_DAYS, days));
        LocalDate since = windowClock.statDate().minusDays(window - 1L);
        return snapshotRepository.findTrend(login, since).stream()
                .map(LeaderboardService::toTrendPoint)
                .toList();
    }

    private static TrendPointDTO toTrendPoint(ChannelDailySnapshot d) {
        RankAggregate a = d.getAggregate();
        return new TrendPointDTO(d.getId().getStatDate(), a.getViewerCount(), a.getMeanScore(), a.getMedianScore(),
                a.getMeanTier(), a.getMeanDivision(), a.getMeanPoints(),
                d.getAlltimeViewerCount(), d.getAlltimeMeanScore(), d.getAlltimeMedianScore());
    }

    private List<TopViewer> readTopViewers(String login, String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, TOP_VIEWERS);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable top viewers for {}: {}", login, e.getMessage());
            return List.of();
        }
    }
}
