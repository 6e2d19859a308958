package quest.gekko.rankboard.web.dto;

import quest.gekko.rankboard.domain.TopViewer;

import java.time.LocalDate;
import java.util.List;

/**
 * All-time figures of one channel. {@code leaderboardRank} is null while the channel is not eligible.
 */
public record ChannelStatsDTO(String channel,
                              String displayName,
                              int viewerCount,
                              Double meanScore,
                              String meanTier,
                              String meanDivision,
                              Integer meanLp,
                              Double medianScore,
                              String medianTier,
                              String medianDivision,
                              Integer medianLp,
                              List<TopViewer> topViewers,
                              boolean eligible,
                              Long leaderboardRank,
                              LocalDate lastComputedStatDate) {}
