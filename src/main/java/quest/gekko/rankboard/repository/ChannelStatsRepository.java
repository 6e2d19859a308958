package quest.gekko.rankboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.rankboard.domain.ChannelStats;

import java.util.List;

public interface ChannelStatsRepository extends JpaRepository<ChannelStats, String> {

    @Query("select s.channelLogin from ChannelStats s where s.aggregate.eligible = true")
    List<String> findEligibleChannelLogins();

    @Query(value = """
        SELECT * FROM channel_stats
        WHERE eligible = true
        ORDER BY mean_score DESC, channel_login ASC
        LIMIT :limit OFFSET :offset
        """, nativeQuery = true)
    List<ChannelStats> findLeaderboard(@Param("limit") final int limit, @Param("offset") final int offset);

    long countByAggregateEligibleTrue();

    @Query("select count(s) from ChannelStats s where s.aggregate.eligible = true and s.aggregate.meanScore > :score")
    long countEligibleAbove(@Param("score") final double score);

    @Modifying
    @Query(value = """
        INSERT INTO channel_stats
          (channel_login, display_name, viewer_count,
           mean_score, mean_tier, mean_division, mean_points,
           median_score, median_tier, median_division, median_points,
           top_viewers_json, eligible, last_computed_stat_date)
        VALUES (:#{#s.channelLogin}, :#{#s.displayName}, :#{#s.aggregate.viewerCount},
                CAST(:#{#s.aggregate.meanScore} AS double precision), :#{#s.aggregate.meanTier}, :#{#s.aggregate.meanDivision}, CAST(:#{#s.aggregate.meanPoints} AS integer),
                CAST(:#{#s.aggregate.medianScore} AS double precision), :#{#s.aggregate.medianTier}, :#{#s.aggregate.medianDivision}, CAST(:#{#s.aggregate.medianPoints} AS integer),
                :#{#s.aggregate.topViewersJson}, :#{#s.aggregate.eligible}, :#{#s.lastComputedStatDate})
        ON CONFLICT (channel_login) DO UPDATE SET
          display_name = excluded.display_name,
          viewer_count = excluded.viewer_count,
          mean_score = excluded.mean_score,
          mean_tier = excluded.mean_tier,
          mean_division = excluded.mean_division,
          mean_points = excluded.mean_points,
          median_score = excluded.median_score,
          median_tier = excluded.median_tier,
          median_division = excluded.median_division,
          median_points = excluded.median_points,
          top_viewers_json = excluded.top_viewers_json,
          eligible = excluded.eligible,
          last_computed_stat_date = excluded.last_computed_stat_date
        """, nativeQuery = true)
    int upsert(@Param("s") final ChannelStats stats);
}
