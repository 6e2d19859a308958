package quest.gekko.rankboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.rankboard.domain.ChannelDailySnapshot;

import java.time.LocalDate;
import java.util.List;

public interface ChannelDailySnapshotRepository extends JpaRepository<ChannelDailySnapshot, ChannelDailySnapshot.Key> {

    @Query("""
        select d from ChannelDailySnapshot d
        where d.id.channelLogin = :channel and d.id.statDate >= :since
        order by d.id.statDate desc
        """)
    List<ChannelDailySnapshot> findTrend(@Param("channel") final String channelLogin, @Param("since") final LocalDate since);

    @Modifying
    @Query(value = """
        INSERT INTO channel_daily_snapshot
          (stat_date, channel_login, viewer_count,
           mean_score, mean_tier, mean_division, mean_points,
           median_score, median_tier, median_division, median_points,
           top_viewers_json, eligible,
           alltime_viewer_count, alltime_mean_score, alltime_median_score)
        VALUES (:#{#d.id.statDate}, :#{#d.id.channelLogin}, :#{#d.aggregate.viewerCount},
                CAST(:#{#d.aggregate.meanScore} AS double precision), :#{#d.aggregate.meanTier}, :#{#d.aggregate.meanDivision}, CAST(:#{#d.aggregate.meanPoints} AS integer),
                CAST(:#{#d.aggregate.medianScore} AS double precision), :#{#d.aggregate.medianTier}, :#{#d.aggregate.medianDivision}, CAST(:#{#d.aggregate.medianPoints} AS integer),
                :#{#d.aggregate.topViewersJson}, :#{#d.aggregate.eligible},
                CAST(:#{#d.alltimeViewerCount} AS integer), CAST(:#{#d.alltimeMeanScore} AS double precision), CAST(:#{#d.alltimeMedianScore} AS double precision))
        ON CONFLICT (stat_date, channel_login) DO UPDATE SET
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
          alltime_viewer_count = excluded.alltime_viewer_count,
          alltime_mean_score = excluded.alltime_mean_score,
          alltime_median_score = excluded.alltime_median_score
        """, nativeQuery = true)
    int upsert(@Param("d") final ChannelDailySnapshot snapshot);
}
