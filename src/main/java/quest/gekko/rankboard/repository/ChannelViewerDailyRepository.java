package quest.gekko.rankboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.rankboard.domain.ChannelViewerDaily;

import java.time.LocalDate;
import java.util.List;

public interface ChannelViewerDailyRepository extends JpaRepository<ChannelViewerDaily, ChannelViewerDaily.Key> {

    /** Every channel that has ever had a qualified viewer. */
    @Query("select distinct v.id.channelLogin from ChannelViewerDaily v order by v.id.channelLogin")
    List<String> findAllChannelLogins();

    @Query("""
        select distinct v.id.viewerId from ChannelViewerDaily v
        where v.id.channelLogin = :channel
        order by v.id.viewerId
        """)
    List<String> findDistinctViewerIds(@Param("channel") final String channelLogin);

    @Query("""
        select distinct v.id.viewerId from ChannelViewerDaily v
        where v.id.channelLogin = :channel and v.id.statDate = :date
        order by v.id.viewerId
        """)
    List<String> findDistinctViewerIdsOn(@Param("channel") final String channelLogin, @Param("date") final LocalDate date);

    @Modifying
    @Query(value = """
        INSERT INTO channel_viewer_daily (stat_date, channel_login, viewer_id, created_at)
        VALUES (:date, :channel, :viewer, now())
        ON CONFLICT (stat_date, channel_login, viewer_id) DO NOTHING
        """, nativeQuery = true)
    int recordView(@Param("date") final LocalDate date,
                   @Param("channel") final String channelLogin,
                   @Param("viewer") final String viewerId);
}
