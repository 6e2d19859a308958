package quest.gekko.rankboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.rankboard.domain.ViewerRank;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ViewerRankRepository extends JpaRepository<ViewerRank, String> {

    Optional<ViewerRank> findFirstByDisplayNameOrderByLastUpdatedDesc(final String displayName);

    List<ViewerRank> findByLastUpdatedBeforeOrderByLastUpdatedAsc(final Instant cutoff);

    // show_peak is a viewer preference owned by the account side, so it is never touched here
    @Modifying
    @Query(value = """
        INSERT INTO viewer_rank
          (viewer_id, display_name, riot_id, region, rank_tier, rank_division, lp,
           peak_tier, peak_division, peak_lp, show_peak, plus_active, last_updated)
        VALUES (:#{#r.viewerId}, :#{#r.displayName}, :#{#r.riotId}, :#{#r.region},
                :#{#r.rankTier}, :#{#r.rankDivision}, CAST(:#{#r.lp} AS integer),
                :#{#r.peakTier}, :#{#r.peakDivision}, CAST(:#{#r.peakLp} AS integer),
                :#{#r.showPeak}, :#{#r.plusActive}, :#{#r.lastUpdated})
        ON CONFLICT (viewer_id) DO UPDATE SET
          display_name = excluded.display_name,
          riot_id = excluded.riot_id,
          region = excluded.region,
          rank_tier = excluded.rank_tier,
          rank_division = excluded.rank_division,
          lp = excluded.lp,
          peak_tier = excluded.peak_tier,
          peak_division = excluded.peak_division,
          peak_lp = excluded.peak_lp,
          plus_active = excluded.plus_active,
          last_updated = excluded.last_updated
        """, nativeQuery = true)
    int upsert(@Param("r") final ViewerRank rank);

    @Modifying
    @Query(value = """
        UPDATE viewer_rank
           SET peak_tier = :tier, peak_division = :division, peak_lp = :lp
         WHERE viewer_id = :viewerId
        """, nativeQuery = true)
    int updatePeak(@Param("viewerId") final String viewerId,
                   @Param("tier") final String tier,
                   @Param("division") final String division,
                   @Param("lp") final int lp);
}
