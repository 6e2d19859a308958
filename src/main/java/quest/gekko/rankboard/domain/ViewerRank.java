package quest.gekko.rankboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

/**
 * Current rank and lifetime peak of one viewer, keyed by the stable rank identity.
 */
@Entity
@Table(name = "viewer_rank", indexes = @Index(name = "idx_viewer_rank_display_name", columnList = "display_name"))
@Getter @Setter
public class ViewerRank {
    @Id
    @Column(name = "viewer_id", nullable = false)
    String viewerId;

    /** Current streaming username, lower-case. Mutable, never used as a key. */
    @Column(name = "display_name", nullable = false)
    String displayName;

    String riotId;
    String region;

    @Column(name = "rank_tier", nullable = false)
    String rankTier;
    String rankDivision;
    Integer lp;

    String peakTier;
    String peakDivision;
    Integer peakLp;

    boolean showPeak;
    boolean plusActive;

    @Column(nullable = false)
    Instant lastUpdated;

    public Optional<RankObservation> current() {
        return RankObservation.parse(rankTier, rankDivision, lp);
    }

    public Optional<RankObservation> peak() {
        return RankObservation.parse(peakTier, peakDivision, peakLp);
    }

    public void setCurrent(RankObservation observation) {
        this.rankTier = observation.tier().name();
        this.rankDivision = observation.divisionName();
        this.lp = observation.points();
    }

    public void setPeak(RankObservation observation) {
        this.peakTier = observation.tier().name();
        this.peakDivision = observation.divisionName();
        this.peakLp = observation.points();
    }
}
