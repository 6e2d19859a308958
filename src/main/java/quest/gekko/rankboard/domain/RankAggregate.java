package quest.gekko.rankboard.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

/**
 * Aggregate columns shared by the all-time and the daily stats rows.
 * All score and rank fields are null in the zero-viewer state.
 */
@Embeddable
@Getter @Setter
public class RankAggregate {
    @Column(name = "viewer_count", nullable = false)
    int viewerCount;

    Double meanScore;
    String meanTier;
    String meanDivision;
    Integer meanPoints;

    Double medianScore;
    String medianTier;
    String medianDivision;
    Integer medianPoints;

    /** JSON array of {@link TopViewer}, highest score first. */
    @Column(name = "top_viewers_json", columnDefinition = "text")
    String topViewersJson;

    @Column(nullable = false)
    boolean eligible;
}
