package quest.gekko.rankboard.service.core;

import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.ViewerRank;

import java.util.Optional;

/**
 * The rank a viewer is shown and scored with: the peak when they opted to display it and one exists,
 * the current rank otherwise.
 */
public final class EffectiveRank {

    private EffectiveRank() {}

    public static Optional<RankObservation> select(boolean showPeak,
                                                   Optional<RankObservation> peak,
                                                   Optional<RankObservation> current) {
        return showPeak && peak.isPresent() ? peak : current;
    }

    public static Optional<RankObservation> of(ViewerRank viewer) {
        return select(viewer.isShowPeak(), viewer.peak(), viewer.current());
    }
}
