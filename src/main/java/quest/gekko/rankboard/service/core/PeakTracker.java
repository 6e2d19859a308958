package quest.gekko.rankboard.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.ViewerRank;

/**
 * Decides whether a new reading replaces a viewer's lifetime peak.
 *
 * Order: tier first; within an apex tier only points count; otherwise the higher division wins and
 * points break the remaining tie. Equal ranks are never higher.
 */
@Component
public class PeakTracker {

    /**
     * @param candidate  the new reading, null when it could not be parsed
     * @param storedPeak the current peak, null when absent or unparseable
     */
    public boolean isHigher(RankObservation candidate, RankObservation storedPeak) {
        if (storedPeak == null) return true;
        if (candidate == null) return false;

        int byTier = Integer.compare(candidate.tier().ordinal(), storedPeak.tier().ordinal());
        if (byTier != 0) return byTier > 0;

        if (!candidate.tier().isApex()) {
            int byDivision = Integer.compare(candidate.division().ordinal(), storedPeak.division().ordinal());
            if (byDivision != 0) return byDivision > 0;
        }
        return candidate.points() > storedPeak.points();
    }

    /**
     * Applies a reading to the row's peak columns. An explicit peak is written as given; otherwise the
     * observation replaces the peak only when it is higher, leaving every previous peak field intact.
     */
    public PeakUpdate apply(ViewerRank row, RankObservation observation, RankObservation explicitPeak) {
        if (explicitPeak != null) {
            row.setPeak(explicitPeak);
            return PeakUpdate.EXPLICIT_OVERRIDE;
        }
        if (isHigher(observation, row.peak().orElse(null))) {
            row.setPeak(observation);
            return PeakUpdate.RANK_COMPARISON;
        }
        return PeakUpdate.UNCHANGED;
    }
}
