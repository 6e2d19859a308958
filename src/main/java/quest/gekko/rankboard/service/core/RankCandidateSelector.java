package quest.gekko.rankboard.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.rankboard.domain.RankObservation;

import java.util.List;
import java.util.Optional;

/**
 * Picks the best of a set of historical readings by score. Ties keep the first candidate in list order.
 */
@Component
@RequiredArgsConstructor
public class RankCandidateSelector {
    private final RankScore rankScore;

    public Optional<RankObservation> selectHighest(List<RankObservation> candidates) {
        RankObservation best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (RankObservation candidate : candidates) {
            if (candidate == null) continue;
            double score = rankScore.score(candidate);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }
}
