package quest.gekko.rankboard.service.integration.connector;

import quest.gekko.rankboard.domain.RankObservation;

import java.util.Optional;

public interface CurrentRankSource {

    /**
     * Current solo-queue rank of a viewer.
     *
     * @return empty only when the source explicitly reports the viewer as unranked
     * @throws RankSourceUnavailableException when the source cannot be reached or answers with an error
     */
    Optional<RankObservation> fetchCurrentRank(String viewerId, String region);
}
