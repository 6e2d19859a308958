package quest.gekko.rankboard.service.integration.connector;

import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.ViewerRank;

import java.util.List;

public interface RankHistoryConnector {

    /**
     * Historical readings (past seasons, recorded peak) for a viewer. An empty list means nothing was found.
     *
     * @throws RankSourceUnavailableException when the history could not be fetched
     */
    List<RankObservation> fetchHistory(ViewerRank viewer);
}
