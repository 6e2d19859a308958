package quest.gekko.rankboard.service.core;

import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.TopViewer;

import java.util.List;

/**
 * Computed statistics of one channel window. Mean/median fields are null when no viewer qualified.
 */
public record WindowStats(int viewerCount,
                          Double meanScore,
                          Double medianScore,
                          RankObservation meanRank,
                          RankObservation medianRank,
                          List<TopViewer> topViewers,
                          boolean eligible) {

    public static final WindowStats EMPTY = new WindowStats(0, null, null, null, null, List.of(), false);

    public WindowStats {
        topViewers = List.copyOf(topViewers);
    }

    public boolean isEmpty() {
        return viewerCount == 0;
    }
}
