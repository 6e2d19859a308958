package quest.gekko.rankboard.web.dto;

import quest.gekko.rankboard.service.core.PeakUpdate;

/** {@code peakUpdated} is the name of the path that moved the peak, or {@code false}. */
public record RankWriteResponse(String viewerId, Object peakUpdated) {

    public static RankWriteResponse of(String viewerId, PeakUpdate update) {
        return new RankWriteResponse(viewerId, update.changed() ? update.wireName() : Boolean.FALSE);
    }
}
