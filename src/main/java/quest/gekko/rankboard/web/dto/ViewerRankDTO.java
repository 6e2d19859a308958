package quest.gekko.rankboard.web.dto;

import quest.gekko.rankboard.domain.RankObservation;

public record ViewerRankDTO(String displayName, String tier, String division, int lp, boolean peak) {

    public static ViewerRankDTO of(String displayName, RankObservation rank, boolean peak) {
        return new ViewerRankDTO(displayName, rank.tier().name(), rank.divisionName(), rank.points(), peak);
    }
}
