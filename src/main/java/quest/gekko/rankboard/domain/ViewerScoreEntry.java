package quest.gekko.rankboard.domain;

/** A viewer scored for one channel window. Lives only for the duration of one aggregation. */
public record ViewerScoreEntry(String viewerId, String displayName, RankObservation rank, double score) {}
