package quest.gekko.rankboard.domain;

/** One row of a channel's top-10 list, stored as JSON on the stats rows. */
public record TopViewer(String displayName, String tier, String division, int points, double score) {}
