package quest.gekko.rankboard.web.dto;

public record LeaderboardEntryDTO(int position,
                                  String channel,
                                  String displayName,
                                  int viewerCount,
                                  Double meanScore,
                                  String meanTier,
                                  String meanDivision,
                                  Integer meanLp) {}
