package quest.gekko.rankboard.web.dto;

import java.util.List;

public record LeaderboardPageDTO(List<LeaderboardEntryDTO> entries, long total, int limit, int offset, boolean hasMore) {}
