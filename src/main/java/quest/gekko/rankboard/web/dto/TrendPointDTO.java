package quest.gekko.rankboard.web.dto;

import java.time.LocalDate;

public record TrendPointDTO(LocalDate date,
                            int viewerCount,
                            Double meanScore,
                            Double medianScore,
                            String meanTier,
                            String meanDivision,
                            Integer meanLp,
                            Integer alltimeViewerCount,
                            Double alltimeMeanScore,
                            Double alltimeMedianScore) {}
