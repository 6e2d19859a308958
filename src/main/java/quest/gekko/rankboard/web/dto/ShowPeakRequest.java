package quest.gekko.rankboard.web.dto;

public record ShowPeakRequest(boolean showPeak) {}
