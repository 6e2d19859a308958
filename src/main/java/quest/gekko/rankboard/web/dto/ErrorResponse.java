package quest.gekko.rankboard.web.dto;

public record ErrorResponse(String error, int status) {}
