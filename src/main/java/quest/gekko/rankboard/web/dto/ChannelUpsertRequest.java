package quest.gekko.rankboard.web.dto;

public record ChannelUpsertRequest(String login, String displayName, String linkedViewerId) {}
