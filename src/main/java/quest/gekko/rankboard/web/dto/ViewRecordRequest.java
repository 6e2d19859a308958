package quest.gekko.rankboard.web.dto;

/** One qualified view: a viewer with a linked rank identity watched a channel long enough to count. */
public record ViewRecordRequest(String channel, String viewerId) {}
