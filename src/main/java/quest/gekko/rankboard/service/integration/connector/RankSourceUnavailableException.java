package quest.gekko.rankboard.service.integration.connector;

/** A rank source could not answer. Means "no observation", never "unranked". */
public class RankSourceUnavailableException extends RuntimeException {

    public RankSourceUnavailableException(String message) {
        super(message);
    }

    public RankSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
