package quest.gekko.rankboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for scoring, windows, the stats cycle and outbound integrations
 */
@Configuration
@EnableConfigurationProperties({
        RankBoardProperties.Scoring.class,
        RankBoardProperties.Window.class,
        RankBoardProperties.Stats.class,
        RankBoardProperties.Riot.class,
        RankBoardProperties.OpGg.class,
        RankBoardProperties.Security.class
})
public class RankBoardProperties {

    /** Points-in-pool cutoffs used when turning an apex score back into a tier. Heuristic, not ladder data. */
    @ConfigurationProperties("rankboard.scoring")
    public record Scoring(@DefaultValue("300") int grandmasterMinPoints,
                          @DefaultValue("700") int challengerMinPoints) {}

    @ConfigurationProperties("rankboard.window")
    public record Window(@DefaultValue("7") int resetHour) {}

    @ConfigurationProperties("rankboard.stats")
    public record Stats(@DefaultValue("50") int batchSize,
                        @DefaultValue("10") int eligibleMinViewers,
                        @DefaultValue("10") int topViewers) {}

    @ConfigurationProperties("rankboard.riot")
    public record Riot(String apiKey,
                       @DefaultValue("24h") Duration staleAfter,
                       @DefaultValue("50") int refreshBatchSize) {}

    @ConfigurationProperties("rankboard.opgg")
    public record OpGg(@DefaultValue("https://op.gg") String baseUrl) {}

    @ConfigurationProperties("security.admin")
    public record Security(String username, String password) {}
}
