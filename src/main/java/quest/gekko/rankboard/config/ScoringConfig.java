package quest.gekko.rankboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.rankboard.service.core.RankScore;

import java.time.Clock;

@Configuration
public class ScoringConfig {

    @Bean
    public RankScore rankScore(final RankBoardProperties.Scoring scoring) {
        return new RankScore(scoring.grandmasterMinPoints(), scoring.challengerMinPoints());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
