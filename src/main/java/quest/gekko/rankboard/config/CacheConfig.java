package quest.gekko.rankboard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LEADERBOARD = "leaderboard";
    public static final String CHANNEL_STATS = "channelStats";
    public static final String CHANNEL_TREND = "channelTrend";

    // Stats only change once per cycle and every cycle evicts, so the TTL is only a backstop
    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(30));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(LEADERBOARD, CHANNEL_STATS, CHANNEL_TREND);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }
}
