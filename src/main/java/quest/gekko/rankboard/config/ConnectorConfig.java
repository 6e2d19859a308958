package quest.gekko.rankboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class ConnectorConfig {

    // Profile pages are large, the default 256 KB buffer is not enough
    private static final int MAX_BODY_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient webClient(final WebClient.Builder builder) {
        return builder
                .defaultHeader(HttpHeaders.USER_AGENT,
                        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36")
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                        .build())
                .build();
    }
}
