package quest.gekko.rankboard.service.integration.connector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import quest.gekko.rankboard.config.RankBoardProperties;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.util.RateLimiter;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class RiotLeagueConnector implements CurrentRankSource {
    static final String SOLO_QUEUE = "RANKED_SOLO_5x5";

    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final RankBoardProperties.Riot riot;

    @Override
    public Optional<RankObservation> fetchCurrentRank(String viewerId, String region) {
        if (riot.apiKey() == null || riot.apiKey().isBlank()) {
            throw new RankSourceUnavailableException("Riot API key not configured");
        }
        if (region == null || region.isBlank()) {
            throw new RankSourceUnavailableException("No region known for viewer " + viewerId);
        }

        List<Map<String, Object>> entries;
        try {
            entries = rateLimiter.call(() -> http.get()
                    .uri(uri -> uri.scheme("https").host(region.toLowerCase(Locale.ROOT) + ".api.riotgames.com")
                            .path("/lol/league/v4/entries/by-puuid/{puuid}")
                            .build(viewerId))
                    .header("X-Riot-Token", riot.apiKey())
                    .retrieve()
                    .bodyToFlux(Map.class)
                    .map(m -> (Map<String, Object>) m)
                    .collectList()
                    .block());
        } catch (WebClientException e) {
            throw new RankSourceUnavailableException("League lookup failed for " + viewerId + ": " + e.getMessage(), e);
        }
        return soloQueueRank(entries == null ? List.of() : entries, viewerId);
    }

    Optional<RankObservation> soloQueueRank(List<Map<String, Object>> entries, String viewerId) {
        for (Map<String, Object> entry : entries) {
            if (!SOLO_QUEUE.equals(entry.get("queueType"))) continue;

            Object lp = entry.get("leaguePoints");
            Optional<RankObservation> rank = RankObservation.parse(
                    (String) entry.get("tier"),
                    (String) entry.get("rank"),
                    lp instanceof Number n ? n.intValue() : 0);
            if (rank.isEmpty()) {
                throw new RankSourceUnavailableException("Unrecognised tier " + entry.get("tier") + " for " + viewerId);
            }
            return rank;
        }
        return Optional.empty();
    }
}
