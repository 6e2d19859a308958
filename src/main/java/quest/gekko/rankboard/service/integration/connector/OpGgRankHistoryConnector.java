package quest.gekko.rankboard.service.integration.connector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import quest.gekko.rankboard.config.RankBoardProperties;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.ViewerRank;
import quest.gekko.rankboard.util.RateLimiter;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads season history and the recorded "Top Tier" peak from a public op.gg profile page.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OpGgRankHistoryConnector implements RankHistoryConnector {
    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final RankBoardProperties.OpGg opGg;

    static final Map<String, String> REGIONS = Map.ofEntries(
            Map.entry("na1", "na"), Map.entry("euw1", "euw"), Map.entry("eun1", "eune"),
            Map.entry("kr", "kr"), Map.entry("br1", "br"), Map.entry("jp1", "jp"),
            Map.entry("la1", "lan"), Map.entry("la2", "las"), Map.entry("oc1", "oce"),
            Map.entry("tr1", "tr"), Map.entry("ru", "ru"), Map.entry("me1", "me"),
            Map.entry("sea", "sea"), Map.entry("sg2", "sea"), Map.entry("tw2", "tw"),
            Map.entry("vn2", "vn")
    );

    private static final String LP_SPAN = "<span class=\"text-xs text-gray-500\">([0-9,]+)(?:<!--[^>]*-->)?\\s*LP</span>";

    private static final Pattern CURRENT = Pattern.compile(
            "<strong class=\"text-xl first-letter:uppercase\">([^<]+)</strong>[\\s\\S]*?" + LP_SPAN);
    private static final Pattern PEAK = Pattern.compile(
            "<strong class=\"text-sm first-letter:uppercase\">([^<]+)</strong>[\\s\\S]*?" + LP_SPAN
                    + "[\\s\\S]*?<span[^>]*>Top Tier</span>");
    private static final Pattern SEASON_ROW = Pattern.compile(
            "<tr class=\"bg-main-100[^\"]*\"[^>]*>.*?<strong[^>]*>(S\\d{4}[^<]*)</strong>.*?"
                    + "<span class=\"text-xs lowercase first-letter:uppercase\">([^<]+)</span>.*?"
                    + "<td align=\"right\" class=\"text-xs text-gray-500\">([0-9,]+)</td>",
            Pattern.DOTALL);

    @Override
    public List<RankObservation> fetchHistory(ViewerRank viewer) {
        Optional<URI> profile = profileUri(viewer.getRiotId(), viewer.getRegion());
        if (profile.isEmpty()) {
            log.warn("[PeakSeed] No profile URL for {} ({}, region {})", viewer.getViewerId(), viewer.getRiotId(), viewer.getRegion());
            return List.of();
        }

        String html;
        try {
            html = rateLimiter.call(() -> http.get()
                    .uri(profile.get())
                    .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml")
                    .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block());
        } catch (WebClientResponseException.NotFound e) {
            log.info("[PeakSeed] Profile not found for {} - likely new account", viewer.getRiotId());
            return List.of();
        } catch (WebClientException e) {
            throw new RankSourceUnavailableException("Profile fetch failed for " + viewer.getRiotId() + ": " + e.getMessage(), e);
        }
        return html == null ? List.of() : parse(html);
    }

    Optional<URI> profileUri(String riotId, String region) {
        if (riotId == null || riotId.isBlank() || region == null) return Optional.empty();
        String opggRegion = REGIONS.get(region.toLowerCase(Locale.ROOT));
        if (opggRegion == null) return Optional.empty();

        String[] parts = riotId.split("#", 2);
        String tagLine = parts.length > 1 && !parts[1].isBlank() ? parts[1] : region.toUpperCase(Locale.ROOT);
        return Optional.of(UriComponentsBuilder.fromHttpUrl(opGg.baseUrl())
                .pathSegment("lol", "summoners", opggRegion, parts[0] + "-" + tagLine)
                .queryParam("queue_type", "SOLORANKED")
                .encode()
                .build()
                .toUri());
    }

    /** Current rank first, then the recorded peak, then past seasons in page order. */
    List<RankObservation> parse(String html) {
        List<RankObservation> ranks = new ArrayList<>();

        Matcher current = CURRENT.matcher(html);
        if (current.find()) toRank(current.group(1), current.group(2)).ifPresent(ranks::add);

        Matcher peak = PEAK.matcher(html);
        if (peak.find()) toRank(peak.group(1), peak.group(2)).ifPresent(ranks::add);

        Matcher season = SEASON_ROW.matcher(html);
        while (season.find()) {
            toRank(season.group(2), season.group(3)).ifPresent(ranks::add);
        }
        return ranks;
    }

    private static Optional<RankObservation> toRank(String rankText, String lpText) {
        String[] parts = rankText.trim().split("\\s+");
        String digits = lpText.replaceAll("[^0-9]", "");
        int lp = digits.isEmpty() ? 0 : Integer.parseInt(digits);
        return RankObservation.parse(parts[0], parts.length > 1 ? parts[1] : null, lp);
    }
}
