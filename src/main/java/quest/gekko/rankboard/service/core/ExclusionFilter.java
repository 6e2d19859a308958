package quest.gekko.rankboard.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.rankboard.domain.StatWindow;
import quest.gekko.rankboard.domain.ViewerRank;
import quest.gekko.rankboard.repository.ChannelViewerDailyRepository;
import quest.gekko.rankboard.repository.ViewerRankRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves the viewers that count towards a channel's statistics for one window.
 *
 * Viewers are de-duplicated by rank identity, then the streamer's own linked identity and every viewer
 * currently named like an eligible streamer are removed. Viewers without a rank row cannot be named or
 * scored and drop out here as well. The result keeps viewer-id order so later tie-breaks are stable.
 */
@Component
@RequiredArgsConstructor
public class ExclusionFilter {

    // Keeps IN lists well under the driver's bind parameter limit
    static final int LOOKUP_CHUNK = 1000;

    private final ChannelViewerDailyRepository viewerRepository;
    private final ViewerRankRepository rankRepository;

    public List<ViewerRank> resolve(String channelLogin, String linkedViewerId, StatWindow window, ExclusionSnapshot snapshot) {
        List<String> viewerIds = window.isAllTime()
                ? viewerRepository.findDistinctViewerIds(channelLogin)
                : viewerRepository.findDistinctViewerIdsOn(channelLogin, window.day());

        List<String> candidates = viewerIds.stream()
                .distinct()
                .filter(id -> !id.equals(linkedViewerId))
                .toList();

        Map<String, ViewerRank> ranks = loadRanks(candidates);
        List<ViewerRank> result = new ArrayList<>(candidates.size());
        for (String id : candidates) {
            ViewerRank rank = ranks.get(id);
            if (rank == null || snapshot.isStreamer(rank.getDisplayName())) continue;
            result.add(rank);
        }
        return result;
    }

    private Map<String, ViewerRank> loadRanks(List<String> ids) {
        List<ViewerRank> rows = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i += LOOKUP_CHUNK) {
            rows.addAll(rankRepository.findAllById(ids.subList(i, Math.min(ids.size(), i + LOOKUP_CHUNK))));
        }
        return rows.stream().collect(Collectors.toMap(ViewerRank::getViewerId, Function.identity(), (a, b) -> a));
    }
}
