package quest.gekko.rankboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.rankboard.service.core.ChannelService;
import quest.gekko.rankboard.service.core.PeakReconciliationService;
import quest.gekko.rankboard.service.core.PeakUpdate;
import quest.gekko.rankboard.service.core.RankRefreshService;
import quest.gekko.rankboard.service.core.RankService;
import quest.gekko.rankboard.service.core.ViewerSessionService;
import quest.gekko.rankboard.web.dto.ChannelUpsertRequest;
import quest.gekko.rankboard.web.dto.RankWriteRequest;
import quest.gekko.rankboard.web.dto.RankWriteResponse;
import quest.gekko.rankboard.web.dto.ShowPeakRequest;
import quest.gekko.rankboard.web.dto.ViewRecordRequest;

import java.util.Locale;
import java.util.Map;

/**
 * Write endpoints fed by the account and chat-presence side.
 */
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class IngestController {

    private final RankService rankService;
    private final PeakReconciliationService reconciliationService;
    private final RankRefreshService refreshService;
    private final ViewerSessionService viewerSessionService;
    private final ChannelService channelService;

    @PostMapping("/ranks")
    public RankWriteResponse storeRank(@RequestBody RankWriteRequest request) {
        PeakUpdate update = rankService.storeRank(request);
        // runs after the write has committed
        if (!request.hasExplicitPeak()) {
            reconciliationService.reconcileAsync(request.viewerId());
        }
        return RankWriteResponse.of(request.viewerId(), update);
    }

    @DeleteMapping("/ranks/{viewerId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteRank(@PathVariable String viewerId) {
        rankService.delete(viewerId);
    }

    @PutMapping("/ranks/{viewerId}/show-peak")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void showPeak(@PathVariable String viewerId, @RequestBody ShowPeakRequest request) {
        rankService.setShowPeak(viewerId, request.showPeak());
    }

    @PostMapping("/ranks/{viewerId}/refresh")
    public Map<String, String> refresh(@PathVariable String viewerId) {
        RankRefreshService.Outcome outcome = refreshService.refresh(viewerId);
        return Map.of("viewerId", viewerId, "outcome", outcome.name().toLowerCase(Locale.ROOT));
    }

    @PostMapping("/viewers")
    public Map<String, Boolean> recordView(@RequestBody ViewRecordRequest request) {
        return Map.of("recorded", viewerSessionService.recordView(request.channel(), request.viewerId()));
    }

    @PostMapping("/channels")
    public Map<String, String> upsertChannel(@RequestBody ChannelUpsertRequest request) {
        return Map.of("channel", channelService.upsertChannel(request));
    }
}
