package quest.gekko.rankboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.rankboard.repository.ChannelViewerDailyRepository;
import quest.gekko.rankboard.util.ChannelNames;

import java.time.LocalDate;

@Service
@RequiredArgsConstructor
@Slf4j
public class ViewerSessionService {

    private final ChannelViewerDailyRepository viewerRepository;
    private final WindowClock windowClock;

    /**
     * Attributes a qualified view to the current window. Repeats within the same window are ignored.
     *
     * @return true when this was the viewer's first qualified view of the channel in the window
     */
    @Transactional
    public boolean recordView(String channel, String viewerId) {
        String login = ChannelNames.sanitize(channel)
                .orElseThrow(() -> new IllegalArgumentException("Invalid channel name: " + channel));
        if (viewerId == null || viewerId.isBlank()) {
            throw new IllegalArgumentException("viewerId is required");
        }
        LocalDate statDate = windowClock.statDate();
        boolean inserted = viewerRepository.recordView(statDate, login, viewerId) > 0;
        if (inserted) log.debug("Recorded view of {} by {} on {}", login, viewerId, statDate);
        return inserted;
    }
}
