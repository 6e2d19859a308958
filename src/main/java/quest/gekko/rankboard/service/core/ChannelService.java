package quest.gekko.rankboard.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.rankboard.repository.ChannelRepository;
import quest.gekko.rankboard.util.ChannelNames;
import quest.gekko.rankboard.web.dto.ChannelUpsertRequest;

@Service
@RequiredArgsConstructor
public class ChannelService {

    private final ChannelRepository channelRepository;

    /** Registers a channel or refreshes its display name and linked rank identity. Null fields keep stored values. */
    @Transactional
    public String upsertChannel(ChannelUpsertRequest request) {
        String login = ChannelNames.sanitize(request.login())
                .orElseThrow(() -> new IllegalArgumentException("Invalid channel name: " + request.login()));
        String linked = request.linkedViewerId() == null || request.linkedViewerId().isBlank()
                ? null : request.linkedViewerId();
        channelRepository.upsert(login, request.displayName(), linked);
        return login;
    }
}
