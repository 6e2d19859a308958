package quest.gekko.rankboard.service.core;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logins of the channels that were leaderboard-eligible when a cycle started. Captured once and handed to
 * every channel of that cycle so that stats written mid-cycle never shift the exclusion basis.
 */
public record ExclusionSnapshot(Set<String> eligibleChannels) {

    public static final ExclusionSnapshot EMPTY = new ExclusionSnapshot(Set.of());

    public ExclusionSnapshot {
        eligibleChannels = Set.copyOf(eligibleChannels);
    }

    public static ExclusionSnapshot of(Collection<String> channelLogins) {
        return new ExclusionSnapshot(channelLogins.stream()
                .filter(Objects::nonNull)
                .map(login -> login.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet()));
    }

    /** True when the viewer is currently known under the name of an eligible streamer. */
    public boolean isStreamer(String displayName) {
        return displayName != null && eligibleChannels.contains(displayName.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return eligibleChannels.size();
    }
}
