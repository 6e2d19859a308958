package quest.gekko.rankboard.service.core;

import java.time.LocalDate;

/** Outcome of one channel in one cycle. {@code daily} is null when no viewer qualified that day. */
public record ChannelAggregation(String channelLogin, LocalDate statDate, WindowStats allTime, WindowStats daily) {

    public boolean hasDaily() {
        return daily != null;
    }
}
