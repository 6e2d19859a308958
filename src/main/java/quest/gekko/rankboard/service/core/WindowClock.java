package quest.gekko.rankboard.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.rankboard.config.RankBoardProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Daily attribution windows start at a fixed UTC hour rather than midnight. A window is keyed by the
 * date on which it starts, so 03:00 UTC still belongs to the previous date's window.
 */
@Component
public class WindowClock {
    private final Clock clock;
    private final int resetHour;

    public WindowClock(final Clock clock, final RankBoardProperties.Window window) {
        if (window.resetHour() < 0 || window.resetHour() > 23) {
            throw new IllegalArgumentException("reset hour must be within 0..23, got " + window.resetHour());
        }
        this.clock = clock;
        this.resetHour = window.resetHour();
    }

    public LocalDate statDate() {
        return statDateOf(clock.instant());
    }

    public LocalDate statDateOf(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        LocalDate date = utc.toLocalDate();
        return utc.getHour() < resetHour ? date.minusDays(1) : date;
    }

    public Instant now() {
        return clock.instant();
    }
}
