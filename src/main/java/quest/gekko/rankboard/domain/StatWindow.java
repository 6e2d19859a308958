package quest.gekko.rankboard.domain;

import java.time.LocalDate;

/**
 * Either the unbounded all-time window or one canonical day keyed by its window start date.
 */
public record StatWindow(LocalDate day) {

    public static final StatWindow ALL_TIME = new StatWindow(null);

    public static StatWindow day(LocalDate day) {
        if (day == null) throw new IllegalArgumentException("day is required");
        return new StatWindow(day);
    }

    public boolean isAllTime() {
        return day == null;
    }

    @Override
    public String toString() {
        return isAllTime() ? "all-time" : day.toString();
    }
}
