package quest.gekko.rankboard.service.core;

/** Which path, if any, changed a viewer's stored peak. */
public enum PeakUpdate {
    EXPLICIT_OVERRIDE("explicit_override"),
    RANK_COMPARISON("rank_comparison"),
    UNCHANGED(null);

    private final String wireName;

    PeakUpdate(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean changed() {
        return this != UNCHANGED;
    }
}
