package quest.gekko.rankboard.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Divisions inside a non-apex tier, lowest first. The ordinal doubles as the 100-point sub-block index.
 */
public enum Division {
    IV,
    III,
    II,
    I;

    public int offset() {
        return ordinal() * 100;
    }

    /** Accepts roman numerals and the numeric form ("1".."4") used by some profile pages. */
    public static Optional<Division> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "I", "1" -> Optional.of(I);
            case "II", "2" -> Optional.of(II);
            case "III", "3" -> Optional.of(III);
            case "IV", "4" -> Optional.of(IV);
            default -> Optional.empty();
        };
    }
}
