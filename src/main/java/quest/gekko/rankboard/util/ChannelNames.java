package quest.gekko.rankboard.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public class ChannelNames {
    private static final Pattern LOGIN = Pattern.compile("^[a-z0-9_]{3,25}$");

    /** Lower-cased, trimmed login, or empty when it cannot be a streaming login. */
    public static Optional<String> sanitize(String s) {
        if (s == null) return Optional.empty();
        String cleaned = s.trim().toLowerCase(Locale.ROOT);
        return LOGIN.matcher(cleaned).matches() ? Optional.of(cleaned) : Optional.empty();
    }
}
