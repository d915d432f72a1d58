package at.sv.sun;

import java.time.Duration;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * Formats a duration like {@code 9h 24m 39s}, leaving out leading zero units.
     */
    public static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long days = seconds / 86_400;
        long hours = seconds % 86_400 / 3_600;
        long minutes = seconds % 3_600 / 60;
        StringBuilder builder = new StringBuilder();
        if (days > 0) {
            builder.append(days).append("d ");
        }
        if (hours > 0) {
            builder.append(hours).append("h ");
        }
        if (minutes > 0) {
            builder.append(minutes).append("m ");
        }
        return builder.append(seconds % 60).append('s').toString();
    }
}
