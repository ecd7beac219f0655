package ru.fittrack.bot.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public final class TimeUtil {
    private TimeUtil() {}

    // Fixed width, so stored timestamps compare chronologically as plain strings.
    public static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");
    public static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock);
    }

    public static String nowIso(Clock clock) {
        return fmt(now(clock));
    }

    public static LocalDateTime parseDateTime(String iso) {
        return LocalDateTime.parse(iso, DATETIME);
    }

    public static String fmt(LocalDateTime dt) {
        return dt.format(DATETIME);
    }

    public static String display(LocalDateTime dt) {
        return dt == null ? "" : dt.format(DISPLAY);
    }
}
