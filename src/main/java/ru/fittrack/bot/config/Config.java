package ru.fittrack.bot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public final class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private final String botToken;
    private final String botUsername;
    private final Path dbPath;
    private final ZoneId zoneId;

    // Leaderboard
    private final int leaderboardWindowDays;

    // Challenge setup: how long a chosen frequency waits for the challenge text
    private final int pendingSetupTtlMinutes;

    // Scheduler
    private final int schedulerIntervalSeconds;

    private final int maxMessageLen;

    private Config(
            String botToken,
            String botUsername,
            Path dbPath,
            ZoneId zoneId,
            int leaderboardWindowDays,
            int pendingSetupTtlMinutes,
            int schedulerIntervalSeconds,
            int maxMessageLen
    ) {
        this.botToken = Objects.requireNonNull(botToken);
        this.botUsername = Objects.requireNonNull(botUsername);
        this.dbPath = Objects.requireNonNull(dbPath);
        this.zoneId = Objects.requireNonNull(zoneId);
        this.leaderboardWindowDays = leaderboardWindowDays;
        this.pendingSetupTtlMinutes = pendingSetupTtlMinutes;
        this.schedulerIntervalSeconds = schedulerIntervalSeconds;
        this.maxMessageLen = maxMessageLen;
    }

    // env, then JVM system properties, then defaults
    public static Config load() {
        return load(key -> {
            String env = System.getenv(key);
            if (env != null && !env.isBlank()) return env;
            return System.getProperty(key);
        });
    }

    public static Config from(Map<String, String> values) {
        return load(values::get);
    }

    private static Config load(Function<String, String> source) {
        String botToken = get(source, "BOT_TOKEN", "");
        String botUsername = get(source, "BOT_USERNAME", "fittrack_bot");
        String dbPath = get(source, "DB_PATH", "./data/fitness_tracker.db");
        String tz = get(source, "BOT_TIMEZONE", "UTC");

        int windowDays = getPositiveInt(source, "LEADERBOARD_WINDOW_DAYS", 30);
        int pendingTtl = getPositiveInt(source, "PENDING_SETUP_TTL_MINUTES", 30);
        int schedulerIntervalSeconds = getPositiveInt(source, "SCHEDULER_INTERVAL_SECONDS", 60);
        int maxLen = getPositiveInt(source, "MAX_MESSAGE_LEN", 3900);

        if (botToken.isBlank()) {
            log.warn("BOT_TOKEN is empty. Set env BOT_TOKEN or VM option -DBOT_TOKEN=...");
        }

        return new Config(
                botToken,
                botUsername,
                Path.of(dbPath),
                ZoneId.of(tz),
                windowDays,
                pendingTtl,
                schedulerIntervalSeconds,
                maxLen
        );
    }

    private static String get(Function<String, String> source, String key, String def) {
        String v = source.apply(key);
        if (v != null && !v.isBlank()) return v.trim();
        return def;
    }

    private static int getInt(Function<String, String> source, String key, int def) {
        String v = get(source, key, "");
        if (v.isBlank()) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}', using default {}", key, v, def);
            return def;
        }
    }

    private static int getPositiveInt(Function<String, String> source, String key, int def) {
        int v = getInt(source, key, def);
        if (v < 1) {
            log.warn("{} must be positive, got {}, using default {}", key, v, def);
            return def;
        }
        return v;
    }

    public String botToken() { return botToken; }
    public String botUsername() { return botUsername; }
    public Path dbPath() { return dbPath; }
    public ZoneId zoneId() { return zoneId; }

    public int leaderboardWindowDays() { return leaderboardWindowDays; }
    public int pendingSetupTtlMinutes() { return pendingSetupTtlMinutes; }

    public int schedulerIntervalSeconds() { return schedulerIntervalSeconds; }
    public int maxMessageLen() { return maxMessageLen; }
}
