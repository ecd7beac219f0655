package ru.fittrack.bot.service;

import ru.fittrack.bot.config.Config;
import ru.fittrack.bot.db.Database;
import ru.fittrack.bot.db.Storage;
import ru.fittrack.bot.exception.StorageException;
import ru.fittrack.bot.exception.ValidationException;
import ru.fittrack.bot.model.LeaderboardEntry;
import ru.fittrack.bot.model.User;
import ru.fittrack.bot.util.TimeUtil;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public final class LeaderboardService {

    private final Database db;
    private final Storage storage;
    private final Config cfg;
    private final Clock clock;

    public LeaderboardService(Database db, Storage storage, Config cfg, Clock clock) {
        this.db = db;
        this.storage = storage;
        this.cfg = cfg;
        this.clock = clock;
    }

    public int defaultWindowDays() {
        return cfg.leaderboardWindowDays();
    }

    public List<LeaderboardEntry> monthlyLeaderboard() {
        return monthlyLeaderboard(cfg.leaderboardWindowDays());
    }

    public List<LeaderboardEntry> monthlyLeaderboard(int windowDays) {
        if (windowDays < 1) {
            throw new ValidationException("Leaderboard window must be at least one day, got " + windowDays);
        }
        String cutoff = TimeUtil.fmt(TimeUtil.now(clock).minusDays(windowDays));

        List<Storage.CountRow> rows;
        try (Connection c = db.getConnection()) {
            rows = storage.completionCountsSince(c, cutoff);
        } catch (SQLException e) {
            throw new StorageException("Failed to build leaderboard", e);
        }

        List<LeaderboardEntry> out = new ArrayList<>(rows.size());
        int rank = 1;
        for (Storage.CountRow r : rows) {
            out.add(new LeaderboardEntry(rank++, r.userId(), User.nameOf(r.firstName(), r.username()), r.username(), r.count()));
        }
        return out;
    }
}
