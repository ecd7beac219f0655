package ru.fittrack.bot.service;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.fittrack.bot.config.Config;
import ru.fittrack.bot.db.Database;
import ru.fittrack.bot.exception.StorageException;
import ru.fittrack.bot.model.Frequency;
import ru.fittrack.bot.model.PendingSetup;
import ru.fittrack.bot.util.JsonUtils;
import ru.fittrack.bot.util.TimeUtil;

import java.sql.*;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

public final class PendingSetupService {
    private static final Logger log = LoggerFactory.getLogger(PendingSetupService.class);

    private static final String KEY_FREQUENCY = "frequency";

    private final Database db;
    private final Config cfg;
    private final Clock clock;

    public PendingSetupService(Database db, Config cfg, Clock clock) {
        this.db = db;
        this.cfg = cfg;
        this.clock = clock;
    }

    public PendingSetup begin(long userId, Frequency frequency) {
        LocalDateTime now = TimeUtil.now(clock);
        LocalDateTime expires = now.plusMinutes(cfg.pendingSetupTtlMinutes());
        JsonObject data = JsonUtils.obj();
        data.addProperty(KEY_FREQUENCY, frequency.code());

        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO pending_setups(user_id, kind, data, created_at, expires_at) VALUES(?,?,?,?,?) " +
                            "ON CONFLICT(user_id) DO UPDATE SET kind=excluded.kind, data=excluded.data, " +
                            "created_at=excluded.created_at, expires_at=excluded.expires_at"
            )) {
                ps.setLong(1, userId);
                ps.setString(2, PendingSetup.KIND_CHALLENGE);
                ps.setString(3, JsonUtils.GSON.toJson(data));
                ps.setString(4, TimeUtil.fmt(now));
                ps.setString(5, TimeUtil.fmt(expires));
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store pending setup for user " + userId, e);
        }

        PendingSetup p = new PendingSetup();
        p.userId = userId;
        p.kind = PendingSetup.KIND_CHALLENGE;
        p.data = data;
        p.createdAt = now;
        p.expiresAt = expires;
        return p;
    }

    // expired rows count as absent
    public Optional<PendingSetup> find(long userId) {
        Optional<PendingSetup> row;
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM pending_setups WHERE user_id=?")) {
                ps.setLong(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    row = rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load pending setup for user " + userId, e);
        }
        return row.filter(p -> !p.isExpired(TimeUtil.now(clock)));
    }

    public Optional<Frequency> pendingFrequency(long userId) {
        return find(userId)
                .map(p -> JsonUtils.str(p.data, KEY_FREQUENCY))
                .map(Frequency::parse);
    }

    public void clear(long userId) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM pending_setups WHERE user_id=?")) {
                ps.setLong(1, userId);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to clear pending setup for user " + userId, e);
        }
    }

    public int purgeExpired() {
        int removed;
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM pending_setups WHERE expires_at <= ?")) {
                ps.setString(1, TimeUtil.nowIso(clock));
                removed = ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to purge pending setups", e);
        }
        if (removed > 0) log.info("Purged {} expired pending setups", removed);
        return removed;
    }

    private static PendingSetup map(ResultSet rs) throws SQLException {
        PendingSetup p = new PendingSetup();
        p.userId = rs.getLong("user_id");
        p.kind = rs.getString("kind");
        p.data = JsonUtils.parseObj(rs.getString("data"));
        p.createdAt = TimeUtil.parseDateTime(rs.getString("created_at"));
        p.expiresAt = TimeUtil.parseDateTime(rs.getString("expires_at"));
        return p;
    }
}
