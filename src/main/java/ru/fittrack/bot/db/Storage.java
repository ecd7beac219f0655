package ru.fittrack.bot.db;

import ru.fittrack.bot.model.Challenge;
import ru.fittrack.bot.model.Completion;
import ru.fittrack.bot.model.Frequency;
import ru.fittrack.bot.model.User;
import ru.fittrack.bot.util.TimeUtil;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

// every method runs on a connection owned by the caller
public final class Storage {

    public record CountRow(long userId, String firstName, String username, int count) {}

    // --- users ---

    public void upsertUser(Connection c, User u, String now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO users(id, username, first_name, registered_at) VALUES(?,?,?,?) " +
                        "ON CONFLICT(id) DO UPDATE SET username=excluded.username, first_name=excluded.first_name"
        )) {
            ps.setLong(1, u.id);
            setNullableString(ps, 2, u.handle);
            setNullableString(ps, 3, u.displayName);
            ps.setString(4, now);
            ps.executeUpdate();
        }
    }

    public Optional<User> findUser(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM users WHERE id=?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapUser(rs));
            }
        }
    }

    public int countUsers(Connection c) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM users")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    // --- challenges ---

    public long insertChallenge(Connection c, long userId, String text, Frequency frequency, String createdAt) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO challenges(user_id, challenge_text, frequency, created_at, active) VALUES(?,?,?,?,1)",
                Statement.RETURN_GENERATED_KEYS
        )) {
            ps.setLong(1, userId);
            ps.setString(2, text);
            ps.setString(3, frequency.code());
            ps.setString(4, createdAt);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    public int deactivateChallenges(Connection c, long userId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE challenges SET active=0 WHERE user_id=? AND active=1")) {
            ps.setLong(1, userId);
            return ps.executeUpdate();
        }
    }

    public List<Challenge> findActiveChallenges(Connection c, long userId) throws SQLException {
        return queryChallenges(c, "SELECT * FROM challenges WHERE user_id=? AND active=1 ORDER BY id", userId);
    }

    public List<Challenge> findChallenges(Connection c, long userId) throws SQLException {
        return queryChallenges(c, "SELECT * FROM challenges WHERE user_id=? ORDER BY id", userId);
    }

    // --- completions ---

    public long insertCompletion(Connection c, long userId, long challengeId, String completedAt) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO completions(user_id, challenge_id, completed_at) VALUES(?,?,?)",
                Statement.RETURN_GENERATED_KEYS
        )) {
            ps.setLong(1, userId);
            ps.setLong(2, challengeId);
            ps.setString(3, completedAt);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    public List<Completion> findCompletions(Connection c, long userId) throws SQLException {
        List<Completion> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM completions WHERE user_id=? ORDER BY id")) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapCompletion(rs));
            }
        }
        return out;
    }

    public int countCompletions(Connection c, long userId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM completions WHERE user_id=?")) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    public List<CountRow> completionCountsSince(Connection c, String cutoff) throws SQLException {
        List<CountRow> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT u.id, u.first_name, u.username, COUNT(c.id) AS completion_count " +
                        "FROM users u " +
                        "LEFT JOIN completions c ON c.user_id = u.id AND c.completed_at > ? " +
                        "GROUP BY u.id, u.first_name, u.username, u.registered_at " +
                        "ORDER BY completion_count DESC, u.registered_at ASC, u.id ASC"
        )) {
            ps.setString(1, cutoff);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new CountRow(
                            rs.getLong("id"),
                            rs.getString("first_name"),
                            rs.getString("username"),
                            rs.getInt("completion_count")
                    ));
                }
            }
        }
        return out;
    }

    // --- mapping ---

    private static List<Challenge> queryChallenges(Connection c, String sql, long userId) throws SQLException {
        List<Challenge> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapChallenge(rs));
            }
        }
        return out;
    }

    private static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) throw new SQLException("No id");
            return keys.getLong(1);
        }
    }

    private static void setNullableString(PreparedStatement ps, int idx, String v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.VARCHAR);
        else ps.setString(idx, v);
    }

    private static User mapUser(ResultSet rs) throws SQLException {
        User u = new User();
        u.id = rs.getLong("id");
        u.handle = rs.getString("username");
        u.displayName = rs.getString("first_name");
        u.registeredAt = rs.getString("registered_at");
        return u;
    }

    private static Challenge mapChallenge(ResultSet rs) throws SQLException {
        Challenge ch = new Challenge();
        ch.id = rs.getLong("id");
        ch.userId = rs.getLong("user_id");
        ch.text = rs.getString("challenge_text");
        ch.frequency = Frequency.parse(rs.getString("frequency"));
        ch.createdAt = TimeUtil.parseDateTime(rs.getString("created_at"));
        ch.active = rs.getInt("active") == 1;
        return ch;
    }

    private static Completion mapCompletion(ResultSet rs) throws SQLException {
        Completion cp = new Completion();
        cp.id = rs.getLong("id");
        cp.userId = rs.getLong("user_id");
        cp.challengeId = rs.getLong("challenge_id");
        cp.completedAt = TimeUtil.parseDateTime(rs.getString("completed_at"));
        return cp;
    }
}
