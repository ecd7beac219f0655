package ru.fittrack.bot.support;

import ru.fittrack.bot.App;
import ru.fittrack.bot.config.Config;
import ru.fittrack.bot.db.Database;
import ru.fittrack.bot.db.Schema;
import ru.fittrack.bot.service.BotFacade;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** Fresh SQLite file with the full service graph on top. */
public final class TestDb {

    public static final Instant START = Instant.parse("2026-10-19T12:00:00Z");

    public final Config cfg;
    public final Database db;
    public final MutableClock clock;
    public final BotFacade facade;

    private TestDb(Config cfg, Database db, MutableClock clock, BotFacade facade) {
        this.cfg = cfg;
        this.db = db;
        this.clock = clock;
        this.facade = facade;
    }

    public static TestDb create(Path dir) throws Exception {
        return create(dir, Map.of());
    }

    public static TestDb create(Path dir, Map<String, String> overrides) throws Exception {
        Map<String, String> values = new HashMap<>();
        values.put("DB_PATH", dir.resolve("test.db").toString());
        values.put("BOT_TOKEN", "test-token");
        values.putAll(overrides);
        Config cfg = Config.from(values);

        Database db = new Database(cfg);
        Schema.migrate(db);
        MutableClock clock = new MutableClock(START);
        return new TestDb(cfg, db, clock, App.createFacade(cfg, db, clock));
    }

    public long count(String sql, Object... args) throws SQLException {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setObject(i + 1, args[i]);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    public void exec(String sql) throws SQLException {
        try (Connection c = db.getConnection();
             Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }
}
