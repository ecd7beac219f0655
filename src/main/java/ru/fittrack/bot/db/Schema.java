package ru.fittrack.bot.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public final class Schema {
    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    private Schema() {}

    public static void migrate(Database db) throws SQLException {
        try (Connection c = db.getConnection()) {
            try (Statement st = c.createStatement()) {

                st.execute("CREATE TABLE IF NOT EXISTS users (" +
                        "id INTEGER PRIMARY KEY," +
                        "username TEXT," +
                        "first_name TEXT," +
                        "registered_at TEXT NOT NULL" +
                        ");");

                st.execute("CREATE TABLE IF NOT EXISTS challenges (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                        "user_id INTEGER NOT NULL," +
                        "challenge_text TEXT NOT NULL," +
                        "frequency TEXT NOT NULL CHECK (frequency IN ('daily','weekly'))," +
                        "created_at TEXT NOT NULL," +
                        "active INTEGER NOT NULL DEFAULT 1," +
                        "FOREIGN KEY (user_id) REFERENCES users (id)" +
                        ");");

                // at most one active challenge per user
                st.execute("CREATE UNIQUE INDEX IF NOT EXISTS ux_challenges_active_user " +
                        "ON challenges(user_id) WHERE active = 1;");

                st.execute("CREATE TABLE IF NOT EXISTS completions (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                        "user_id INTEGER NOT NULL," +
                        "challenge_id INTEGER NOT NULL," +
                        "completed_at TEXT NOT NULL," +
                        "FOREIGN KEY (user_id) REFERENCES users (id)," +
                        "FOREIGN KEY (challenge_id) REFERENCES challenges (id)" +
                        ");");

                st.execute("CREATE INDEX IF NOT EXISTS ix_completions_user_time " +
                        "ON completions(user_id, completed_at);");

                st.execute("CREATE TABLE IF NOT EXISTS pending_setups (" +
                        "user_id INTEGER PRIMARY KEY," +
                        "kind TEXT NOT NULL," +
                        "data TEXT NOT NULL DEFAULT '{}'," +
                        "created_at TEXT NOT NULL," +
                        "expires_at TEXT NOT NULL" +
                        ");");
            }
        }
        log.info("Schema migrated: {}", db.jdbcUrl());
    }
}
