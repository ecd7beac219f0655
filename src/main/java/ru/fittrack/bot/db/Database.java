package ru.fittrack.bot.db;

import org.sqlite.SQLiteConfig;
import ru.fittrack.bot.config.Config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

public final class Database {
    private final String jdbcUrl;
    private final Properties props;

    public Database(Config cfg) throws IOException {
        Path file = Objects.requireNonNull(cfg).dbPath().toAbsolutePath();
        Files.createDirectories(file.getParent());
        this.jdbcUrl = "jdbc:sqlite:" + file;

        SQLiteConfig sc = new SQLiteConfig();
        // WAL lets the leaderboard read while a check-in is being written.
        sc.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sc.enforceForeignKeys(true);
        sc.setBusyTimeout(5000);
        // Writers take the lock at BEGIN, so deactivate+insert never races another writer.
        sc.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.props = sc.toProperties();
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, props);
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }
}
