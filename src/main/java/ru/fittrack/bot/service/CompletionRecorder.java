package ru.fittrack.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.fittrack.bot.db.Database;
import ru.fittrack.bot.db.Storage;
import ru.fittrack.bot.exception.NoActiveChallengeException;
import ru.fittrack.bot.exception.StorageException;
import ru.fittrack.bot.model.Challenge;
import ru.fittrack.bot.model.Completion;
import ru.fittrack.bot.util.TimeUtil;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;

public final class CompletionRecorder {
    private static final Logger log = LoggerFactory.getLogger(CompletionRecorder.class);

    private final Database db;
    private final Storage storage;
    private final ChallengeRegistry registry;
    private final Clock clock;

    public CompletionRecorder(Database db, Storage storage, ChallengeRegistry registry, Clock clock) {
        this.db = db;
        this.storage = storage;
        this.registry = registry;
        this.clock = clock;
    }

    // repeated calls add repeated rows
    public long recordCompletion(long userId) {
        Challenge active = registry.getActiveChallenge(userId)
                .orElseThrow(() -> new NoActiveChallengeException(userId));
        try (Connection c = db.getConnection()) {
            long id = storage.insertCompletion(c, userId, active.id, TimeUtil.nowIso(clock));
            log.info("Completion {} recorded for user {} on challenge {}", id, userId, active.id);
            return id;
        } catch (SQLException e) {
            throw new StorageException("Failed to record completion for user " + userId, e);
        }
    }

    public int countCompletions(long userId) {
        try (Connection c = db.getConnection()) {
            return storage.countCompletions(c, userId);
        } catch (SQLException e) {
            throw new StorageException("Failed to count completions for user " + userId, e);
        }
    }

    public List<Completion> listCompletions(long userId) {
        try (Connection c = db.getConnection()) {
            return storage.findCompletions(c, userId);
        } catch (SQLException e) {
            throw new StorageException("Failed to list completions for user " + userId, e);
        }
    }
}
