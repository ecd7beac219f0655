package ru.fittrack.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.fittrack.bot.db.Database;
import ru.fittrack.bot.db.Storage;
import ru.fittrack.bot.exception.InvariantViolationException;
import ru.fittrack.bot.exception.StorageException;
import ru.fittrack.bot.exception.ValidationException;
import ru.fittrack.bot.model.Challenge;
import ru.fittrack.bot.model.Frequency;
import ru.fittrack.bot.util.TimeUtil;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

public final class ChallengeRegistry {
    private static final Logger log = LoggerFactory.getLogger(ChallengeRegistry.class);

    private final Database db;
    private final Storage storage;
    private final Clock clock;

    // entries live only while some thread holds or waits for the user's lock
    private final ConcurrentMap<Long, UserLock> userLocks = new ConcurrentHashMap<>();

    public ChallengeRegistry(Database db, Storage storage, Clock clock) {
        this.db = db;
        this.storage = storage;
        this.clock = clock;
    }

    public long setChallenge(long userId, String text, String frequency) {
        return setChallenge(userId, text, Frequency.parse(frequency));
    }

    /**
     * Retires every active challenge of the user and activates a new one, in a single transaction.
     *
     * @throws ValidationException if the text is blank or the frequency is missing
     * @throws StorageException    if the transaction fails; the previous challenge stays active then
     */
    public long setChallenge(long userId, String text, Frequency frequency) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Challenge text must not be empty");
        }
        if (frequency == null) {
            throw new ValidationException("Challenge frequency is required (daily or weekly)");
        }
        String clean = text.trim();

        UserLock lock = acquire(userId);
        try (Connection c = db.getConnection()) {
            c.setAutoCommit(false);
            try {
                int retired = storage.deactivateChallenges(c, userId);
                long id = storage.insertChallenge(c, userId, clean, frequency, TimeUtil.nowIso(clock));
                c.commit();
                log.info("Challenge {} set for user {} ({}), {} previous retired", id, userId, frequency.code(), retired);
                return id;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to set challenge for user " + userId, e);
        } finally {
            release(userId, lock);
        }
    }

    public Optional<Challenge> getActiveChallenge(long userId) {
        List<Challenge> active;
        try (Connection c = db.getConnection()) {
            active = storage.findActiveChallenges(c, userId);
        } catch (SQLException e) {
            throw new StorageException("Failed to load active challenge for user " + userId, e);
        }
        if (active.size() > 1) {
            log.error("INVARIANT VIOLATION: user {} has {} active challenges (ids {})",
                    userId, active.size(), active.stream().map(ch -> ch.id).toList());
            throw new InvariantViolationException("User " + userId + " has " + active.size() + " active challenges");
        }
        return active.isEmpty() ? Optional.empty() : Optional.of(active.get(0));
    }

    public List<Challenge> listChallenges(long userId) {
        try (Connection c = db.getConnection()) {
            return storage.findChallenges(c, userId);
        } catch (SQLException e) {
            throw new StorageException("Failed to list challenges for user " + userId, e);
        }
    }

    int lockedUsers() {
        return userLocks.size();
    }

    private UserLock acquire(long userId) {
        UserLock ul = userLocks.compute(userId, (k, v) -> {
            UserLock l = v == null ? new UserLock() : v;
            l.holders++;
            return l;
        });
        ul.lock.lock();
        return ul;
    }

    private void release(long userId, UserLock ul) {
        ul.lock.unlock();
        userLocks.compute(userId, (k, v) -> --v.holders == 0 ? null : v);
    }

    private static final class UserLock {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        int holders;
    }
}
