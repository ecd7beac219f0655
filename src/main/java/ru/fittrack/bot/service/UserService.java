package ru.fittrack.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.fittrack.bot.db.Database;
import ru.fittrack.bot.db.Storage;
import ru.fittrack.bot.exception.StorageException;
import ru.fittrack.bot.model.User;
import ru.fittrack.bot.util.TimeUtil;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;

public final class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final Database db;
    private final Storage storage;
    private final Clock clock;

    public UserService(Database db, Storage storage, Clock clock) {
        this.db = db;
        this.storage = storage;
        this.clock = clock;
    }

    public void registerUser(long id, String handle, String displayName) {
        User u = new User(id, handle, displayName);
        try (Connection c = db.getConnection()) {
            storage.upsertUser(c, u, TimeUtil.nowIso(clock));
        } catch (SQLException e) {
            throw new StorageException("Failed to register user " + id, e);
        }
        log.debug("User {} registered (handle={})", id, handle);
    }

    public Optional<User> findById(long id) {
        try (Connection c = db.getConnection()) {
            return storage.findUser(c, id);
        } catch (SQLException e) {
            throw new StorageException("Failed to load user " + id, e);
        }
    }

    public int countUsers() {
        try (Connection c = db.getConnection()) {
            return storage.countUsers(c);
        } catch (SQLException e) {
            throw new StorageException("Failed to count users", e);
        }
    }
}
