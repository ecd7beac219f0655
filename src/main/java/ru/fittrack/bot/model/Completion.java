package ru.fittrack.bot.model;

import java.time.LocalDateTime;

public final class Completion {
    public long id;
    public long userId;
    public long challengeId;
    public LocalDateTime completedAt;
}
