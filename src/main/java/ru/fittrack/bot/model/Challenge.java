package ru.fittrack.bot.model;

import java.time.LocalDateTime;

public final class Challenge {
    public long id;
    public long userId;
    public String text;
    public Frequency frequency;
    public LocalDateTime createdAt;
    public boolean active;
}
