package ru.fittrack.bot.model;

import com.google.gson.JsonObject;

import java.time.LocalDateTime;

public final class PendingSetup {
    public static final String KIND_CHALLENGE = "CHALLENGE_SETUP";

    public long userId;
    public String kind;
    public JsonObject data;
    public LocalDateTime createdAt;
    public LocalDateTime expiresAt;

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
