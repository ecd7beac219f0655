package ru.fittrack.bot.model;

public final class User {
    public long id;
    public String handle;       // Telegram username, may be absent
    public String displayName;  // Telegram first name, may be absent
    public String registeredAt;

    public User() {}

    public User(long id, String handle, String displayName) {
        this.id = id;
        this.handle = handle;
        this.displayName = displayName;
    }

    public static String nameOf(String displayName, String handle) {
        if (displayName != null && !displayName.isBlank()) return displayName;
        if (handle != null && !handle.isBlank()) return handle;
        return "Unknown";
    }
}
