package ru.fittrack.bot.model;

import ru.fittrack.bot.exception.ValidationException;

import java.util.Locale;

public enum Frequency {
    DAILY("daily"),
    WEEKLY("weekly");

    private final String code;

    Frequency(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Frequency parse(String v) {
        if (v == null || v.isBlank()) {
            throw new ValidationException("Challenge frequency is required (daily or weekly)");
        }
        String norm = v.trim().toLowerCase(Locale.ROOT);
        for (Frequency f : values()) {
            if (f.code.equals(norm)) return f;
        }
        throw new ValidationException("Unknown challenge frequency: " + v + " (expected daily or weekly)");
    }
}
