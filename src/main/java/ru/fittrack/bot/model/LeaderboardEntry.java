package ru.fittrack.bot.model;

public record LeaderboardEntry(int rank, long userId, String name, String handle, int count) {
}
