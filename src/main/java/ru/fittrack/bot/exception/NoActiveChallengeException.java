package ru.fittrack.bot.exception;

public class NoActiveChallengeException extends FitTrackException {

    private final long userId;

    public NoActiveChallengeException(long userId) {
        super("User " + userId + " has no active challenge");
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
