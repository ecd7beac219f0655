package ru.fittrack.bot.exception;

public class InvariantViolationException extends FitTrackException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
