package ru.fittrack.bot.exception;

public class ValidationException extends FitTrackException {

    public ValidationException(String message) {
        super(message);
    }
}
