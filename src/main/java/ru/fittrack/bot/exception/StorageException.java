package ru.fittrack.bot.exception;

public class StorageException extends FitTrackException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
