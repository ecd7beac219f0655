package ru.fittrack.bot.telegram;

/**
 * Callback-data should be <= 64 bytes.
 * We keep it compact and parse by prefixes.
 */
public final class CallbackData {
    private CallbackData() {}

    // Setup
    public static final String FREQUENCY_PREFIX = "ch:freq:"; // + daily|weekly

    // Check-in. No challenge id here: the active challenge is resolved when the button is pressed.
    public static final String CHECK_DONE = "ch:done";
    public static final String CHECK_NOT_YET = "ch:notyet";
}
