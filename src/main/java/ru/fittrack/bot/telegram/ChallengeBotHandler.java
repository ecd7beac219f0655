package ru.fittrack.bot.telegram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import ru.fittrack.bot.exception.InvariantViolationException;
import ru.fittrack.bot.exception.NoActiveChallengeException;
import ru.fittrack.bot.exception.StorageException;
import ru.fittrack.bot.exception.ValidationException;
import ru.fittrack.bot.model.Challenge;
import ru.fittrack.bot.model.Frequency;
import ru.fittrack.bot.model.LeaderboardEntry;
import ru.fittrack.bot.service.BotFacade;
import ru.fittrack.bot.util.TextChunker;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;

public final class ChallengeBotHandler {
    private static final Logger log = LoggerFactory.getLogger(ChallengeBotHandler.class);

    private final BotFacade facade;
    private final ChatGateway chat;

    public ChallengeBotHandler(BotFacade facade, ChatGateway chat) {
        this.facade = facade;
        this.chat = chat;
    }

    public void handle(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                onCallback(update.getCallbackQuery());
                return;
            }
            if (update.hasMessage()) {
                onMessage(update.getMessage());
            }
        } catch (Exception e) {
            log.error("Unhandled error while processing update {}", update.getUpdateId(), e);
        }
    }

    private void onMessage(Message msg) {
        User from = msg.getFrom();
        if (from == null) return;
        long chatId = msg.getChatId();

        if (!guarded(chatId, () -> facade.users().registerUser(from.getId(), from.getUserName(), from.getFirstName()))) {
            return;
        }

        String text = msg.getText();
        if (text == null) return;

        if (text.startsWith("/")) {
            switch (command(text)) {
                case "/start" -> guarded(chatId, () -> start(chatId, from));
                case "/check" -> guarded(chatId, () -> check(chatId, from.getId()));
                case "/stats" -> guarded(chatId, () -> stats(chatId));
                case "/export" -> guarded(chatId, () -> export(chatId, from.getId()));
                default -> chat.sendHtml(chatId, Messages.help(facade.leaderboard().defaultWindowDays()), null);
            }
            return;
        }

        guarded(chatId, () -> receiveChallenge(chatId, from.getId(), text));
    }

    private void onCallback(CallbackQuery cb) {
        if (cb.getFrom() == null || cb.getMessage() == null) return;
        User from = cb.getFrom();
        long chatId = cb.getMessage().getChatId();
        int msgId = cb.getMessage().getMessageId();
        String data = cb.getData();

        chat.answer(cb.getId(), null);
        if (data == null) return;

        if (!guarded(chatId, () -> facade.users().registerUser(from.getId(), from.getUserName(), from.getFirstName()))) {
            return;
        }

        if (data.startsWith(CallbackData.FREQUENCY_PREFIX)) {
            String code = data.substring(CallbackData.FREQUENCY_PREFIX.length());
            guarded(chatId, () -> chooseFrequency(chatId, msgId, from.getId(), code));
            return;
        }
        if (CallbackData.CHECK_DONE.equals(data)) {
            guarded(chatId, () -> markDone(chatId, msgId, from.getId()));
            return;
        }
        if (CallbackData.CHECK_NOT_YET.equals(data)) {
            chat.editHtml(chatId, msgId, Messages.NOT_YET, null);
            return;
        }
        log.warn("Unknown callback data '{}' from user {}", data, from.getId());
    }

    // --- flows ---

    private void start(long chatId, User from) {
        // a fresh /start abandons any half-finished setup
        facade.pending().clear(from.getId());
        chat.sendHtml(chatId, Messages.welcome(from.getFirstName()), Keyboards.frequencyPicker());
    }

    private void chooseFrequency(long chatId, int msgId, long userId, String code) {
        Frequency f = Frequency.parse(code);
        facade.pending().begin(userId, f);
        chat.editHtml(chatId, msgId, Messages.frequencyChosen(f), null);
    }

    private void receiveChallenge(long chatId, long userId, String text) {
        Optional<Frequency> pending = facade.pending().pendingFrequency(userId);
        if (pending.isEmpty()) {
            chat.sendHtml(chatId, Messages.NO_PENDING_SETUP, null);
            return;
        }
        Frequency f = pending.get();
        facade.challenges().setChallenge(userId, text, f);
        try {
            facade.pending().clear(userId);
        } catch (StorageException e) {
            // the challenge is saved; the leftover row expires and the scheduler purges it
            log.warn("Could not clear pending setup of user {}", userId, e);
        }
        chat.sendHtml(chatId, Messages.challengeSet(f, text.trim()), null);
    }

    private void check(long chatId, long userId) {
        Optional<Challenge> active = facade.challenges().getActiveChallenge(userId);
        if (active.isEmpty()) {
            chat.sendHtml(chatId, Messages.NO_ACTIVE_CHALLENGE, null);
            return;
        }
        chat.sendHtml(chatId, Messages.checkPrompt(active.get()), Keyboards.checkIn());
    }

    private void markDone(long chatId, int msgId, long userId) {
        try {
            facade.completions().recordCompletion(userId);
        } catch (NoActiveChallengeException e) {
            // the challenge shown on the button may be gone by now
            chat.editHtml(chatId, msgId, Messages.NO_ACTIVE_CHALLENGE, null);
            return;
        }
        int total = facade.completions().countCompletions(userId);
        chat.editHtml(chatId, msgId, Messages.completed(total), null);
    }

    private void stats(long chatId) {
        int window = facade.leaderboard().defaultWindowDays();
        List<LeaderboardEntry> board = facade.leaderboard().monthlyLeaderboard(window);
        String text = Messages.leaderboard(board, window);
        for (String part : TextChunker.splitByLines(text, facade.cfg().maxMessageLen())) {
            chat.sendHtml(chatId, part, null);
        }
    }

    private void export(long chatId, long userId) {
        File file = facade.excel().buildExport(userId);
        try {
            chat.sendDocument(chatId, file, "📈 Leaderboard and your challenge history");
        } finally {
            try {
                Files.deleteIfExists(file.toPath());
            } catch (IOException e) {
                log.warn("Could not delete export file {}", file, e);
            }
        }
    }

    // --- helpers ---

    // false if the action failed and the user already got an error reply
    private boolean guarded(long chatId, Runnable action) {
        try {
            action.run();
            return true;
        } catch (ValidationException e) {
            chat.sendHtml(chatId, Messages.invalidInput(e.getMessage()), null);
        } catch (NoActiveChallengeException e) {
            chat.sendHtml(chatId, Messages.NO_ACTIVE_CHALLENGE, null);
        } catch (InvariantViolationException e) {
            log.error("Data invariant broken while serving chat {}", chatId, e);
            chat.sendHtml(chatId, Messages.TEMPORARY_FAILURE, null);
        } catch (StorageException e) {
            log.error("Storage failure while serving chat {}", chatId, e);
            chat.sendHtml(chatId, Messages.TEMPORARY_FAILURE, null);
        }
        return false;
    }

    static String command(String text) {
        String first = text.trim().split("\\s+", 2)[0];
        int at = first.indexOf('@');
        return at >= 0 ? first.substring(0, at) : first;
    }
}
