package ru.fittrack.bot.telegram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import ru.fittrack.bot.config.Config;
import ru.fittrack.bot.service.BotFacade;

import java.io.File;
import java.util.List;

public final class FitTrackBot extends TelegramLongPollingBot implements ChatGateway {
    private static final Logger log = LoggerFactory.getLogger(FitTrackBot.class);

    private final Config cfg;
    private final ChallengeBotHandler handler;

    public FitTrackBot(Config cfg, BotFacade facade) {
        super(cfg.botToken());
        this.cfg = cfg;
        this.handler = new ChallengeBotHandler(facade, this);
    }

    @Override
    public String getBotUsername() {
        return cfg.botUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        handler.handle(update);
    }

    public void registerCommands() {
        try {
            execute(new SetMyCommands(List.of(
                    new BotCommand("/start", "Set up a challenge"),
                    new BotCommand("/check", "Check in on your challenge"),
                    new BotCommand("/stats", "Monthly leaderboard"),
                    new BotCommand("/export", "Download leaderboard and history"),
                    new BotCommand("/help", "Help")
            ), null, null));
        } catch (TelegramApiException e) {
            log.warn("Could not register bot commands: {}", e.getMessage());
        }
    }

    // --- ChatGateway ---

    @Override
    public void sendHtml(long chatId, String text, InlineKeyboardMarkup kb) {
        SendMessage m = new SendMessage();
        m.setChatId(chatId);
        m.setText(limit(text));
        m.setParseMode(ParseMode.HTML);
        if (kb != null) m.setReplyMarkup(kb);
        try {
            execute(m);
        } catch (TelegramApiException e) {
            log.warn("sendMessage to chat {} failed: {}", chatId, e.getMessage());
        }
    }

    @Override
    public void editHtml(long chatId, int messageId, String text, InlineKeyboardMarkup kb) {
        EditMessageText em = new EditMessageText();
        em.setChatId(chatId);
        em.setMessageId(messageId);
        em.setText(limit(text));
        em.setParseMode(ParseMode.HTML);
        if (kb != null) em.setReplyMarkup(kb);
        try {
            execute(em);
        } catch (TelegramApiException e) {
            log.warn("editMessageText {} in chat {} failed: {}", messageId, chatId, e.getMessage());
        }
    }

    @Override
    public void answer(String callbackId, String text) {
        AnswerCallbackQuery a = new AnswerCallbackQuery();
        a.setCallbackQueryId(callbackId);
        if (text != null) a.setText(text);
        try {
            execute(a);
        } catch (TelegramApiException e) {
            log.debug("answerCallbackQuery {} failed: {}", callbackId, e.getMessage());
        }
    }

    @Override
    public void sendDocument(long chatId, File file, String caption) {
        SendDocument doc = new SendDocument();
        doc.setChatId(chatId);
        doc.setDocument(new InputFile(file));
        doc.setCaption(caption);
        try {
            execute(doc);
        } catch (TelegramApiException e) {
            log.warn("sendDocument to chat {} failed: {}", chatId, e.getMessage());
            sendHtml(chatId, "⚠️ Could not send the Excel file.", null);
        }
    }

    private String limit(String text) {
        if (text == null) return "";
        if (text.length() <= cfg.maxMessageLen()) return text;
        return text.substring(0, cfg.maxMessageLen() - 3) + "...";
    }
}
