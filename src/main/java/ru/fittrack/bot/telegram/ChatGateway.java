package ru.fittrack.bot.telegram;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;

import java.io.File;

public interface ChatGateway {

    void sendHtml(long chatId, String html, InlineKeyboardMarkup kb);

    void editHtml(long chatId, int messageId, String html, InlineKeyboardMarkup kb);

    void answer(String callbackId, String text);

    void sendDocument(long chatId, File file, String caption);
}
