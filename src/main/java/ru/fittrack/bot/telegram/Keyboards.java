package ru.fittrack.bot.telegram;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import ru.fittrack.bot.model.Frequency;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Keyboards {

    private Keyboards() {}

    public static InlineKeyboardButton btn(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setCallbackData(data);
        return b;
    }

    public static InlineKeyboardMarkup rows(List<List<InlineKeyboardButton>> rows) {
        InlineKeyboardMarkup m = new InlineKeyboardMarkup();
        m.setKeyboard(rows);
        return m;
    }

    @SafeVarargs
    public static InlineKeyboardMarkup ofRows(List<InlineKeyboardButton>... rows) {
        List<List<InlineKeyboardButton>> list = new ArrayList<>(Arrays.asList(rows));
        return rows(list);
    }

    public static InlineKeyboardMarkup frequencyPicker() {
        return ofRows(List.of(
                btn("Daily Challenge", CallbackData.FREQUENCY_PREFIX + Frequency.DAILY.code()),
                btn("Weekly Challenge", CallbackData.FREQUENCY_PREFIX + Frequency.WEEKLY.code())
        ));
    }

    public static InlineKeyboardMarkup checkIn() {
        return ofRows(List.of(
                btn("✅ Yes, completed!", CallbackData.CHECK_DONE),
                btn("❌ Not yet", CallbackData.CHECK_NOT_YET)
        ));
    }
}
