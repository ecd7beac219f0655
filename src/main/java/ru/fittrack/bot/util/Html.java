package ru.fittrack.bot.util;

public final class Html {
    private Html() {}

    public static String esc(String s) {
        if (s == null) return "";
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    public static String bold(String s) {
        return "<b>" + esc(s) + "</b>";
    }
}
