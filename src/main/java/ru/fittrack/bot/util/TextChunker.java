package ru.fittrack.bot.util;

import java.util.ArrayList;
import java.util.List;

public final class TextChunker {

    private TextChunker() {}

    public static List<String> splitByLines(String text, int maxLen) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        if (text.length() <= maxLen) {
            out.add(text);
            return out;
        }
        StringBuilder cur = new StringBuilder();
        for (String line : text.split("\n")) {
            if (cur.length() > 0 && cur.length() + line.length() + 1 > maxLen) {
                out.add(cur.toString());
                cur.setLength(0);
            }
            // a single line longer than the limit is cut hard
            while (line.length() > maxLen) {
                out.add(line.substring(0, maxLen));
                line = line.substring(maxLen);
            }
            if (cur.length() > 0) cur.append("\n");
            cur.append(line);
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }
}
