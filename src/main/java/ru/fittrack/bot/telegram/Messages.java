package ru.fittrack.bot.telegram;

import ru.fittrack.bot.model.Challenge;
import ru.fittrack.bot.model.Frequency;
import ru.fittrack.bot.model.LeaderboardEntry;
import ru.fittrack.bot.util.Html;

import java.util.List;

public final class Messages {
    private Messages() {}

    public static final String NO_PENDING_SETUP = "Please use /start to begin setting up your challenge.";
    public static final String NO_ACTIVE_CHALLENGE = "You don't have an active challenge. Use /start to create one!";
    public static final String NO_STATS = "No statistics available yet!";
    public static final String NOT_YET = "💪 No worries! Come back with /check once it's done.";
    public static final String TEMPORARY_FAILURE = "⚠️ Something went wrong on our side. Please try again in a moment.";

    public static String welcome(String firstName) {
        return "Hi " + Html.esc(firstName) + "! 💪\n\n" +
                "Welcome to the Fitness Tracker Bot!\n" +
                "Choose your challenge frequency:";
    }

    public static String frequencyChosen(Frequency f) {
        return "Great! You've chosen a <b>" + f.code() + "</b> challenge.\n\n" +
                "Now, type your challenge (e.g., '35 pushups per day'):";
    }

    public static String challengeSet(Frequency f, String text) {
        return "✅ Challenge set!\n\n" +
                "📋 Your " + f.code() + " challenge: " + Html.bold(text) + "\n\n" +
                "Use /check whenever you want to log your progress!";
    }

    public static String checkPrompt(Challenge ch) {
        return "Did you complete your " + ch.frequency.code() + " challenge?\n\n" +
                "📋 " + Html.esc(ch.text);
    }

    public static String completed(int total) {
        return "✅ Great job! Challenge marked as complete!\n\n" +
                "Completions so far: <b>" + total + "</b>";
    }

    public static String invalidInput(String reason) {
        return "⚠️ " + Html.esc(reason);
    }

    public static String leaderboard(List<LeaderboardEntry> entries, int windowDays) {
        if (entries.isEmpty()) return NO_STATS;
        StringBuilder sb = new StringBuilder();
        sb.append("🏆 <b>Monthly Leaderboard</b> (Last ").append(windowDays).append(" days)\n\n");
        for (LeaderboardEntry e : entries) {
            sb.append(medal(e.rank())).append(' ')
                    .append(Html.esc(e.name())).append(": ")
                    .append(e.count()).append(e.count() == 1 ? " completion" : " completions")
                    .append('\n');
        }
        return sb.toString();
    }

    public static String help(int windowDays) {
        return "🆘 <b>How to use the bot</b>\n\n" +
                "• /start — set up a new daily or weekly challenge (replaces the current one)\n" +
                "• /check — log that you completed your challenge\n" +
                "• /stats — leaderboard for the last " + windowDays + " days\n" +
                "• /export — Excel file with the leaderboard and your history\n" +
                "• /help — this message";
    }

    static String medal(int rank) {
        switch (rank) {
            case 1: return "🥇";
            case 2: return "🥈";
            case 3: return "🥉";
            default: return "👤";
        }
    }
}
