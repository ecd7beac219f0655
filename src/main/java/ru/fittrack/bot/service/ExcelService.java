package ru.fittrack.bot.service;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import ru.fittrack.bot.exception.StorageException;
import ru.fittrack.bot.model.Challenge;
import ru.fittrack.bot.model.Completion;
import ru.fittrack.bot.model.LeaderboardEntry;
import ru.fittrack.bot.util.TimeUtil;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class ExcelService {

    private final LeaderboardService leaderboard;
    private final ChallengeRegistry registry;
    private final CompletionRecorder recorder;

    public ExcelService(LeaderboardService leaderboard, ChallengeRegistry registry, CompletionRecorder recorder) {
        this.leaderboard = leaderboard;
        this.registry = registry;
        this.recorder = recorder;
    }

    public File buildExport(long userId) {
        List<LeaderboardEntry> board = leaderboard.monthlyLeaderboard();
        List<Challenge> challenges = registry.listChallenges(userId);
        List<Completion> completions = recorder.listCompletions(userId);

        try {
            File tmp = File.createTempFile("fittrack_", "_" + userId + ".xlsx");
            try (Workbook wb = new XSSFWorkbook()) {
                writeLeaderboard(wb.createSheet("Leaderboard"), board);
                writeChallenges(wb.createSheet("Challenges"), challenges);
                writeCompletions(wb.createSheet("Completions"), completions, challenges);

                try (FileOutputStream fos = new FileOutputStream(tmp)) {
                    wb.write(fos);
                }
            }
            return tmp;
        } catch (IOException e) {
            throw new StorageException("Failed to build export for user " + userId, e);
        }
    }

    private static void writeLeaderboard(Sheet sheet, List<LeaderboardEntry> board) {
        header(sheet, "Rank", "Name", "Username", "Completions");
        int r = 1;
        for (LeaderboardEntry e : board) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(e.rank());
            row.createCell(1).setCellValue(e.name());
            row.createCell(2).setCellValue(nvl(e.handle()));
            row.createCell(3).setCellValue(e.count());
        }
    }

    private static void writeChallenges(Sheet sheet, List<Challenge> challenges) {
        header(sheet, "Id", "Challenge", "Frequency", "Created", "Active");
        int r = 1;
        for (Challenge ch : challenges) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(ch.id);
            row.createCell(1).setCellValue(ch.text);
            row.createCell(2).setCellValue(ch.frequency.code());
            row.createCell(3).setCellValue(TimeUtil.display(ch.createdAt));
            row.createCell(4).setCellValue(ch.active ? "yes" : "no");
        }
    }

    private static void writeCompletions(Sheet sheet, List<Completion> completions, List<Challenge> challenges) {
        Map<Long, String> texts = new HashMap<>();
        for (Challenge ch : challenges) texts.put(ch.id, ch.text);

        header(sheet, "Id", "Challenge", "Completed");
        int r = 1;
        for (Completion cp : completions) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(cp.id);
            row.createCell(1).setCellValue(nvl(texts.get(cp.challengeId)));
            row.createCell(2).setCellValue(TimeUtil.display(cp.completedAt));
        }
    }

    private static void header(Sheet sheet, String... titles) {
        Row header = sheet.createRow(0);
        for (int i = 0; i < titles.length; i++) {
            header.createCell(i).setCellValue(titles[i]);
        }
    }

    private static String nvl(String s) {
        return s == null ? "" : s;
    }
}
