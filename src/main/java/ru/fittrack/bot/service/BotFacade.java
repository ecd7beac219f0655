package ru.fittrack.bot.service;

import ru.fittrack.bot.config.Config;

public final class BotFacade {

    private final Config cfg;

    private final UserService userService;
    private final ChallengeRegistry challengeRegistry;
    private final CompletionRecorder completionRecorder;
    private final LeaderboardService leaderboardService;
    private final PendingSetupService pendingSetups;
    private final ExcelService excelService;

    public BotFacade(
            Config cfg,
            UserService userService,
            ChallengeRegistry challengeRegistry,
            CompletionRecorder completionRecorder,
            LeaderboardService leaderboardService,
            PendingSetupService pendingSetups,
            ExcelService excelService
    ) {
        this.cfg = cfg;
        this.userService = userService;
        this.challengeRegistry = challengeRegistry;
        this.completionRecorder = completionRecorder;
        this.leaderboardService = leaderboardService;
        this.pendingSetups = pendingSetups;
        this.excelService = excelService;
    }

    public Config cfg() { return cfg; }

    public UserService users() { return userService; }
    public ChallengeRegistry challenges() { return challengeRegistry; }
    public CompletionRecorder completions() { return completionRecorder; }
    public LeaderboardService leaderboard() { return leaderboardService; }
    public PendingSetupService pending() { return pendingSetups; }
    public ExcelService excel() { return excelService; }
}
