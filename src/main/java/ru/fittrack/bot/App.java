package ru.fittrack.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;
import ru.fittrack.bot.config.Config;
import ru.fittrack.bot.db.Database;
import ru.fittrack.bot.db.Schema;
import ru.fittrack.bot.db.Storage;
import ru.fittrack.bot.scheduler.SchedulerService;
import ru.fittrack.bot.service.*;
import ru.fittrack.bot.telegram.FitTrackBot;

import java.time.Clock;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        Config cfg = Config.load();
        log.info("Config dbPath={}", cfg.dbPath().toAbsolutePath());

        Database db = new Database(cfg);
        Schema.migrate(db);

        BotFacade facade = createFacade(cfg, db, Clock.system(cfg.zoneId()));

        FitTrackBot bot = new FitTrackBot(cfg, facade);
        TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
        api.registerBot(bot);
        bot.registerCommands();

        SchedulerService scheduler = new SchedulerService(cfg, facade.pending());
        scheduler.start();
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::stop, "fittrack-shutdown"));

        log.info("FitTrack bot started as @{}, {} users known", cfg.botUsername(), facade.users().countUsers());
    }

    public static BotFacade createFacade(Config cfg, Database db, Clock clock) {
        Storage storage = new Storage();

        UserService userService = new UserService(db, storage, clock);
        ChallengeRegistry challengeRegistry = new ChallengeRegistry(db, storage, clock);
        CompletionRecorder completionRecorder = new CompletionRecorder(db, storage, challengeRegistry, clock);
        LeaderboardService leaderboardService = new LeaderboardService(db, storage, cfg, clock);
        PendingSetupService pendingSetups = new PendingSetupService(db, cfg, clock);
        ExcelService excelService = new ExcelService(leaderboardService, challengeRegistry, completionRecorder);

        return new BotFacade(
                cfg,
                userService,
                challengeRegistry,
                completionRecorder,
                leaderboardService,
                pendingSetups,
                excelService
        );
    }
}
