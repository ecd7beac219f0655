package ru.fittrack.bot.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.fittrack.bot.config.Config;
import ru.fittrack.bot.service.PendingSetupService;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public final class SchedulerService {
    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private final Config cfg;
    private final PendingSetupService pendingSetups;

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "fittrack-scheduler");
        t.setDaemon(true);
        return t;
    });

    public SchedulerService(Config cfg, PendingSetupService pendingSetups) {
        this.cfg = cfg;
        this.pendingSetups = pendingSetups;
    }

    public void start() {
        exec.scheduleAtFixedRate(this::tickSafe, 5, cfg.schedulerIntervalSeconds(), TimeUnit.SECONDS);
        log.info("Scheduler started, interval {}s", cfg.schedulerIntervalSeconds());
    }

    public void stop() {
        exec.shutdownNow();
    }

    // An exception escaping here would cancel the periodic task.
    void tickSafe() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Scheduler tick failed", e);
        }
    }

    void tick() {
        pendingSetups.purgeExpired();
    }
}
