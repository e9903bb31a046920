package com.autorestart.plugin;

import com.autorestart.cron.JobScheduler;
import com.autorestart.cron.RestartTrigger;
import com.autorestart.dashboard.DashboardClient;
import com.autorestart.dashboard.DashboardError;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

/**
 * Issues restarts, manual or scheduled, and records each one as a pending
 * marker before the remote call so the next process can report it.
 * <p>
 * A failed remote call leaves the marker in place: the restart may still have
 * happened, and a later reconnection will then be reported.
 */
@Slf4j
public class RestartOrchestrator {

    /** Scheduler slot for the recurring restart. */
    public static final String RECURRING_JOB = "auto-restart";

    private final PendingRestartStore markers;
    private final DashboardClient dashboard;
    private final JobScheduler scheduler;
    private final Clock clock;

    public RestartOrchestrator(PendingRestartStore markers, DashboardClient dashboard,
            JobScheduler scheduler, Clock clock) {
        this.markers = markers;
        this.dashboard = dashboard;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Record who asked, then ask the dashboard to restart the core.
     *
     * @param originSession where to report completion; empty for nobody
     * @param platformId    platform the request came from; empty for any
     * @throws java.io.UncheckedIOException if the marker could not be saved;
     *                                      the restart is not issued
     * @throws DashboardError               if the dashboard call failed
     */
    public void requestRestart(String originSession, String platformId) {
        PendingRestartMarker marker = new PendingRestartMarker(platformId, originSession, clock.instant());
        markers.save(marker);
        log.info("Restart requested (platform '{}', session '{}')", marker.platformId(), marker.originSession());
        try {
            dashboard.restart();
        } catch (DashboardError e) {
            log.warn("Restart call failed, pending marker kept: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Arm {@code trigger} as the recurring restart, replacing the current one.
     * {@link RestartTrigger#none()} disarms it.
     *
     * @throws com.autorestart.cron.SchedulingError if the trigger cannot be
     *                                              scheduled; the current one stays armed
     */
    public void configureRecurringRestart(RestartTrigger trigger) {
        scheduler.register(RECURRING_JOB, trigger, this::scheduledRestart);
    }

    public void disableRecurringRestart() {
        scheduler.remove(RECURRING_JOB);
    }

    public Optional<PendingRestartMarker> pendingRestart() {
        return markers.load();
    }

    JobScheduler scheduler() {
        return scheduler;
    }

    private void scheduledRestart() {
        log.info("Scheduled restart firing");
        requestRestart("", "");
    }
}
