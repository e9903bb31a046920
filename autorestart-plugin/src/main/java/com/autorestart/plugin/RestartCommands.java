package com.autorestart.plugin;

import com.autorestart.common.config.ConfigStore;
import com.autorestart.common.config.PluginConfig;
import com.autorestart.common.infra.FormatDuration;
import com.autorestart.cron.JobRun;
import com.autorestart.cron.JobScheduler;
import com.autorestart.cron.RestartTrigger;
import com.autorestart.cron.SchedulingError;
import com.autorestart.cron.TriggerParse;
import com.autorestart.dashboard.DashboardError;
import com.autorestart.plugin.host.RequestContext;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Administrator commands. The host's command router has already checked
 * permissions; each method returns or sends the reply text.
 */
@Slf4j
public class RestartCommands {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm xxx");

    private final RestartOrchestrator orchestrator;
    private final ConfigStore configStore;
    private final Clock clock;

    public RestartCommands(RestartOrchestrator orchestrator, ConfigStore configStore, Clock clock) {
        this.orchestrator = orchestrator;
        this.configStore = configStore;
        this.clock = clock;
    }

    /**
     * Restart now and report completion back to the requesting session.
     */
    public void restartNow(RequestContext ctx) {
        ctx.reply("Restarting…");
        try {
            orchestrator.requestRestart(ctx.getSession(), ctx.getPlatformId());
        } catch (UncheckedIOException e) {
            log.error("Restart aborted, pending state not saved", e);
            ctx.reply("Restart aborted: " + e.getMessage());
        } catch (DashboardError e) {
            ctx.reply("Restart failed: " + e.getMessage());
        }
    }

    /**
     * Turn the recurring restart on or off and persist the switch.
     */
    public synchronized String setRecurringEnabled(boolean enabled) {
        PluginConfig config = configStore.load();
        RestartTrigger trigger;
        try {
            trigger = enabled ? TriggerParse.fromConfig(config) : RestartTrigger.none();
        } catch (SchedulingError e) {
            return "Configured schedule is invalid: " + e.getMessage();
        }

        try {
            configStore.update(Map.of(PluginConfig.RESTART_SWITCH, enabled));
        } catch (IOException e) {
            log.error("Could not save restart_switch", e);
            return "Could not save configuration: " + e.getMessage();
        }

        if (!enabled) {
            orchestrator.disableRecurringRestart();
            return "Scheduled restart disabled";
        }
        if (trigger.isNone()) {
            return "Scheduled restart enabled, but no schedule is set";
        }
        try {
            orchestrator.configureRecurringRestart(trigger);
        } catch (SchedulingError e) {
            return "Scheduled restart enabled, but the schedule cannot run: " + e.getMessage();
        }
        return "Scheduled restart enabled (" + trigger.describe() + ")";
    }

    /**
     * Replace the schedule. The schedule is seconds, {@code HH:MM} or a five-field
     * cron expression; it is stored under the matching key and the other two
     * keys are cleared. When the recurring restart is on, it is re-armed.
     */
    public synchronized String setSchedule(String input) {
        RestartTrigger trigger;
        try {
            trigger = TriggerParse.parse(input);
        } catch (SchedulingError e) {
            return "Invalid schedule: " + e.getMessage();
        }

        PluginConfig config = configStore.load();
        if (config.isRestartSwitch()) {
            try {
                orchestrator.configureRecurringRestart(trigger);
            } catch (SchedulingError e) {
                return "Invalid schedule: " + e.getMessage();
            }
        }

        Map<String, Object> changes = new HashMap<>();
        changes.put(PluginConfig.RESTART_INTERVAL,
                trigger.kind() == RestartTrigger.Kind.INTERVAL ? trigger.intervalSeconds() : null);
        changes.put(PluginConfig.RESTART_TIME, trigger.kind() == RestartTrigger.Kind.DAILY_TIME
                ? String.format("%02d:%02d", trigger.timeOfDay().getHour(), trigger.timeOfDay().getMinute())
                : null);
        changes.put(PluginConfig.RESTART_CRON,
                trigger.kind() == RestartTrigger.Kind.CRON ? trigger.cronExpression() : null);
        try {
            configStore.update(changes);
        } catch (IOException e) {
            log.error("Could not save schedule", e);
            return "Schedule is active but could not be saved: " + e.getMessage();
        }

        log.info("Restart schedule set to {}", trigger.describe());
        return config.isRestartSwitch()
                ? "Schedule set: " + trigger.describe()
                : "Schedule set: " + trigger.describe() + " (scheduled restart is disabled)";
    }

    /**
     * Switch state, schedule, timezone, next run and last run outcome.
     */
    public String scheduleStatus() {
        PluginConfig config = configStore.load();
        JobScheduler scheduler = orchestrator.scheduler();
        String job = RestartOrchestrator.RECURRING_JOB;

        StringBuilder status = new StringBuilder()
                .append("Scheduled restart: ").append(config.isRestartSwitch() ? "enabled" : "disabled")
                .append("\nSchedule: ").append(configuredSchedule(config))
                .append("\nTimezone: ").append(scheduler.getZone().getId())
                .append("\nNext run: ")
                .append(scheduler.nextFireTime(job).map(TIME_FORMAT::format).orElse("not scheduled"));

        Optional<JobRun> last = scheduler.getRunLog().last(job);
        last.ifPresent(run -> {
            String ago = FormatDuration.formatCompact(Duration.between(run.getStartedAt(), clock.instant()));
            status.append("\nLast run: ").append(ago).append(" ago, ")
                    .append(run.isSuccess() ? "ok" : "failed: " + run.getError());
        });
        orchestrator.pendingRestart().ifPresent(marker ->
                status.append("\nPending restart since ").append(marker.requestedAt()));
        return status.toString();
    }

    private static String configuredSchedule(PluginConfig config) {
        try {
            return TriggerParse.fromConfig(config).describe();
        } catch (SchedulingError e) {
            return "invalid (" + e.getMessage() + ")";
        }
    }
}
