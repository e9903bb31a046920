package com.autorestart.plugin;

import com.autorestart.common.config.ConfigStore;
import com.autorestart.common.config.PluginConfig;
import com.autorestart.cron.JobRunLog;
import com.autorestart.cron.JobScheduler;
import com.autorestart.cron.RestartTrigger;
import com.autorestart.cron.SchedulingError;
import com.autorestart.cron.TimezoneResolver;
import com.autorestart.cron.TriggerParse;
import com.autorestart.dashboard.DashboardClient;
import com.autorestart.plugin.host.MemoryProbe;
import com.autorestart.plugin.host.MessageSender;
import com.autorestart.plugin.host.PlatformConnections;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Entry point the host drives: {@link #initialize()} on load,
 * {@link #onPlatformLoaded(String)} whenever a platform (re)connects and
 * {@link #terminate()} on unload.
 */
@Slf4j
public class RestartPlugin implements AutoCloseable {

    private final ConfigStore configStore;
    private final MessageSender sender;
    private final PlatformConnections connections;
    private final MemoryProbe memoryProbe;
    private final Map<String, String> env;
    private final Clock clock;
    private final Supplier<ScheduledExecutorService> timerFactory;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private DashboardClient dashboard;
    private JobScheduler scheduler;
    private RestartOrchestrator orchestrator;
    private CompletionNotifier notifier;
    private RestartCommands commands;

    public RestartPlugin(ConfigStore configStore, MessageSender sender, PlatformConnections connections) {
        this(configStore, sender, connections, MemoryProbe.system(), System.getenv(), Clock.systemUTC(),
                JobScheduler::newTimerExecutor);
    }

    public RestartPlugin(ConfigStore configStore, MessageSender sender, PlatformConnections connections,
            MemoryProbe memoryProbe, Map<String, String> env, Clock clock,
            Supplier<ScheduledExecutorService> timerFactory) {
        this.configStore = configStore;
        this.sender = sender;
        this.connections = connections;
        this.memoryProbe = memoryProbe;
        this.env = env;
        this.clock = clock;
        this.timerFactory = timerFactory;
    }

    /**
     * Build the client and scheduler, and arm the configured schedule when
     * {@code restart_switch} is on. A bad schedule is logged and left unarmed.
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            log.debug("Restart plugin already initialized");
            return;
        }
        PluginConfig config = configStore.load();
        ZoneId zone = TimezoneResolver.resolve(config.getTimezone());

        PendingRestartStore markers = new PendingRestartStore(configStore);
        dashboard = new DashboardClient(configStore, env, clock);
        scheduler = new JobScheduler(zone, clock, timerFactory.get(), new JobRunLog());
        orchestrator = new RestartOrchestrator(markers, dashboard, scheduler, clock);
        notifier = new CompletionNotifier(markers, connections, sender, memoryProbe, configStore, clock);
        commands = new RestartCommands(orchestrator, configStore, clock);

        if (config.isRestartSwitch()) {
            armConfiguredSchedule(config);
        }
        log.info("Restart plugin initialized (timezone {}, scheduled restart {})",
                zone.getId(), config.isRestartSwitch() ? "on" : "off");
    }

    /**
     * Host signal that a platform finished loading or reconnected.
     */
    public void onPlatformLoaded(String platformId) {
        if (!initialized.get() || terminated.get()) {
            log.debug("Ignoring platform '{}' load signal, plugin not running", platformId);
            return;
        }
        try {
            notifier.onPlatformConnected(platformId);
        } catch (RuntimeException e) {
            log.error("Restart completion handling failed for platform '{}': {}", platformId, e.getMessage(), e);
        }
    }

    public RestartCommands commands() {
        requireRunning();
        return commands;
    }

    /**
     * Stop the scheduler and close the HTTP connection pool. Safe to call
     * more than once.
     */
    public void terminate() {
        if (!initialized.get() || !terminated.compareAndSet(false, true)) {
            return;
        }
        scheduler.close();
        dashboard.close();
        log.info("Restart plugin terminated");
    }

    @Override
    public void close() {
        terminate();
    }

    RestartOrchestrator orchestrator() {
        return orchestrator;
    }

    JobScheduler scheduler() {
        return scheduler;
    }

    private void armConfiguredSchedule(PluginConfig config) {
        try {
            RestartTrigger trigger = TriggerParse.fromConfig(config);
            if (trigger.isNone()) {
                log.warn("restart_switch is on but no schedule is configured");
                return;
            }
            orchestrator.configureRecurringRestart(trigger);
        } catch (SchedulingError e) {
            log.error("Scheduled restart not armed: {}", e.getMessage());
        }
    }

    private void requireRunning() {
        if (!initialized.get() || terminated.get()) {
            throw new IllegalStateException("Restart plugin is not running");
        }
    }
}
