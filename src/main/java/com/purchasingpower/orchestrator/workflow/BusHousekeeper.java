package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.agent.AgentRegistry;
import com.purchasingpower.orchestrator.config.OrchestrationProperties;
import com.purchasingpower.orchestrator.service.approval.UserApprovalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Background maintenance for the bus: periodic agent health checks, removal of idle per-type
 * concurrency permits and expiry of stale approval requests.
 *
 * <p>Each task catches and logs its own failures so one bad run never cancels the schedule.
 * Stopping the context cancels every task and shuts the scheduler down.
 */
@Slf4j
@Component
public class BusHousekeeper implements SmartLifecycle {

    private final AgentRegistry registry;
    private final AgentConcurrencyLimiter limiter;
    private final UserApprovalService approvalService;
    private final OrchestrationProperties.Housekeeping settings;

    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();
    private ThreadPoolTaskScheduler scheduler;
    private volatile boolean running;

    public BusHousekeeper(AgentRegistry registry,
                          AgentConcurrencyLimiter limiter,
                          UserApprovalService approvalService,
                          OrchestrationProperties properties) {
        this.registry = registry;
        this.limiter = limiter;
        this.approvalService = approvalService;
        this.settings = properties.getHousekeeping();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!settings.isEnabled()) {
            log.info("🧹 Bus housekeeping disabled");
            running = true;
            return;
        }

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("bus-housekeeping-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        tasks.add(schedule("health check", settings.getHealthCheckInterval(), this::checkHealth));
        tasks.add(schedule("lock cleanup", settings.getLockCleanupInterval(), this::cleanupLocks));
        tasks.add(schedule("approval cleanup", settings.getApprovalCleanupInterval(), this::cleanupApprovals));
        running = true;

        log.info("🚀 Bus housekeeping started: health every {}, locks every {}, approvals every {}",
                settings.getHealthCheckInterval(), settings.getLockCleanupInterval(), settings.getApprovalCleanupInterval());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        tasks.forEach(task -> task.cancel(false));
        tasks.clear();
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
        running = false;
        log.info("🛑 Bus housekeeping stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void checkHealth() {
        registry.refreshAllHealth();
        log.debug("🩺 Refreshed health of {} agents", registry.getAllAgentHealth().size());
    }

    void cleanupLocks() {
        int removed = limiter.cleanupIdle(settings.getLockIdleTimeout());
        if (removed > 0) {
            log.info("🧹 Removed {} idle agent-type permits, {} still tracked", removed, limiter.trackedAgentTypes());
        }
    }

    void cleanupApprovals() {
        approvalService.cleanupExpiredApprovals();
    }

    private ScheduledFuture<?> schedule(String name, Duration interval, Runnable task) {
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("❌ Housekeeping task '{}' failed", name, e);
            }
        }, interval);
    }
}
