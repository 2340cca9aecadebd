package com.purchasingpower.orchestrator.config;

import com.purchasingpower.orchestrator.model.agent.AgentIntent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the agent registry, the communication bus and its background housekeeping.
 *
 * <p>Properties are loaded from the {@code app.orchestration} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   orchestration:
 *     default-method: custom
 *     agent-call-timeout: 60s
 *     max-concurrent-per-agent-type: 10
 *     semaphore-wait-timeout: 30s
 *     max-workflow-hops: 10
 *     fallback-intent: GENERAL_INQUIRY
 *     catalog-directory: ./agents
 *     housekeeping:
 *       health-check-interval: 5m
 *       health-stale-after: 5m
 *       lock-idle-timeout: 10m
 *       lock-cleanup-interval: 5m
 *       approval-cleanup-interval: 5m
 * </pre>
 *
 * @since 1.0.0
 */
@Component
@ConfigurationProperties(prefix = "app.orchestration")
@Validated
@Data
public class OrchestrationProperties {

    /**
     * Orchestration method stamped on requests until changed at runtime.
     * One of custom, foundry_workflow, connected_agent.
     */
    @NotBlank
    private String defaultMethod = "custom";

    /**
     * Deadline for a single agent invocation.
     */
    @NotNull
    private Duration agentCallTimeout = Duration.ofSeconds(60);

    /**
     * In-flight requests allowed per agent type.
     */
    @Min(1)
    private int maxConcurrentPerAgentType = 10;

    /**
     * How long a request waits for a concurrency permit before failing with a retryable timeout.
     */
    @NotNull
    private Duration semaphoreWaitTimeout = Duration.ofSeconds(30);

    /**
     * Follow-up hops a single workflow call may chain before it is stopped.
     */
    @Min(1)
    private int maxWorkflowHops = 10;

    /**
     * Intent tried once when nothing serves the requested intent.
     */
    @NotNull
    private AgentIntent fallbackIntent = AgentIntent.GENERAL_INQUIRY;

    /**
     * Directory of JSON agent cards loaded at startup. Optional.
     */
    private String catalogDirectory;

    @Valid
    private Housekeeping housekeeping = new Housekeeping();

    @Valid
    private ExecutorSettings executor = new ExecutorSettings();

    @Data
    public static class Housekeeping {

        private boolean enabled = true;

        @NotNull
        private Duration healthCheckInterval = Duration.ofMinutes(5);

        /**
         * Cached health older than this is refreshed on read.
         */
        @NotNull
        private Duration healthStaleAfter = Duration.ofMinutes(5);

        @NotNull
        private Duration lockIdleTimeout = Duration.ofMinutes(10);

        @NotNull
        private Duration lockCleanupInterval = Duration.ofMinutes(5);

        @NotNull
        private Duration approvalCleanupInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class ExecutorSettings {

        @Min(1)
        private int corePoolSize = 5;

        @Min(1)
        private int maxPoolSize = 20;

        @Min(0)
        private int queueCapacity = 200;
    }
}
