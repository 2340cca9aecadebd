package com.purchasingpower.orchestrator.model.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Declared capabilities of a registered agent.
 *
 * <p>Owned by the registry. Callers only ever receive copies made with {@link #snapshot()},
 * so mutating a returned capability never affects routing.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentCapability {

    private String agentId;

    private String agentName;

    private String description;

    private String version;

    /**
     * Concurrency bucket. Agents sharing a type share one in-flight limit.
     * Defaults to the agent id.
     */
    private String agentType;

    @Builder.Default
    private List<AgentIntent> supportedIntents = new ArrayList<>();

    @Builder.Default
    private List<String> supportedTasks = new ArrayList<>();

    @Builder.Default
    private List<String> requiredPermissions = new ArrayList<>();

    /**
     * Empty means the agent serves every industry.
     */
    @Builder.Default
    private List<String> supportedIndustries = new ArrayList<>();

    @Builder.Default
    private boolean active = true;

    private AgentPerformanceMetrics performanceMetrics;

    private Instant lastUpdated;

    public String concurrencyKey() {
        return agentType != null && !agentType.isBlank() ? agentType : agentId;
    }

    public boolean supports(AgentIntent intent) {
        return supportedIntents != null && supportedIntents.contains(intent);
    }

    public boolean servesIndustry(String industry) {
        if (industry == null || industry.isBlank() || supportedIndustries == null || supportedIndustries.isEmpty()) {
            return true;
        }
        return supportedIndustries.stream().anyMatch(i -> i.equalsIgnoreCase(industry));
    }

    /**
     * Deep copy, safe to hand out to callers.
     */
    public AgentCapability snapshot() {
        return toBuilder()
                .supportedIntents(copyOf(supportedIntents))
                .supportedTasks(copyOf(supportedTasks))
                .requiredPermissions(copyOf(requiredPermissions))
                .supportedIndustries(copyOf(supportedIndustries))
                .performanceMetrics(performanceMetrics != null ? performanceMetrics.copy() : null)
                .build();
    }

    /**
     * Null-tolerant list copy, a missing list becomes empty.
     */
    public static <T> List<T> copyOf(List<T> source) {
        return source != null ? new ArrayList<>(source) : new ArrayList<>();
    }
}
