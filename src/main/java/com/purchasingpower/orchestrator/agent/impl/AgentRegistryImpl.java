package com.purchasingpower.orchestrator.agent.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.orchestrator.agent.AgentHandle;
import com.purchasingpower.orchestrator.agent.AgentRegistry;
import com.purchasingpower.orchestrator.config.OrchestrationProperties;
import com.purchasingpower.orchestrator.exception.AgentRegistrationException;
import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentHealthStatus;
import com.purchasingpower.orchestrator.model.agent.AgentIntent;
import com.purchasingpower.orchestrator.model.agent.AgentPerformanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-process agent registry.
 *
 * <p>Entries live in a {@link ConcurrentHashMap}. Metrics are swapped with compare-and-set, so
 * {@link #updateAgentMetrics} never blocks readers or other writers. Registration decisions for a
 * given id are made inside {@code compute}, which serializes them per key.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class AgentRegistryImpl implements AgentRegistry {

    private final Map<String, RegisteredAgent> agents = new ConcurrentHashMap<>();
    private final Duration healthStaleAfter;

    public AgentRegistryImpl(OrchestrationProperties properties) {
        this.healthStaleAfter = properties.getHousekeeping().getHealthStaleAfter();
    }

    @Override
    public boolean registerAgent(String agentId, AgentHandle handle, AgentCapability capability) {
        Preconditions.checkArgument(agentId != null && !agentId.isBlank(), "agentId cannot be empty");
        Preconditions.checkNotNull(handle, "handle cannot be null");
        Preconditions.checkNotNull(capability, "capability cannot be null");
        validateCapability(agentId, capability);

        AgentCapability stored = capability.snapshot();
        stored.setAgentId(agentId);
        stored.setLastUpdated(Instant.now());
        AgentPerformanceMetrics initialMetrics = stored.getPerformanceMetrics() != null
                ? stored.getPerformanceMetrics().toBuilder().agentId(agentId).build()
                : AgentPerformanceMetrics.unobserved(agentId);
        stored.setPerformanceMetrics(null);

        boolean[] registered = {false};
        agents.compute(agentId, (id, existing) -> {
            if (existing != null && existing.isActive()) {
                return existing;
            }
            if (existing != null) {
                log.info("Replacing inactive registration of agent {}", id);
            }
            registered[0] = true;
            return new RegisteredAgent(handle, stored, initialMetrics);
        });

        if (registered[0]) {
            log.info("✅ Agent {} ({}) registered for intents {}", agentId, stored.getAgentName(), stored.getSupportedIntents());
        } else {
            log.warn("⚠️ Agent {} is already registered and active, registration rejected", agentId);
        }
        return registered[0];
    }

    @Override
    public boolean unregisterAgent(String agentId) {
        if (agentId == null) {
            return false;
        }
        RegisteredAgent removed = agents.remove(agentId);
        if (removed == null) {
            log.debug("Unregister ignored, agent {} not found", agentId);
            return false;
        }
        log.info("Agent {} unregistered", agentId);
        return true;
    }

    @Override
    public List<AgentCapability> findAgentsForIntent(AgentIntent intent, String industry) {
        if (intent == null) {
            return List.of();
        }
        return agents.values().stream()
                .filter(RegisteredAgent::isActive)
                .map(RegisteredAgent::capabilitySnapshot)
                .filter(capability -> capability.supports(intent))
                .filter(capability -> capability.servesIndustry(industry))
                .sorted(Comparator.comparing(AgentCapability::getAgentId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AgentHandle> getAgentHandle(String agentId) {
        return Optional.ofNullable(agentId).map(agents::get).map(RegisteredAgent::handle);
    }

    @Override
    public Optional<AgentCapability> getAgentCapability(String agentId) {
        return Optional.ofNullable(agentId).map(agents::get).map(RegisteredAgent::capabilitySnapshot);
    }

    @Override
    public List<AgentCapability> getAgentCapabilities() {
        return agents.values().stream()
                .map(RegisteredAgent::capabilitySnapshot)
                .sorted(Comparator.comparing(AgentCapability::getAgentId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean setAgentActive(String agentId, boolean active) {
        RegisteredAgent entry = agentId != null ? agents.get(agentId) : null;
        if (entry == null) {
            return false;
        }
        entry.setActive(active);
        entry.health = active
                ? AgentHealthStatus.registered(agentId)
                : new AgentHealthStatus(agentId, false, AgentHealthStatus.INACTIVE, Instant.now(), 0, null);
        log.info("Agent {} is now {}", agentId, active ? "active" : "inactive");
        return true;
    }

    @Override
    public void updateAgentMetrics(String agentId, long responseTimeMs, boolean success, double confidence) {
        RegisteredAgent entry = agentId != null ? agents.get(agentId) : null;
        if (entry == null) {
            log.debug("Metrics update ignored, agent {} not found", agentId);
            return;
        }
        AgentPerformanceMetrics updated = entry.metrics.updateAndGet(
                current -> fold(current, responseTimeMs, success, confidence));

        log.debug("Updated metrics for agent {}: success rate {}, avg response {}ms",
                agentId, String.format("%.2f", updated.getSuccessRate()), Math.round(updated.getAverageResponseTimeMs()));
    }

    @Override
    public Map<String, AgentHealthStatus> getAllAgentHealth() {
        Map<String, AgentHealthStatus> snapshot = new LinkedHashMap<>();
        agents.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> snapshot.put(e.getKey(), e.getValue().health));
        return snapshot;
    }

    @Override
    public AgentHealthStatus getAgentHealth(String agentId) {
        RegisteredAgent entry = agentId != null ? agents.get(agentId) : null;
        if (entry == null) {
            return AgentHealthStatus.notFound(agentId);
        }
        AgentHealthStatus cached = entry.health;
        if (cached.lastChecked().isBefore(Instant.now().minus(healthStaleAfter))) {
            return refreshHealth(agentId, entry);
        }
        return cached;
    }

    @Override
    public boolean isAgentAvailable(String agentId) {
        RegisteredAgent entry = agentId != null ? agents.get(agentId) : null;
        return entry != null && entry.isActive() && getAgentHealth(agentId).healthy();
    }

    @Override
    public void refreshAllHealth() {
        log.debug("Refreshing health of {} agents", agents.size());
        agents.forEach(this::refreshHealth);
    }

    private AgentHealthStatus refreshHealth(String agentId, RegisteredAgent entry) {
        AgentHealthStatus status;
        if (!entry.isActive()) {
            status = new AgentHealthStatus(agentId, false, AgentHealthStatus.INACTIVE, Instant.now(), 0, null);
        } else {
            long start = System.currentTimeMillis();
            try {
                boolean healthy = entry.handle().ping();
                status = new AgentHealthStatus(agentId, healthy,
                        healthy ? AgentHealthStatus.HEALTHY : AgentHealthStatus.UNHEALTHY,
                        Instant.now(), System.currentTimeMillis() - start, null);
            } catch (RuntimeException e) {
                log.warn("⚠️ Health probe failed for agent {}: {}", agentId, e.getMessage());
                status = new AgentHealthStatus(agentId, false, AgentHealthStatus.UNHEALTHY,
                        Instant.now(), System.currentTimeMillis() - start, e.getMessage());
            }
        }
        entry.health = status;
        return status;
    }

    /**
     * Success rate is exact. Latency and confidence use the rolling {@code (avg + sample) / 2};
     * the first observed sample replaces the seed values.
     */
    static AgentPerformanceMetrics fold(AgentPerformanceMetrics current, long responseTimeMs,
                                        boolean success, double confidence) {
        long total = current.getTotalRequests() + 1;
        long successful = current.getSuccessfulRequests() + (success ? 1 : 0);
        boolean first = current.getTotalRequests() == 0;

        return current.toBuilder()
                .totalRequests(total)
                .successfulRequests(successful)
                .successRate((double) successful / total)
                .averageResponseTimeMs(first ? responseTimeMs : (current.getAverageResponseTimeMs() + responseTimeMs) / 2)
                .averageConfidence(first ? confidence : (current.getAverageConfidence() + confidence) / 2)
                .lastUpdated(Instant.now())
                .build();
    }

    private void validateCapability(String agentId, AgentCapability capability) {
        if (capability.getAgentName() == null || capability.getAgentName().isBlank()) {
            throw new AgentRegistrationException(agentId, "Agent name is required");
        }
        if (capability.getSupportedIntents() == null || capability.getSupportedIntents().isEmpty()) {
            throw new AgentRegistrationException(agentId, "Agent must support at least one intent");
        }
        if (capability.getVersion() == null || capability.getVersion().isBlank()) {
            log.warn("Agent {} registered without a version", agentId);
        }
    }

    private static final class RegisteredAgent {
        private final AgentHandle handle;
        private final AgentCapability capability;
        private final AtomicReference<AgentPerformanceMetrics> metrics;
        private volatile boolean active;
        private volatile AgentHealthStatus health;

        RegisteredAgent(AgentHandle handle, AgentCapability capability, AgentPerformanceMetrics metrics) {
            this.handle = handle;
            this.capability = capability;
            this.metrics = new AtomicReference<>(metrics);
            this.active = capability.isActive();
            this.health = capability.isActive()
                    ? AgentHealthStatus.registered(capability.getAgentId())
                    : new AgentHealthStatus(capability.getAgentId(), false, AgentHealthStatus.INACTIVE, Instant.now(), 0, null);
        }

        AgentHandle handle() {
            return handle;
        }

        boolean isActive() {
            return active;
        }

        void setActive(boolean active) {
            this.active = active;
        }

        AgentCapability capabilitySnapshot() {
            AgentCapability copy = capability.snapshot();
            copy.setActive(active);
            copy.setPerformanceMetrics(metrics.get().copy());
            return copy;
        }
    }
}
