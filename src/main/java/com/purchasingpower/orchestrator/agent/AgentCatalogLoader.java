package com.purchasingpower.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.config.OrchestrationProperties;
import com.purchasingpower.orchestrator.exception.AgentRegistrationException;
import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentCard;
import com.purchasingpower.orchestrator.model.agent.AgentIntent;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registers agents at startup.
 *
 * <p>Agent cards from the catalog directory are applied first, so a card can override the
 * capability an agent bean declares for itself. Agent beans without a card are then registered
 * with their own description. Cards naming an agent with no bean are skipped.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class AgentCatalogLoader {

    private final AgentRegistry registry;
    private final Map<String, SelfDescribingAgent> agentBeans;
    private final ObjectMapper objectMapper;
    private final OrchestrationProperties properties;

    public AgentCatalogLoader(AgentRegistry registry,
                              List<SelfDescribingAgent> agents,
                              ObjectMapper objectMapper,
                              OrchestrationProperties properties) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.agentBeans = new LinkedHashMap<>();
        agents.forEach(agent -> agentBeans.put(agent.getAgentId(), agent));
    }

    @PostConstruct
    public void registerAgents() {
        log.info("🚀 Registering agents ({} agent beans)", agentBeans.size());

        Set<String> registered = new HashSet<>();
        String directory = properties.getCatalogDirectory();
        if (directory != null && !directory.isBlank()) {
            registered.addAll(loadCatalog(Path.of(directory)));
        }

        agentBeans.forEach((agentId, agent) -> {
            if (!registered.contains(agentId) && registry.registerAgent(agentId, agent, agent.describe())) {
                registered.add(agentId);
            }
        });

        log.info("✅ {} agents registered", registered.size());
    }

    /**
     * Load every {@code *.json} card in the directory and register the ones backed by an agent bean.
     *
     * @return ids of the agents registered from cards
     */
    public List<String> loadCatalog(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("⚠️ Agent catalog directory {} does not exist, skipping", directory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list agent catalog " + directory, e);
        }

        List<String> registered = new ArrayList<>();
        for (Path file : files) {
            try {
                AgentCard card = objectMapper.readValue(file.toFile(), AgentCard.class);
                if (registerCard(card)) {
                    registered.add(card.getAgentId());
                }
            } catch (IOException | AgentRegistrationException e) {
                log.error("❌ Skipping agent card {}: {}", file.getFileName(), e.getMessage());
            }
        }
        log.info("Loaded {} of {} agent cards from {}", registered.size(), files.size(), directory);
        return registered;
    }

    private boolean registerCard(AgentCard card) {
        SelfDescribingAgent handle = agentBeans.get(card.getAgentId());
        if (handle == null) {
            log.warn("⚠️ Agent card {} has no matching agent implementation, skipping", card.getAgentId());
            return false;
        }
        return registry.registerAgent(card.getAgentId(), handle, toCapability(card));
    }

    static AgentCapability toCapability(AgentCard card) {
        List<AgentIntent> intents = AgentCapability.copyOf(card.getCapabilities()).stream()
                .map(AgentIntent::fromName)
                .filter(intent -> intent != AgentIntent.UNKNOWN)
                .distinct()
                .collect(Collectors.toList());

        return AgentCapability.builder()
                .agentId(card.getAgentId())
                .agentName(Objects.requireNonNullElse(card.getName(), card.getAgentId()))
                .description(card.getDescription())
                .version(card.getVersion())
                .agentType(card.getAgentType())
                .supportedIntents(intents)
                .supportedTasks(AgentCapability.copyOf(card.getTasks()))
                .requiredPermissions(AgentCapability.copyOf(card.getPermissions()))
                .supportedIndustries(AgentCapability.copyOf(card.getIndustries()))
                .build();
    }
}
