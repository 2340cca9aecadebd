package com.purchasingpower.orchestrator.model.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON agent card as found in the agent catalog directory.
 *
 * <p>Example:
 * <pre>
 * {
 *   "agentId": "general-inquiry",
 *   "name": "General Inquiry Agent",
 *   "version": "1.0.0",
 *   "capabilities": ["generalInquiry", "dataAnalysis"],
 *   "tasks": ["answer", "summarize"],
 *   "industries": []
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentCard {
    private String agentId;
    private String name;
    private String description;
    private String version;
    private String agentType;
    private List<String> capabilities = new ArrayList<>();
    private List<String> tasks = new ArrayList<>();
    private List<String> permissions = new ArrayList<>();
    private List<String> industries = new ArrayList<>();
}
