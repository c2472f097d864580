package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What an agent may and may not do at its current maturity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentCapabilities {

    private String agentId;

    private String maturityLevel;

    private double confidenceScore;

    private int maxComplexity;

    private List<String> allowedActions;

    private List<String> restrictedActions;
}
