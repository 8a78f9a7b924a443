package com.wayfinder.core.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Turn budgets for the two-level agent loop.
 */
@Component
@ConfigurationProperties(prefix = "wayfinder.agent")
public class AgentProperties {

    private int maxSupervisorTurns = 4;
    private int maxAgentTurns = 6;

    public int getMaxSupervisorTurns() { return maxSupervisorTurns; }
    public void setMaxSupervisorTurns(int maxSupervisorTurns) { this.maxSupervisorTurns = maxSupervisorTurns; }
    public int getMaxAgentTurns() { return maxAgentTurns; }
    public void setMaxAgentTurns(int maxAgentTurns) { this.maxAgentTurns = maxAgentTurns; }
}
