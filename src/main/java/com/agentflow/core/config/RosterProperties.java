package com.agentflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed roster seeded into an empty store at startup.
 */
@Component
@ConfigurationProperties(prefix = "agentflow.roster")
public class RosterProperties {

    private List<AgentDefinition> agents = new ArrayList<>();

    public List<AgentDefinition> getAgents() { return agents; }
    public void setAgents(List<AgentDefinition> agents) { this.agents = agents; }

    public static class AgentDefinition {
        private String role;
        private String name;
        private int maxLoad = 5;
        private List<String> skills = new ArrayList<>();

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getMaxLoad() { return maxLoad; }
        public void setMaxLoad(int maxLoad) { this.maxLoad = maxLoad; }

        public List<String> getSkills() { return skills; }
        public void setSkills(List<String> skills) { this.skills = skills; }
    }
}
