package com.agentflow.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the orchestration store.
 * <p>
 * {@code agentflow.store.type=memory} (default) keeps everything in process;
 * {@code agentflow.store.type=jdbc} persists to the configured database.
 */
@Component
@ConfigurationProperties(prefix = "agentflow.store")
public class StoreProperties {

    private String type = "memory";
    private Jdbc jdbc = new Jdbc();

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public Jdbc getJdbc() { return jdbc; }
    public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }

    public static class Jdbc {
        private String url = "jdbc:postgresql://localhost:5432/agentflow";
        private String username = "agentflow";
        private String password = "";
        private String tablePrefix = "agentflow_";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getTablePrefix() { return tablePrefix; }
        public void setTablePrefix(String tablePrefix) { this.tablePrefix = tablePrefix; }
    }
}
