package com.agentflow;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

// The orchestration store builds its own DataSource when agentflow.store.type=jdbc.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class AgentFlowApplication {

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AgentFlowApplication.class);

        if (serveMode) {
            // REST API, SSE and the sweeps
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off",
                    "agentflow.orchestrator.auto-start=true"
            );
        } else {
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
