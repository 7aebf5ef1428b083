package com.agentflow.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time source and worker pools shared by the orchestration components.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs sweep bodies so a slow sweep never delays the others. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService sweepExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("agentflow-sweep"));
    }

    /** Runs per-task reasoner calls, bounded by {@code agentflow.orchestrator.max-concurrent-tasks}. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService taskExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentTasks()),
                daemonThreads("agentflow-task"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
