package com.agentflow.core.logging;

import com.agentflow.core.model.Agent;
import org.slf4j.MDC;

/**
 * Utility for managing orchestration MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSweep(String sweep) {
        MDC.put("sweep", sweep);
    }

    public static void setTask(long taskId) {
        MDC.put("taskId", String.valueOf(taskId));
    }

    public static void setTask(long taskId, Agent agent) {
        setTask(taskId);
        if (agent != null) {
            MDC.put("agentId", String.valueOf(agent.id()));
            MDC.put("agentRole", agent.role().tag());
        }
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("agentId");
        MDC.remove("agentRole");
    }

    public static void clear() {
        clearTask();
        MDC.remove("sweep");
    }
}
