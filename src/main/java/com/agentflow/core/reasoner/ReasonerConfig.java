package com.agentflow.core.reasoner;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReasonerConfig {

    /**
     * Fallback reasoner, replaced by any other {@link Reasoner} bean.
     */
    @Bean
    @ConditionalOnMissingBean(Reasoner.class)
    public Reasoner stagePipelineReasoner() {
        return new StagePipelineReasoner();
    }
}
