package com.agentflow.core.notification;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationConfig {

    @Bean
    @ConditionalOnMissingBean(NotificationSink.class)
    public NotificationSink loggingNotificationSink() {
        return new LoggingNotificationSink();
    }
}
