package com.linlay.agentsview.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({SyncProperties.class, SessionStoreProperties.class})
public class AgentsViewConfiguration {
}
