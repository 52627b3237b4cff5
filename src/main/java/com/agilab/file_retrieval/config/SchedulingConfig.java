package com.agilab.file_retrieval.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnBooleanProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnBooleanProperty(prefix = "file-retrieval", name = "scheduling.enabled", havingValue = true, matchIfMissing = true)
public class SchedulingConfig {
}
