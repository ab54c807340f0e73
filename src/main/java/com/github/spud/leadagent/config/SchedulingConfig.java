package com.github.spud.leadagent.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 开启跟进任务调度
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "app.agent.followup.enabled", havingValue = "true")
public class SchedulingConfig {

}
