package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.service.SessionCleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Background housekeeping tasks. Disabled with {@code app.scheduling.enabled=false}, which tests use.
 * The scheduler is a container-managed bean so its threads stop with the context.
 */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(value = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SchedulingConfig implements SchedulingConfigurer {

  private final SessionCleanupService sessionCleanupService;
  private final ApplicationProperties properties;

  @Bean
  public ThreadPoolTaskScheduler housekeepingScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("housekeeping-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.setTaskScheduler(housekeepingScheduler());

    log.info("Scheduling session cleanup every {} and counter sweep every {}",
             properties.session().cleanupInterval(), properties.rateLimit().fallback().sweepInterval());
    taskRegistrar.addFixedDelayTask(sessionCleanupService::cleanupExpiredSessions,
                                    properties.session().cleanupInterval());
    taskRegistrar.addFixedDelayTask(sessionCleanupService::sweepRateLimitCounters,
                                    properties.rateLimit().fallback().sweepInterval());
  }
}
