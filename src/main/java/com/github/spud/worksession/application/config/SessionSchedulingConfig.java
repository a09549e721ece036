package com.github.spud.worksession.application.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SessionSchedulingConfig {

  /**
   * Time source for session timestamps and idle checks
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Single-threaded so two sweeps never overlap
   */
  @Bean(name = "sessionSweepScheduler")
  public ThreadPoolTaskScheduler sessionSweepScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("session-sweep-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(10);
    return scheduler;
  }
}
