package com.flamingo.ai.scopetree.config;

import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for builds that run off the request thread. */
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

  private final ScopeTreeProperties properties;

  @Bean(name = "scopeTreeExecutor")
  public Executor scopeTreeExecutor() {
    ScopeTreeProperties.Executor pool = properties.getExecutor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pool.getCorePoolSize());
    executor.setMaxPoolSize(Math.max(pool.getCorePoolSize(), pool.getMaxPoolSize()));
    executor.setQueueCapacity(pool.getQueueCapacity());
    executor.setThreadNamePrefix("scope-tree-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
