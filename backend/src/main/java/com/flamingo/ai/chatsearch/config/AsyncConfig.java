package com.flamingo.ai.chatsearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the pool that runs asynchronous searches. */
@Configuration
public class AsyncConfig {

  @Bean(name = "searchExecutor")
  public ThreadPoolTaskExecutor searchExecutor(SearchConfig searchConfig) {
    SearchConfig.Async async = searchConfig.getAsync();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(async.getCorePoolSize());
    executor.setMaxPoolSize(async.getMaxPoolSize());
    executor.setQueueCapacity(async.getQueueCapacity());
    executor.setThreadNamePrefix("search-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
