package com.worklog.backend.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TimesheetProperties.class)
public class TimesheetConfiguration {

  /** One thread per activity source; the two fetches of a day run side by side. */
  private static final int FETCH_THREADS = 2;

  @Bean(name = "activityFetchExecutor", destroyMethod = "shutdownNow")
  public ExecutorService activityFetchExecutor() {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("activity-fetch-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };
    return Executors.newFixedThreadPool(FETCH_THREADS, threadFactory);
  }
}
