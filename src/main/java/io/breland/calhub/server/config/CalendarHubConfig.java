package io.breland.calhub.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.breland.calhub.server.calendar.BackendRetry;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.context.annotation.Bean;

@SpringBootConfiguration
@Slf4j
public class CalendarHubConfig {

  @Bean
  public ObjectMapper getObjectMapper() {
    return new ObjectMapper().registerModule(new JavaTimeModule());
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService calendarSourceExecutor() {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "calendar-source-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(8, threadFactory);
  }

  @Bean
  public RetryRegistry backendRetryRegistry(CalendarProperties properties) {
    CalendarProperties.Retry retry = properties.getRetry();
    log.info(
        "Backend retry: {} attempts, initial delay {}, max delay {}",
        retry.getMaxAttempts(),
        retry.getInitialDelay(),
        retry.getMaxDelay());
    return BackendRetry.registryFor(retry);
  }
}
