package sensor.relay.infrastructure.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler thread pool for the evaluation loop and the Telegram update poller.
 *
 * <p>Spring's default scheduler has a single thread, which would let a long Telegram long-poll
 * delay an evaluation tick. Both jobs use {@code fixedDelay}, so neither overlaps with itself.
 *
 * <p>On shutdown the pool waits for a running tick to finish, bounded by {@code
 * await-termination-seconds}.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

  private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

  @Bean
  @ConditionalOnMissingBean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(
      SchedulerProperties properties, MeterRegistry meterRegistry) {

    Counter rejectedCounter =
        Counter.builder("scheduler.rejected")
            .description("Number of scheduled tasks rejected")
            .register(meterRegistry);

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("scheduler-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(properties.awaitTerminationSeconds());
    scheduler.setRejectedExecutionHandler(
        (r, executor) -> {
          rejectedCounter.increment();
          if (executor.isShutdown()) {
            throw new RejectedExecutionException("Scheduler rejected (shutdown in progress)");
          }
          log.warn(
              "[TaskScheduler] Task rejected. poolSize={}, activeCount={}",
              executor.getPoolSize(),
              executor.getActiveCount());
          throw new RejectedExecutionException("TaskScheduler rejected task");
        });

    scheduler.initialize();

    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "task.scheduler", Collections.emptyList())
        .bindTo(meterRegistry);

    log.info("[TaskScheduler] Initialized with poolSize={}", properties.poolSize());

    return scheduler;
  }
}
