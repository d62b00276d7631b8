package sensor.relay.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for subscriber commands.
 *
 * <p>Commands run concurrently with each other and with the evaluation tick. When the queue is
 * full the command is rejected instead of blocking the poller.
 */
@Slf4j
@Configuration
public class CommandExecutorConfig {

  @Bean(name = "commandTaskExecutor")
  public Executor commandTaskExecutor(
      CommandExecutorProperties properties, MeterRegistry meterRegistry) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.corePoolSize());
    executor.setMaxPoolSize(properties.maxPoolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("command-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();

    new ExecutorServiceMetrics(
            executor.getThreadPoolExecutor(), "command.executor", Collections.emptyList())
        .bindTo(meterRegistry);

    log.info(
        "[CommandExecutor] Initialized core={}, max={}, queue={}",
        properties.corePoolSize(),
        properties.maxPoolSize(),
        properties.queueCapacity());
    return executor;
  }
}
