package sensor.relay.infrastructure.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import sensor.relay.infrastructure.executor.DefaultLogicExecutor;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.policy.ExecutionPipeline;
import sensor.relay.infrastructure.executor.policy.LoggingPolicy;
import sensor.relay.infrastructure.executor.policy.MetricsPolicy;
import sensor.relay.infrastructure.executor.strategy.ExceptionTranslator;

@Configuration
@EnableConfigurationProperties(ExecutorLoggingProperties.class)
public class ExecutorConfig {

  @Bean
  public ExceptionTranslator exceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }

  @Bean
  @ConditionalOnMissingBean(ExecutionPipeline.class)
  public ExecutionPipeline executionPipeline(
      ExecutorLoggingProperties props, MeterRegistry meterRegistry) {
    // logging first so a failing timer registration is still visible in the log
    return new ExecutionPipeline(
        List.of(new LoggingPolicy(props.slowMs()), new MetricsPolicy(meterRegistry)));
  }

  @Bean
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor(ExecutionPipeline pipeline, ExceptionTranslator translator) {
    return new DefaultLogicExecutor(pipeline, translator);
  }
}
