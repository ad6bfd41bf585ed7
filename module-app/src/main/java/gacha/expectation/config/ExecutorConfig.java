package gacha.expectation.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor Configuration - 시뮬레이션 Thread Pool 설정
 *
 * <h4>분리된 책임</h4>
 *
 * <ul>
 *   <li>{@link RejectionPolicyFactory}: AbortPolicy 생성
 *   <li>{@link ExecutorMetricsConfigurator}: Micrometer 메트릭 등록
 *   <li>{@link TaskDecoratorFactory}: MDC 전파용 TaskDecorator 생성
 * </ul>
 */
@Configuration
public class ExecutorConfig {

  private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

  public static final String SIMULATION_EXECUTOR = "simulationExecutor";

  private final MeterRegistry meterRegistry;

  public ExecutorConfig(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Bean
  public TaskDecorator contextPropagatingDecorator() {
    return new TaskDecoratorFactory().createMdcPropagatingDecorator();
  }

  /**
   * 몬테카를로 청크 실행 전용 Executor
   *
   * <h4>운영 정책</h4>
   *
   * <ul>
   *   <li>core = max = workerThreads (CPU 바운드)
   *   <li>bounded queue + AbortPolicy: 포화 시 503
   *   <li>종료 시 진행 중인 청크 완료 대기
   * </ul>
   */
  @Bean(name = SIMULATION_EXECUTOR)
  public ThreadPoolTaskExecutor simulationExecutor(
      SimulationProperties properties,
      @Qualifier("contextPropagatingDecorator") TaskDecorator contextPropagatingDecorator) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("gacha-sim-");
    executor.setRejectedExecutionHandler(
        new RejectionPolicyFactory(meterRegistry).createSimulationAbortPolicy("gacha.simulation"));
    executor.setTaskDecorator(contextPropagatingDecorator);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();

    new ExecutorMetricsConfigurator(meterRegistry)
        .registerExecutorMetrics(executor, "gacha.simulation");

    log.info(
        "[SimulationExecutor] Initialized. threads={}, queueCapacity={}",
        properties.workerThreads(),
        properties.queueCapacity());
    return executor;
  }
}
