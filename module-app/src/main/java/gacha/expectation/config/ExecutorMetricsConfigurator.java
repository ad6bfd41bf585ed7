package gacha.expectation.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 시뮬레이션 Executor Micrometer 메트릭 등록
 *
 * <ul>
 *   <li>{@code executor.completed}, {@code executor.active}, {@code executor.queued}, {@code
 *       executor.pool.size}: ExecutorServiceMetrics 기본 제공
 *   <li>{@code executor.queue.remaining}: 큐 잔여 용량. 0 에 가까우면 곧 503 이 나갑니다
 * </ul>
 */
public class ExecutorMetricsConfigurator {

  private static final Logger log = LoggerFactory.getLogger(ExecutorMetricsConfigurator.class);

  private final MeterRegistry meterRegistry;

  public ExecutorMetricsConfigurator(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * @param executor 초기화된 ThreadPoolTaskExecutor
   * @param name Executor 이름 (메트릭 태그용)
   */
  public void registerExecutorMetrics(ThreadPoolTaskExecutor executor, String name) {
    ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
    Tags tags = Tags.of("name", name);

    new ExecutorServiceMetrics(pool, name, Tags.empty()).bindTo(meterRegistry);
    Gauge.builder("executor.queue.remaining", pool, p -> p.getQueue().remainingCapacity())
        .tags(tags)
        .description("Remaining capacity of the simulation task queue")
        .register(meterRegistry);

    log.info("[ExecutorMetrics] Registered. name={}", name);
  }
}
