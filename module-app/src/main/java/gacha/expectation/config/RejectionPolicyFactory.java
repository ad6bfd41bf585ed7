package gacha.expectation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejection Policy Factory - 시뮬레이션 Thread Pool 거부 정책 생성
 *
 * <h4>AbortPolicy</h4>
 *
 * <ul>
 *   <li>큐 포화 시 즉시 거부: 톰캣 스레드에서 시뮬레이션 청크를 대신 실행하지 않음
 *   <li>GlobalExceptionHandler에서 503 + Retry-After 로 응답
 *   <li>{@code executor.rejected} Counter 로 모니터링
 * </ul>
 */
public class RejectionPolicyFactory {

  private static final Logger log = LoggerFactory.getLogger(RejectionPolicyFactory.class);

  /** 로그 샘플링 간격: 1초에 1회만 WARN 로그 */
  private static final long REJECT_LOG_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

  private final AtomicLong lastRejectLogNanos = new AtomicLong(0);
  private final AtomicLong rejectedSinceLastLog = new AtomicLong(0);

  private final MeterRegistry meterRegistry;

  public RejectionPolicyFactory(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * 시뮬레이션 전용 AbortPolicy
   *
   * <p>RejectedExecutionException을 throw하여 CompletableFuture.runAsync 제출이 즉시 실패하도록 합니다.
   *
   * @param name Executor 이름 (메트릭 태그용)
   * @return RejectedExecutionHandler 인스턴스
   */
  public RejectedExecutionHandler createSimulationAbortPolicy(String name) {
    Counter rejectedCounter =
        Counter.builder("executor.rejected")
            .tag("name", name)
            .description("Number of tasks rejected due to queue full")
            .register(meterRegistry);

    return (r, executor) -> {
      rejectedCounter.increment();

      if (executor.isShutdown() || executor.isTerminating()) {
        throw new RejectedExecutionException("SimulationExecutor rejected (shutdown in progress)");
      }

      rejectedSinceLastLog.incrementAndGet();
      long now = System.nanoTime();
      long prev = lastRejectLogNanos.get();

      if (now - prev >= REJECT_LOG_INTERVAL_NANOS && lastRejectLogNanos.compareAndSet(prev, now)) {
        long count = rejectedSinceLastLog.getAndSet(0);
        log.warn(
            "[SimulationExecutor] Task rejected (queue full). "
                + "droppedInLastWindow={}, poolSize={}, activeCount={}, queueSize={}",
            count,
            executor.getPoolSize(),
            executor.getActiveCount(),
            executor.getQueue().size());
      }

      throw new RejectedExecutionException("SimulationExecutor queue full (capacity exceeded)");
    };
  }
}
