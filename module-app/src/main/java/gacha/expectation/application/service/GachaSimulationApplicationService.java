package gacha.expectation.application.service;

import gacha.expectation.config.SimulationProperties;
import gacha.expectation.core.catalog.PoolCatalog;
import gacha.expectation.core.domain.model.PoolDefinition;
import gacha.expectation.core.domain.simulation.MonteCarloReport;
import gacha.expectation.core.domain.simulation.SimulationRequest;
import gacha.expectation.core.domain.simulation.SimulationResult;
import gacha.expectation.core.domain.simulation.TrialPlan;
import gacha.expectation.core.probability.ExactExpectationSolver;
import gacha.expectation.core.probability.MonteCarloSimulator;
import gacha.expectation.core.result.ResultAggregator;
import gacha.expectation.core.validation.SimulationRequestValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Collection;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 가챠 기대값 계산 Application Service
 *
 * <p>카드풀 조회 → 요청 검증 → 정확 해 / 몬테카를로 → 결과 조립 유스케이스를 수행합니다.
 *
 * <pre>
 * App Layer (이 클래스)    : 유스케이스 조립, 시드/시행 횟수 결정, 메트릭
 *    ↓ 사용
 * Core Layer (module-core) : PityModel, ExactExpectationSolver, MonteCarloSimulator
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GachaSimulationApplicationService {

  private static final String TIMER_NAME = "gacha.simulation.duration";

  private final PoolCatalog poolCatalog;
  private final SimulationRequestValidator validator;
  private final ExactExpectationSolver solver;
  private final MonteCarloSimulator simulator;
  private final ResultAggregator aggregator;
  private final SimulationProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * 기대값/분포 계산
   *
   * @param request 계산 요청
   * @return 모드별 결과
   * @throws gacha.expectation.error.exception.ConfigurationException 지원하지 않는 카드풀
   * @throws gacha.expectation.error.exception.ValidationException 정의역 밖 요청 필드
   * @throws gacha.expectation.error.exception.ComputeException 수렴 실패 / 최대 뽑기 수 초과
   */
  public SimulationResult simulate(SimulationRequest request) {
    PoolDefinition pool = poolCatalog.get(request.game(), request.pool());
    int trialCount =
        request.trialCount() != null
            ? request.trialCount()
            : properties.trialCountFor(request.pool());
    validator.validate(request, pool, trialCount);

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      SimulationResult result =
          request.isDistribution()
              ? distribution(request, pool, trialCount)
              : expectation(request, pool);
      log.info(
          "[GachaSimulation] Completed. pool={}, mode={}, target={}, mean={}",
          pool.key(),
          request.mode().getId(),
          request.targetCount(),
          result.pulls().mean());
      return result;
    } finally {
      sample.stop(timer(request));
    }
  }

  /** 지원 카드풀 목록 */
  public Collection<PoolDefinition> listPools() {
    return poolCatalog.definitions();
  }

  /** 카드풀 기본 시행 횟수 */
  public int defaultTrialCount(PoolDefinition pool) {
    return properties.trialCountFor(pool.key().pool());
  }

  private SimulationResult expectation(SimulationRequest request, PoolDefinition pool) {
    double mean =
        solver.expectedPulls(pool.pityConfig(), request.initialState(), request.targetCount());
    return aggregator.aggregate(request, mean, null);
  }

  private SimulationResult distribution(
      SimulationRequest request, PoolDefinition pool, int trialCount) {
    long seed = request.seed() != null ? request.seed() : ThreadLocalRandom.current().nextLong();
    TrialPlan plan =
        new TrialPlan(
            request.initialState(),
            request.targetCount(),
            trialCount,
            request.budget(),
            seed,
            request.featuredFourStarMaxed());
    MonteCarloReport report = simulator.simulate(pool.pityConfig(), pool.byproduct(), plan);

    Double exactMean = null;
    if (properties.crossCheckExactMean()) {
      exactMean =
          solver.expectedPulls(pool.pityConfig(), request.initialState(), request.targetCount());
      warnOnDivergence(pool, report, exactMean);
    }
    return aggregator.aggregate(request, exactMean, report);
  }

  private void warnOnDivergence(PoolDefinition pool, MonteCarloReport report, double exactMean) {
    double deviationPercent = Math.abs(report.pulls().mean() - exactMean) / exactMean * 100.0;
    if (deviationPercent > properties.crossCheckTolerancePercent()) {
      log.warn(
          "[GachaSimulation] Simulated mean diverges from exact solution. "
              + "pool={}, simulated={}, exact={}, deviation={}%, trials={}, seed={}",
          pool.key(),
          report.pulls().mean(),
          exactMean,
          String.format("%.3f", deviationPercent),
          report.trialCount(),
          report.seed());
    }
  }

  private Timer timer(SimulationRequest request) {
    return Timer.builder(TIMER_NAME)
        .tag("mode", request.mode().getId())
        .tag("game", request.game().getId())
        .tag("pool", request.pool().getId())
        .description("Gacha simulation latency")
        .register(meterRegistry);
  }
}
