package gacha.expectation.core.probability;

import gacha.expectation.core.domain.byproduct.ByproductRule;
import gacha.expectation.core.domain.pity.PityModelConfig;
import gacha.expectation.core.domain.pity.PullOutcome;
import gacha.expectation.core.domain.pity.PullState;
import gacha.expectation.core.domain.simulation.CurrencyStatistics;
import gacha.expectation.core.domain.simulation.DistributionSummary;
import gacha.expectation.core.domain.simulation.MonteCarloReport;
import gacha.expectation.core.domain.simulation.SimulationLimits;
import gacha.expectation.core.domain.simulation.TrialPlan;
import gacha.expectation.error.exception.ComputeException;
import gacha.expectation.error.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 몬테카를로 뽑기 시뮬레이터
 *
 * <h3>결정성</h3>
 *
 * <p>시행 i 는 {@code mix(seed, i)} 로 시드된 자체 {@link SplittableRandom}을 사용합니다. 시행을 어떤 청크로 나눠 어떤
 * 스레드에서 돌려도 같은 시드면 같은 결과가 나옵니다.
 *
 * <h3>병렬화</h3>
 *
 * <p>시행 구간을 {@code parallelism} 개의 연속 청크로 나눠 주입된 {@link Executor}에 제출하고, 각 청크는 결과 배열의 서로
 * 겹치지 않는 구간에만 씁니다.
 */
public class MonteCarloSimulator {

  private static final Logger log = LoggerFactory.getLogger(MonteCarloSimulator.class);

  private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

  private final Executor executor;
  private final int parallelism;
  private final SimulationLimits limits;

  public MonteCarloSimulator(Executor executor, int parallelism, SimulationLimits limits) {
    if (executor == null || limits == null) {
      throw new IllegalArgumentException("executor and limits cannot be null");
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
    }
    this.executor = executor;
    this.parallelism = parallelism;
    this.limits = limits;
  }

  /** 호출 스레드에서 순차 실행 */
  public static MonteCarloSimulator sequential(SimulationLimits limits) {
    return new MonteCarloSimulator(Runnable::run, 1, limits);
  }

  /**
   * 시뮬레이션 실행
   *
   * @param config 천장 설정
   * @param byproduct 부산물 규칙 (nullable)
   * @param plan 실행 계획
   * @return 분포 요약
   * @throws ValidationException 시행 횟수가 한도 밖
   * @throws ComputeException 시행이 최대 뽑기 수 안에 끝나지 않음
   */
  public MonteCarloReport simulate(PityModelConfig config, ByproductRule byproduct, TrialPlan plan) {
    if (!limits.acceptsTrialCount(plan.trialCount())) {
      throw new ValidationException(
          "trialCount",
          "must be within [" + limits.minTrialCount() + ", " + limits.maxTrialCount() + "]");
    }
    PityModel model = new PityModel(config);
    PullState start = model.normalize(plan.initialState());
    int trialCount = plan.trialCount();
    int[] pulls = new int[trialCount];
    long[] currency = byproduct != null ? new long[trialCount] : null;

    int chunks = Math.min(parallelism, trialCount);
    AtomicBoolean aborted = new AtomicBoolean();
    List<CompletableFuture<Void>> futures = new ArrayList<>(chunks);
    try {
      for (int c = 0; c < chunks; c++) {
        int from = (int) ((long) trialCount * c / chunks);
        int to = (int) ((long) trialCount * (c + 1) / chunks);
        CompletableFuture<Void> chunk =
            CompletableFuture.runAsync(
                () -> runTrials(model, byproduct, plan, start, from, to, pulls, currency, aborted),
                executor);
        // 한 청크가 실패하면 나머지 청크도 즉시 멈춘다
        chunk.whenComplete(
            (ignored, failure) -> {
              if (failure != null) {
                aborted.set(true);
              }
            });
        futures.add(chunk);
      }
    } catch (RejectedExecutionException e) {
      abort(aborted, futures);
      log.warn(
          "[MonteCarlo] Chunk submission rejected. Aborting submitted chunks. submitted={}/{}",
          futures.size(),
          chunks);
      throw e;
    }
    awaitAll(futures);

    log.debug(
        "[MonteCarlo] Completed. trials={}, chunks={}, seed={}", trialCount, chunks, plan.seed());
    return report(plan, byproduct, pulls, currency);
  }

  private void runTrials(
      PityModel model,
      ByproductRule byproduct,
      TrialPlan plan,
      PullState start,
      int from,
      int to,
      int[] pulls,
      long[] currency,
      AtomicBoolean aborted) {
    for (int trial = from; trial < to; trial++) {
      if (aborted.get()) {
        return;
      }
      SplittableRandom random = new SplittableRandom(trialSeed(plan.seed(), trial));
      ByproductLedger ledger =
          byproduct != null ? new ByproductLedger(byproduct, plan.featuredFourStarMaxed()) : null;
      pulls[trial] = runTrial(model, start, plan.targetCount(), trial, random, ledger);
      if (ledger != null) {
        currency[trial] = ledger.total();
      }
    }
  }

  private int runTrial(
      PityModel model,
      PullState start,
      int targetCount,
      int trialIndex,
      SplittableRandom random,
      ByproductLedger ledger) {
    PullState state = start;
    int pullCount = 0;
    int obtained = 0;
    while (obtained < targetCount) {
      if (pullCount >= limits.maxPullsPerTrial()) {
        throw ComputeException.pullCeilingExceeded(trialIndex, limits.maxPullsPerTrial());
      }
      pullCount++;
      double hit = model.hitProbability(state);
      if (random.nextDouble() < hit) {
        boolean featured = random.nextDouble() < model.upProbability(state);
        if (ledger != null) {
          ledger.onTopRarity(featured, random);
        }
        state = model.advance(state, featured ? PullOutcome.UP_HIT : PullOutcome.OFF_BANNER_HIT);
        if (featured) {
          obtained++;
        }
      } else {
        if (ledger != null) {
          ledger.onMiss(hit, random);
        }
        state = model.advance(state, PullOutcome.MISS);
      }
    }
    return pullCount;
  }

  private MonteCarloReport report(
      TrialPlan plan, ByproductRule byproduct, int[] pulls, long[] currency) {
    DistributionSummary pullSummary = PercentileCalculator.summarize(pulls);
    Double successRate = plan.hasBudget() ? successRate(pulls, plan.budget()) : null;
    CurrencyStatistics currencyStatistics =
        currency != null
            ? new CurrencyStatistics(
                byproduct.currencyName(), PercentileCalculator.summarize(currency))
            : null;
    return new MonteCarloReport(
        pullSummary, successRate, currencyStatistics, plan.trialCount(), plan.seed());
  }

  static double successRate(int[] pulls, int budget) {
    long within = 0;
    for (int value : pulls) {
      if (value <= budget) {
        within++;
      }
    }
    return 100.0 * within / pulls.length;
  }

  /** SplitMix64 finalizer */
  static long trialSeed(long seed, int trialIndex) {
    long z = seed + (trialIndex + 1L) * GOLDEN_GAMMA;
    z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
    z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
    return z ^ (z >>> 31);
  }

  /** 남은 청크가 더 이상 시행을 돌리지 않도록 중단 플래그를 세우고, 아직 시작 전인 청크는 취소합니다. */
  private static void abort(AtomicBoolean aborted, List<CompletableFuture<Void>> futures) {
    aborted.set(true);
    for (CompletableFuture<Void> future : futures) {
      future.cancel(false);
    }
  }

  private static void awaitAll(List<CompletableFuture<Void>> futures) {
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }
}
