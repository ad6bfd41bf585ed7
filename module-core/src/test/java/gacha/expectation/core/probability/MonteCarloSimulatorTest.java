package gacha.expectation.core.probability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeout;

import gacha.expectation.core.catalog.PoolCatalog;
import gacha.expectation.core.domain.model.GameTitle;
import gacha.expectation.core.domain.model.PoolDefinition;
import gacha.expectation.core.domain.model.PoolType;
import gacha.expectation.core.domain.pity.PityModelConfig;
import gacha.expectation.core.domain.pity.PullState;
import gacha.expectation.core.domain.simulation.MonteCarloReport;
import gacha.expectation.core.domain.simulation.SimulationLimits;
import gacha.expectation.core.domain.simulation.SimulationMode;
import gacha.expectation.core.domain.simulation.SimulationRequest;
import gacha.expectation.core.domain.simulation.TrialPlan;
import gacha.expectation.core.validation.SimulationRequestValidator;
import gacha.expectation.error.GachaErrorCode;
import gacha.expectation.error.exception.ComputeException;
import gacha.expectation.error.exception.ValidationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MonteCarloSimulator 테스트")
class MonteCarloSimulatorTest {

  private static final SimulationLimits LIMITS = new SimulationLimits(100, 500_000, 10_000, 50);

  private final PoolCatalog catalog = PoolCatalog.standard();
  private final MonteCarloSimulator sequential = MonteCarloSimulator.sequential(LIMITS);
  private final ExecutorService pool = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Nested
  @DisplayName("기준 모델")
  class ReferenceModel {

    @Test
    @DisplayName("동전 던지기 모델: 결과는 1 또는 2, 예산 2면 100%")
    void outcomes_are_one_or_two() {
      MonteCarloReport report =
          sequential.simulate(PityConfigFixtures.coinFlip(), null, plan(1, 20_000, 2, 7L));

      assertThat(report.pulls().p25()).isBetween(1L, 2L);
      assertThat(report.pulls().p50()).isIn(1L, 2L);
      assertThat(report.pulls().p95()).isEqualTo(2L);
      assertThat(report.pulls().mean()).isCloseTo(1.5, within(0.02));
      assertThat(report.successRate()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("동전 던지기 모델: 20만 회 평균은 정확 해와 1% 이내")
    void coin_flip_matches_exact_solution() {
      PityModelConfig coinFlip = PityConfigFixtures.coinFlip();
      double exact = new ExactExpectationSolver().expectedPulls(coinFlip, PullState.initial());

      MonteCarloReport report =
          new MonteCarloSimulator(pool, 4, LIMITS)
              .simulate(coinFlip, null, plan(1, 200_000, null, 3L));

      assertThat(exact).isCloseTo(1.5, within(1e-12));
      assertThat(report.pulls().mean()).isCloseTo(exact, within(exact * 0.01));
    }

    @Test
    @DisplayName("동전 던지기 모델: 예산 1이면 약 50%")
    void half_succeed_with_single_pull() {
      MonteCarloReport report =
          sequential.simulate(PityConfigFixtures.coinFlip(), null, plan(1, 20_000, 1, 11L));

      assertThat(report.successRate()).isCloseTo(50.0, within(2.0));
    }

    @Test
    @DisplayName("예산이 없으면 성공률을 계산하지 않는다")
    void no_budget_no_success_rate() {
      MonteCarloReport report =
          sequential.simulate(PityConfigFixtures.coinFlip(), null, plan(1, 1_000, null, 1L));

      assertThat(report.successRate()).isNull();
      assertThat(report.currency()).isNull();
    }
  }

  @Nested
  @DisplayName("결정성")
  class Determinism {

    @Test
    @DisplayName("같은 시드는 같은 결과")
    void same_seed_same_report() {
      PoolDefinition genshin = catalog.get(GameTitle.GENSHIN, PoolType.CHARACTER);
      TrialPlan plan = plan(2, 5_000, 150, 42L);

      PityModelConfig config = genshin.pityConfig();

      MonteCarloReport first = sequential.simulate(config, genshin.byproduct(), plan);
      MonteCarloReport second = sequential.simulate(config, genshin.byproduct(), plan);

      assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("병렬 청크 분할과 무관하게 같은 결과")
    void independent_of_chunking() {
      PoolDefinition hsr = catalog.get(GameTitle.HSR, PoolType.CHARACTER);
      TrialPlan plan = plan(1, 9_999, 90, 2024L);
      MonteCarloSimulator parallel = new MonteCarloSimulator(pool, 7, LIMITS);

      MonteCarloReport expected = sequential.simulate(hsr.pityConfig(), hsr.byproduct(), plan);
      MonteCarloReport actual = parallel.simulate(hsr.pityConfig(), hsr.byproduct(), plan);

      assertThat(actual).isEqualTo(expected);
    }
  }

  @Nested
  @DisplayName("정확 해와의 일치")
  class Agreement {

    @Test
    @DisplayName("시뮬레이션 평균은 정확 해와 1% 이내")
    void mean_matches_exact_solution() {
      PoolDefinition zzz = catalog.get(GameTitle.ZZZ, PoolType.CHARACTER);
      PullState start = PullState.of(20, false);
      double exact = new ExactExpectationSolver().expectedPulls(zzz.pityConfig(), start, 2);

      MonteCarloReport report =
          new MonteCarloSimulator(pool, 4, LIMITS)
              .simulate(zzz.pityConfig(), null, new TrialPlan(start, 2, 100_000, null, 99L, false));

      assertThat(report.pulls().mean()).isCloseTo(exact, within(exact * 0.01));
    }

    @Test
    @DisplayName("백분위는 오름차순")
    void percentiles_are_ordered() {
      PoolDefinition genshin = catalog.get(GameTitle.GENSHIN, PoolType.WEAPON);

      MonteCarloReport report =
          sequential.simulate(genshin.pityConfig(), null, plan(1, 10_000, null, 5L));

      assertThat(report.pulls().p25()).isLessThanOrEqualTo(report.pulls().p50());
      assertThat(report.pulls().p50()).isLessThanOrEqualTo(report.pulls().p75());
      assertThat(report.pulls().p75()).isLessThanOrEqualTo(report.pulls().p90());
      assertThat(report.pulls().p90()).isLessThanOrEqualTo(report.pulls().p95());
      assertThat(report.pulls().p95()).isLessThanOrEqualTo(160L);
    }
  }

  @Nested
  @DisplayName("부산물 재화")
  class Byproduct {

    @Test
    @DisplayName("캐릭터 카드풀은 재화 통계를 함께 낸다")
    void reports_currency_for_character_pools() {
      PoolDefinition genshin = catalog.get(GameTitle.GENSHIN, PoolType.CHARACTER);

      MonteCarloReport report =
          sequential.simulate(genshin.pityConfig(), genshin.byproduct(), plan(1, 5_000, null, 3L));

      assertThat(report.currency()).isNotNull();
      assertThat(report.currency().currencyName()).isEqualTo("Starglitter");
      assertThat(report.currency().summary().mean()).isPositive();
    }

    @Test
    @DisplayName("픽업 4성 최대 돌파면 재화가 늘어난다")
    void maxed_featured_four_star_yields_more() {
      PoolDefinition hsr = catalog.get(GameTitle.HSR, PoolType.CHARACTER);
      TrialPlan fresh = new TrialPlan(PullState.initial(), 1, 20_000, null, 8L, false);
      TrialPlan maxed = new TrialPlan(PullState.initial(), 1, 20_000, null, 8L, true);

      double freshMean =
          sequential.simulate(hsr.pityConfig(), hsr.byproduct(), fresh).currency().summary().mean();
      double maxedMean =
          sequential.simulate(hsr.pityConfig(), hsr.byproduct(), maxed).currency().summary().mean();

      assertThat(maxedMean).isGreaterThan(freshMean);
    }
  }

  @Nested
  @DisplayName("한도")
  class Limits {

    @Test
    @DisplayName("시행당 최대 뽑기 수를 넘기면 ComputeException")
    void pull_ceiling() {
      TrialPlan plan = plan(1, 100, null, 1L);

      assertThatThrownBy(() -> sequential.simulate(PityConfigFixtures.unreachable(), null, plan))
          .isInstanceOf(ComputeException.class)
          .extracting("errorCode")
          .isEqualTo(GachaErrorCode.TRIAL_PULL_CEILING_EXCEEDED);
    }

    @Test
    @DisplayName("병렬 실행 중 실패도 원래 예외로 전달")
    void pull_ceiling_in_parallel() {
      MonteCarloSimulator parallel = new MonteCarloSimulator(pool, 4, LIMITS);

      assertThatThrownBy(
              () -> parallel.simulate(PityConfigFixtures.unreachable(), null, plan(1, 100, null, 1L)))
          .isInstanceOf(ComputeException.class);
    }

    @Test
    @DisplayName("시행 횟수 하한 미만은 ValidationException")
    void trial_count_floor() {
      assertThatThrownBy(
              () -> sequential.simulate(PityConfigFixtures.coinFlip(), null, plan(1, 99, null, 1L)))
          .isInstanceOf(ValidationException.class)
          .extracting("field")
          .isEqualTo("trialCount");
    }
  }

  @Nested
  @DisplayName("청크 제출 거부")
  class Rejection {

    @Test
    @DisplayName("제출이 거부되면 이미 제출된 청크는 시행을 돌리지 않는다")
    void rejected_submission_cancels_submitted_chunks() {
      List<Runnable> accepted = new ArrayList<>();
      Executor singleSlot =
          task -> {
            if (!accepted.isEmpty()) {
              throw new RejectedExecutionException("queue full");
            }
            accepted.add(task);
          };
      PoolDefinition genshin = catalog.get(GameTitle.GENSHIN, PoolType.CHARACTER);
      MonteCarloSimulator simulator = new MonteCarloSimulator(singleSlot, 2, LIMITS);
      TrialPlan heavy = plan(10, 500_000, null, 1L);

      assertThatThrownBy(() -> simulator.simulate(genshin.pityConfig(), null, heavy))
          .isInstanceOf(RejectedExecutionException.class);
      assertThat(accepted).hasSize(1);
      // 취소된 청크: 25만 회 x 픽업 10개를 돌리지 않고 바로 끝난다
      assertTimeout(Duration.ofMillis(200), () -> accepted.get(0).run());
    }
  }

  @Nested
  @DisplayName("운영 한도의 최대 목표 수")
  class LargestTarget {

    private final SimulationLimits shipped = new SimulationLimits(1_000, 1_000_000, 20_000, 100);

    @Test
    @DisplayName("검증을 통과한 최대 목표 수는 최대 뽑기 수에 걸리지 않고 끝난다")
    void largest_allowed_target_completes() {
      PoolDefinition genshin = catalog.get(GameTitle.GENSHIN, PoolType.CHARACTER);
      SimulationRequest request =
          new SimulationRequest(
              GameTitle.GENSHIN,
              PoolType.CHARACTER,
              SimulationMode.DISTRIBUTION,
              shipped.maxTargetCount(),
              PullState.initial(),
              null,
              false,
              1L,
              1_000);
      SimulationRequestValidator validator = new SimulationRequestValidator(shipped);
      assertThatCode(() -> validator.validate(request, genshin, 1_000)).doesNotThrowAnyException();

      TrialPlan largest =
          new TrialPlan(PullState.initial(), shipped.maxTargetCount(), 1_000, null, 1L, false);
      MonteCarloReport report =
          new MonteCarloSimulator(pool, 4, shipped).simulate(genshin.pityConfig(), null, largest);
      double exact =
          new ExactExpectationSolver()
              .expectedPulls(genshin.pityConfig(), PullState.initial(), shipped.maxTargetCount());

      assertThat(report.pulls().p95()).isLessThanOrEqualTo(18_000L);
      assertThat(report.pulls().mean()).isCloseTo(exact, within(exact * 0.01));
    }
  }

  @Test
  @DisplayName("시행 시드는 인덱스마다 다르다")
  void trial_seeds_differ() {
    long seed = MonteCarloSimulator.trialSeed(1L, 0);

    assertThat(seed).isNotEqualTo(MonteCarloSimulator.trialSeed(1L, 1));
    assertThat(seed).isNotEqualTo(MonteCarloSimulator.trialSeed(2L, 0));
  }

  private static TrialPlan plan(int targetCount, int trials, Integer budget, long seed) {
    return new TrialPlan(PullState.initial(), targetCount, trials, budget, seed, false);
  }
}
