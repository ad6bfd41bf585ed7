package gacha.expectation.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import gacha.expectation.config.SimulationProperties;
import gacha.expectation.config.SimulationPropertiesFixture;
import gacha.expectation.core.catalog.PoolCatalog;
import gacha.expectation.core.domain.model.GameTitle;
import gacha.expectation.core.domain.model.PoolType;
import gacha.expectation.core.domain.pity.PullState;
import gacha.expectation.core.domain.simulation.SimulationMode;
import gacha.expectation.core.domain.simulation.SimulationRequest;
import gacha.expectation.core.domain.simulation.SimulationResult;
import gacha.expectation.core.probability.ExactExpectationSolver;
import gacha.expectation.core.probability.MonteCarloSimulator;
import gacha.expectation.core.result.ResultAggregator;
import gacha.expectation.core.validation.SimulationRequestValidator;
import gacha.expectation.error.exception.ValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * GachaSimulationApplicationService 테스트
 *
 * <p>코어 컴포넌트는 실제 구현을 사용하고, 시뮬레이터만 순차 실행으로 구성합니다.
 */
@DisplayName("GachaSimulationApplicationService 테스트")
class GachaSimulationApplicationServiceTest {

  private SimpleMeterRegistry meterRegistry;
  private GachaSimulationApplicationService service;

  @BeforeEach
  void setUp() {
    SimulationProperties properties = SimulationPropertiesFixture.fast();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new GachaSimulationApplicationService(
            PoolCatalog.standard(),
            new SimulationRequestValidator(properties.toLimits()),
            new ExactExpectationSolver(),
            MonteCarloSimulator.sequential(properties.toLimits()),
            new ResultAggregator(),
            properties,
            meterRegistry);
  }

  private static SimulationRequest request(
      SimulationMode mode, PullState state, Integer budget, Long seed, Integer trialCount) {
    return new SimulationRequest(
        GameTitle.GENSHIN, PoolType.CHARACTER, mode, 1, state, budget, false, seed, trialCount);
  }

  @Nested
  @DisplayName("기대값 모드")
  class ExpectationMode {

    @Test
    @DisplayName("확정 상태에서는 평균만 반환하고 60~65회 사이")
    void guaranteed_state() {
      SimulationResult result =
          service.simulate(
              request(SimulationMode.EXPECTATION, PullState.of(0, true), null, null, null));

      assertThat(result.pulls().mean()).isBetween(60.0, 65.0);
      assertThat(result.pulls().p50()).isNull();
      assertThat(result.successRate()).isNull();
      assertThat(result.currency()).isNull();
      assertThat(result.seed()).isNull();
      assertThat(result.trialCount()).isNull();
    }

    @Test
    @DisplayName("모드/게임/카드풀 태그로 지연 시간 타이머 기록")
    void records_timer() {
      service.simulate(request(SimulationMode.EXPECTATION, PullState.initial(), null, null, null));

      assertThat(
              meterRegistry
                  .get("gacha.simulation.duration")
                  .tags("mode", "expectation", "game", "genshin", "pool", "character")
                  .timer()
                  .count())
          .isEqualTo(1L);
    }
  }

  @Nested
  @DisplayName("분포 모드")
  class DistributionMode {

    @Test
    @DisplayName("같은 시드는 같은 결과를 재현하고 시드를 그대로 돌려준다")
    void seed_is_echoed_and_reproducible() {
      SimulationResult first =
          service.simulate(
              request(SimulationMode.DISTRIBUTION, PullState.initial(), 120, 42L, 500));
      SimulationResult second =
          service.simulate(
              request(SimulationMode.DISTRIBUTION, PullState.initial(), 120, 42L, 500));

      assertThat(first.seed()).isEqualTo(42L);
      assertThat(first).isEqualTo(second);
      assertThat(first.trialCount()).isEqualTo(500);
      assertThat(first.successRate()).isBetween(0.0, 100.0);
      assertThat(first.pulls().p25()).isLessThanOrEqualTo(first.pulls().p95());
    }

    @Test
    @DisplayName("시드가 없으면 생성한 시드를 응답에 싣는다")
    void generates_seed() {
      SimulationResult result =
          service.simulate(
              request(SimulationMode.DISTRIBUTION, PullState.initial(), null, null, 200));

      assertThat(result.seed()).isNotNull();
      assertThat(result.successRate()).isNull();
    }

    @Test
    @DisplayName("시행 횟수가 없으면 카드풀 기본값 사용, 캐릭터 카드풀은 재화 통계 포함")
    void default_trial_count() {
      SimulationResult result =
          service.simulate(
              request(SimulationMode.DISTRIBUTION, PullState.initial(), null, 7L, null));

      assertThat(result.trialCount()).isEqualTo(2_000);
      assertThat(result.currency()).isNotNull();
      assertThat(result.currency().currencyName()).isEqualTo("Starglitter");
    }

    @Test
    @DisplayName("교차 검증용 정확 해 평균이 시뮬레이션 평균과 가깝다")
    void exact_mean_cross_check() {
      SimulationResult result =
          service.simulate(
              request(SimulationMode.DISTRIBUTION, PullState.initial(), null, 11L, 20_000));

      assertThat(result.exactMean()).isNotNull();
      assertThat(result.pulls().mean()).isCloseTo(result.exactMean(), within(3.0));
    }
  }

  @Test
  @DisplayName("천장 이상의 pity는 ValidationException, 타이머는 기록하지 않는다")
  void rejects_invalid_pity() {
    SimulationRequest invalid =
        request(SimulationMode.EXPECTATION, PullState.of(90, false), null, null, null);

    assertThatThrownBy(() -> service.simulate(invalid))
        .isInstanceOf(ValidationException.class)
        .extracting("field")
        .isEqualTo("initialState.pity");
    assertThat(meterRegistry.find("gacha.simulation.duration").timer()).isNull();
  }

  @Test
  @DisplayName("기본 시행 횟수는 카드풀 종류로 결정")
  void default_trial_count_by_pool() {
    PoolCatalog catalog = PoolCatalog.standard();

    assertThat(service.defaultTrialCount(catalog.get(GameTitle.HSR, PoolType.CHARACTER)))
        .isEqualTo(2_000);
    assertThat(service.defaultTrialCount(catalog.get(GameTitle.HSR, PoolType.LIGHTCONE)))
        .isEqualTo(1_000);
    assertThat(service.listPools()).hasSize(6);
  }
}
