package gacha.expectation.core.validation;

import gacha.expectation.core.domain.model.PoolDefinition;
import gacha.expectation.core.domain.pity.PityModelConfig;
import gacha.expectation.core.domain.pity.PullState;
import gacha.expectation.core.domain.pity.SpecialMechanic;
import gacha.expectation.core.domain.simulation.SimulationLimits;
import gacha.expectation.core.domain.simulation.SimulationRequest;
import gacha.expectation.core.probability.PityModel;
import gacha.expectation.error.exception.ValidationException;
import java.util.OptionalLong;

/**
 * 요청 정의역 검증
 *
 * <p>카드풀 정의와 한도를 기준으로 검사하며 첫 위반 필드로 {@link ValidationException}을 던집니다. 계산은 검증을 통과한 요청에
 * 대해서만 시작됩니다.
 *
 * <p>분포 모드에서는 목표 수 × 픽업당 최악 뽑기 수가 시행당 최대 뽑기 수를 넘지 않아야 합니다.
 */
public class SimulationRequestValidator {

  private final SimulationLimits limits;

  public SimulationRequestValidator(SimulationLimits limits) {
    this.limits = limits;
  }

  /**
   * @param request 요청
   * @param pool 요청 카드풀 정의
   * @param effectiveTrialCount 요청값 또는 카드풀 기본값으로 결정된 시행 횟수
   */
  public void validate(SimulationRequest request, PoolDefinition pool, int effectiveTrialCount) {
    if (request.mode() == null) {
      throw new ValidationException("mode", "must be one of [expectation, distribution]");
    }
    if (request.targetCount() < 1 || request.targetCount() > limits.maxTargetCount()) {
      throw new ValidationException(
          "targetCount", "must be within [1, " + limits.maxTargetCount() + "]");
    }
    validateState(request.initialState(), pool.pityConfig());
    if (request.budget() != null && request.budget() < 1) {
      throw new ValidationException("budget", "must be >= 1");
    }
    if (request.isDistribution()) {
      if (!limits.acceptsTrialCount(effectiveTrialCount)) {
        throw new ValidationException(
            "trialCount",
            "must be within [" + limits.minTrialCount() + ", " + limits.maxTrialCount() + "]");
      }
      validateReachableWithinCeiling(request.targetCount(), pool.pityConfig());
    }
  }

  /** 최악의 경우에도 시행이 최대 뽑기 수 안에 끝나는 목표 수만 시뮬레이션합니다. */
  private void validateReachableWithinCeiling(int targetCount, PityModelConfig config) {
    OptionalLong perItem = new PityModel(config).worstCasePullsPerItem();
    if (perItem.isEmpty()) {
      return;
    }
    long maxTarget = limits.maxPullsPerTrial() / perItem.getAsLong();
    if (targetCount > maxTarget) {
      throw new ValidationException(
          "targetCount",
          "must be <= "
              + maxTarget
              + " for this pool in distribution mode (worst case "
              + perItem.getAsLong()
              + " pulls per item, ceiling "
              + limits.maxPullsPerTrial()
              + ")");
    }
  }

  private void validateState(PullState state, PityModelConfig config) {
    if (state == null) {
      throw new ValidationException("initialState", "must not be null");
    }
    if (state.pity() < 0 || state.pity() >= config.hardPity()) {
      throw new ValidationException(
          "initialState.pity", "must be within [0, " + (config.hardPity() - 1) + "]");
    }
    if (state.guaranteed() && !config.hasFiftyFifty()) {
      throw new ValidationException("initialState.guaranteed", "pool has no 50/50 stage");
    }
    int cap = config.accelerator().counterCap();
    validateCounter(
        "initialState.streakCounter",
        state.streakCounter(),
        config.mechanic() == SpecialMechanic.STREAK_BONUS ? cap : 0);
    validateCounter(
        "initialState.fatePoints",
        state.fatePoints(),
        config.mechanic() == SpecialMechanic.POINTS_GUARANTEE ? cap : 0);
  }

  private void validateCounter(String field, int value, int max) {
    if (value < 0 || value > max) {
      throw new ValidationException(field, "must be within [0, " + max + "] for this pool");
    }
  }
}
