package gacha.expectation.core.probability;

import gacha.expectation.core.domain.pity.GuaranteeAccelerator;
import gacha.expectation.core.domain.pity.PityModelConfig;
import gacha.expectation.core.domain.pity.PullOutcome;
import gacha.expectation.core.domain.pity.PullState;
import java.util.OptionalLong;

/**
 * 천장 모델: 상태별 확률과 상태 전이
 *
 * <p>정확 해 솔버와 몬테카를로 시뮬레이터가 같은 인스턴스 규칙을 공유하므로 두 결과는 같은 확률 모델을 따릅니다.
 *
 * <h3>전이 규칙</h3>
 *
 * <ul>
 *   <li>MISS: pity + 1
 *   <li>UP_HIT: pity 0, 확정 해제, 메커니즘 카운터는 {@link GuaranteeAccelerator#counterAfterWin}
 *   <li>OFF_BANNER_HIT: pity 0, 확정은 guaranteeOnLoss 또는 카운터 임계치 도달
 * </ul>
 */
public class PityModel {

  private final PityModelConfig config;
  private final GuaranteeAccelerator accelerator;

  public PityModel(PityModelConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config cannot be null");
    }
    this.config = config;
    this.accelerator = config.accelerator();
  }

  public PityModelConfig config() {
    return config;
  }

  /**
   * 현재 상태에서 다음 뽑기가 최고 등급일 확률
   *
   * @param state 현재 상태 (pity 는 0..hardPity-1)
   * @return [0, 1]
   */
  public double hitProbability(PullState state) {
    int pity = state.pity();
    if (pity >= config.hardPity() - 1) {
      return 1.0;
    }
    if (pity < config.softPityStart()) {
      return config.baseRate();
    }
    return Math.min(1.0, config.baseRate() + config.rampRate() * (pity - config.softPityStart() + 1));
  }

  /** 최고 등급이 나왔을 때 픽업일 확률 */
  public double upProbability(PullState state) {
    if (!config.hasFiftyFifty() || state.guaranteed()) {
      return 1.0;
    }
    int counter = accelerator.counterOf(state);
    if (accelerator.forcesGuarantee(counter) || accelerator.forcesWin(counter)) {
      return 1.0;
    }
    return Math.min(1.0, accelerator.adjustUpProbability(config.upProbability(), counter));
  }

  /**
   * 결과를 반영한 다음 상태
   *
   * @throws IllegalArgumentException 현재 상태에서 불가능한 결과
   */
  public PullState advance(PullState state, PullOutcome outcome) {
    switch (outcome) {
      case MISS:
        if (hitProbability(state) >= 1.0) {
          throw new IllegalArgumentException("MISS is impossible at pity " + state.pity());
        }
        return state.withPity(state.pity() + 1);
      case UP_HIT:
        return resetAfterSuccess(state);
      case OFF_BANNER_HIT:
        if (upProbability(state) >= 1.0) {
          throw new IllegalArgumentException("OFF_BANNER_HIT is impossible for " + state);
        }
        return afterLoss(accelerator.counterOf(state));
      default:
        throw new IllegalArgumentException("Unknown outcome: " + outcome);
    }
  }

  /** 픽업 획득 직후 상태. 다음 목표의 시작 상태가 됩니다. */
  public PullState resetAfterSuccess(PullState state) {
    int carried = accelerator.counterAfterWin(accelerator.counterOf(state), state.guaranteed());
    return accelerator.withCounter(PullState.initial(), carried);
  }

  /**
   * 픽업 1개를 얻기까지 걸릴 수 있는 최대 뽑기 수
   *
   * <p>{@code hardPity × (확정 전까지 가능한 픽업 실패 횟수 + 1)}. 시작 pity 나 이월된 카운터는 이 값을 줄이기만 합니다. 픽업
   * 실패가 끝없이 이어질 수 있는 설정이면 비어 있습니다.
   */
  public OptionalLong worstCasePullsPerItem() {
    long hardPity = config.hardPity();
    if (!config.hasFiftyFifty() || config.upProbability() >= 1.0) {
      return OptionalLong.of(hardPity);
    }
    if (config.guaranteeOnLoss()) {
      return OptionalLong.of(2 * hardPity);
    }
    // 카운터가 임계치에 닿으면 확정 또는 강제 승리
    int cap = accelerator.counterCap();
    return cap > 0 ? OptionalLong.of((cap + 1) * hardPity) : OptionalLong.empty();
  }

  /** 카운터가 확정 임계치에 도달했는데 확정 플래그가 꺼진 입력을 보정합니다. */
  public PullState normalize(PullState state) {
    if (!state.guaranteed() && accelerator.forcesGuarantee(accelerator.counterOf(state))) {
      return state.withGuaranteed(true);
    }
    return state;
  }

  private PullState afterLoss(int counter) {
    int next = accelerator.counterAfterLoss(counter);
    boolean guaranteed = config.guaranteeOnLoss() || accelerator.forcesGuarantee(next);
    return accelerator.withCounter(PullState.of(0, guaranteed), next);
  }
}
