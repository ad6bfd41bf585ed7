package gacha.expectation.core.domain.pity;

/**
 * 50/50 결과에 따라 움직이는 추가 카운터 메커니즘 (Strategy)
 *
 * <h3>카운터 규약</h3>
 *
 * <ul>
 *   <li>카운터 값은 {@code 0..counterCap()} 범위
 *   <li>{@link #forcesGuarantee(int)}: 카운터가 확정 플래그를 세움 (운명 포인트)
 *   <li>{@link #forcesWin(int)}: 확정 플래그 없이 이번 50/50 을 승리로 고정 (연속 실패 보정)
 *   <li>{@link #carriesAcrossSuccess()}: 픽업 획득 후에도 카운터가 다음 목표로 이어지는지
 * </ul>
 *
 * <p>{@link PityModelConfig}의 equals/hashCode 에 참여하므로 구현체는 값 객체(record)여야 합니다.
 */
public interface GuaranteeAccelerator {

  SpecialMechanic mechanic();

  /** 카운터 최대값 (메커니즘이 없으면 0) */
  int counterCap();

  /** 상태에서 이 메커니즘이 소유한 카운터를 읽습니다. */
  int counterOf(PullState state);

  /** 이 메커니즘이 소유한 카운터만 교체한 상태를 반환합니다. */
  PullState withCounter(PullState state, int counter);

  boolean forcesGuarantee(int counter);

  boolean forcesWin(int counter);

  /** 카운터에 따른 픽업 확률 보정 */
  double adjustUpProbability(double baseUpProbability, int counter);

  int counterAfterLoss(int counter);

  int counterAfterWin(int counter, boolean wasGuaranteed);

  boolean carriesAcrossSuccess();

  static GuaranteeAccelerator none() {
    return NoAccelerator.INSTANCE;
  }
}
