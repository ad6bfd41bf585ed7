package gacha.expectation.core.domain.pity;

/** 카드풀별 추가 확정 메커니즘 종류 */
public enum SpecialMechanic {
  NONE,

  /** 연속 픽업 실패 시 구제 확률 보정 및 임계치 도달 시 강제 승리 */
  STREAK_BONUS,

  /** 픽업 실패 누적 포인트가 임계치에 도달하면 확정 */
  POINTS_GUARANTEE
}
