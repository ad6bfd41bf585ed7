package gacha.expectation.core.domain.pity;

/** 단일 뽑기 결과 */
public enum PullOutcome {
  /** 최고 등급 미획득 */
  MISS,

  /** 픽업 최고 등급 획득 */
  UP_HIT,

  /** 픽업이 아닌 최고 등급 획득 (50/50 패배) */
  OFF_BANNER_HIT
}
