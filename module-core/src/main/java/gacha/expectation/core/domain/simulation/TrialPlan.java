package gacha.expectation.core.domain.simulation;

import gacha.expectation.core.domain.pity.PullState;

/**
 * 몬테카를로 실행 계획 (검증 완료된 값)
 *
 * @param initialState 시작 상태
 * @param targetCount 목표 픽업 획득 수
 * @param trialCount 시행 횟수
 * @param budget 성공률 계산용 예산 (nullable)
 * @param seed 기준 시드
 * @param featuredFourStarMaxed 픽업 4성 최대 돌파 여부
 */
public record TrialPlan(
    PullState initialState,
    int targetCount,
    int trialCount,
    Integer budget,
    long seed,
    boolean featuredFourStarMaxed) {

  public TrialPlan {
    if (initialState == null) {
      throw new IllegalArgumentException("initialState cannot be null");
    }
    if (targetCount < 1) {
      throw new IllegalArgumentException("targetCount must be >= 1: " + targetCount);
    }
    if (trialCount < 1) {
      throw new IllegalArgumentException("trialCount must be >= 1: " + trialCount);
    }
  }

  public boolean hasBudget() {
    return budget != null;
  }
}
