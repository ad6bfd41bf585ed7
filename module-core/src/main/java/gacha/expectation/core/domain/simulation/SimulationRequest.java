package gacha.expectation.core.domain.simulation;

import gacha.expectation.core.domain.model.GameTitle;
import gacha.expectation.core.domain.model.PoolType;
import gacha.expectation.core.domain.pity.PullState;

/**
 * 계산 요청
 *
 * @param game 게임 타이틀
 * @param pool 카드풀 종류
 * @param mode 계산 모드
 * @param targetCount 목표 픽업 획득 수 (>= 1)
 * @param initialState 시작 상태
 * @param budget 보유 뽑기 수 (없으면 null, 성공률 계산 생략)
 * @param featuredFourStarMaxed 픽업 4성이 이미 최대 돌파인지
 * @param seed 난수 시드 (없으면 null, 서버가 생성)
 * @param trialCount 시행 횟수 (없으면 null, 카드풀 기본값)
 */
public record SimulationRequest(
    GameTitle game,
    PoolType pool,
    SimulationMode mode,
    int targetCount,
    PullState initialState,
    Integer budget,
    boolean featuredFourStarMaxed,
    Long seed,
    Integer trialCount) {

  public boolean isDistribution() {
    return mode == SimulationMode.DISTRIBUTION;
  }
}
