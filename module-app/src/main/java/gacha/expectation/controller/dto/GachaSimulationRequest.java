package gacha.expectation.controller.dto;

import gacha.expectation.core.domain.model.GameTitle;
import gacha.expectation.core.domain.model.PoolType;
import gacha.expectation.core.domain.pity.PullState;
import gacha.expectation.core.domain.simulation.SimulationMode;
import gacha.expectation.core.domain.simulation.SimulationRequest;
import gacha.expectation.error.exception.ConfigurationException;
import gacha.expectation.error.exception.ValidationException;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 시뮬레이션 요청 DTO
 *
 * <p>형식 검증(@NotBlank, @Min)만 담당하고, 카드풀 천장 기준 정의역 검증은 코어의 SimulationRequestValidator가 수행합니다.
 *
 * @param game 게임 식별자 (genshin, hsr, zzz)
 * @param pool 카드풀 식별자 (character, weapon, lightcone)
 * @param mode 계산 모드 (expectation, distribution)
 * @param targetCount 목표 픽업 획득 수
 * @param pity 현재 pity (기본 0)
 * @param guaranteed 확정 여부 (기본 false)
 * @param streakCounter 연속 픽업 실패 횟수 (원신 캐릭터)
 * @param fatePoints 운명 포인트 (원신 무기)
 * @param budget 보유 뽑기 수
 * @param featuredFourStarMaxed 픽업 4성 최대 돌파 여부
 * @param seed 난수 시드
 * @param trialCount 시행 횟수
 */
public record GachaSimulationRequest(
    @NotBlank(message = "game은 필수입니다") String game,
    @NotBlank(message = "pool은 필수입니다") String pool,
    @NotBlank(message = "mode는 필수입니다") String mode,
    @NotNull(message = "targetCount는 필수입니다")
        @Min(value = 1, message = "targetCount는 1 이상이어야 합니다")
        Integer targetCount,
    @Min(value = 0, message = "pity는 0 이상이어야 합니다") Integer pity,
    Boolean guaranteed,
    @Min(value = 0, message = "streakCounter는 0 이상이어야 합니다") Integer streakCounter,
    @Min(value = 0, message = "fatePoints는 0 이상이어야 합니다") Integer fatePoints,
    @Min(value = 1, message = "budget은 1 이상이어야 합니다") Integer budget,
    Boolean featuredFourStarMaxed,
    Long seed,
    @Min(value = 1, message = "trialCount는 1 이상이어야 합니다") Integer trialCount) {

  private static final String MODE_HINT = "must be one of [expectation, distribution]";

  /**
   * 코어 요청으로 변환
   *
   * @throws ConfigurationException 알 수 없는 게임/카드풀 식별자
   * @throws ValidationException 알 수 없는 모드
   */
  public SimulationRequest toDomain() {
    GameTitle gameTitle =
        GameTitle.fromId(game).orElseThrow(() -> ConfigurationException.unknownPool(game, pool));
    PoolType poolType =
        PoolType.fromId(pool).orElseThrow(() -> ConfigurationException.unknownPool(game, pool));
    SimulationMode simulationMode =
        SimulationMode.fromId(mode).orElseThrow(() -> new ValidationException("mode", MODE_HINT));

    PullState initialState =
        new PullState(
            orZero(pity),
            Boolean.TRUE.equals(guaranteed),
            orZero(streakCounter),
            orZero(fatePoints));
    return new SimulationRequest(
        gameTitle,
        poolType,
        simulationMode,
        targetCount,
        initialState,
        budget,
        Boolean.TRUE.equals(featuredFourStarMaxed),
        seed,
        trialCount);
  }

  private static int orZero(Integer value) {
    return value != null ? value : 0;
  }
}
