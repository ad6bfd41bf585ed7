package gacha.expectation.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import gacha.expectation.core.domain.model.PoolDefinition;
import gacha.expectation.core.domain.pity.PityModelConfig;

/**
 * 지원 카드풀 요약 DTO
 *
 * @param game 게임 식별자
 * @param pool 카드풀 식별자
 * @param baseRate 기본 확률
 * @param softPityStart 소프트 천장 시작 pity
 * @param hardPity 천장
 * @param upProbability 픽업 확률 (50/50 없으면 null)
 * @param mechanic 추가 확정 메커니즘
 * @param mechanicThreshold 메커니즘 카운터 임계치 (없으면 null)
 * @param currencyName 부산물 재화 이름 (없으면 null)
 * @param defaultTrialCount 기본 시행 횟수
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PoolSummaryResponse(
    String game,
    String pool,
    double baseRate,
    int softPityStart,
    int hardPity,
    Double upProbability,
    String mechanic,
    Integer mechanicThreshold,
    String currencyName,
    int defaultTrialCount) {

  public static PoolSummaryResponse of(PoolDefinition definition, int defaultTrialCount) {
    PityModelConfig config = definition.pityConfig();
    int cap = config.accelerator().counterCap();
    return new PoolSummaryResponse(
        definition.key().game().getId(),
        definition.key().pool().getId(),
        config.baseRate(),
        config.softPityStart(),
        config.hardPity(),
        config.hasFiftyFifty() ? config.upProbability() : null,
        config.mechanic().name(),
        cap > 0 ? cap : null,
        definition.accruesByproduct() ? definition.byproduct().currencyName() : null,
        defaultTrialCount);
  }
}
