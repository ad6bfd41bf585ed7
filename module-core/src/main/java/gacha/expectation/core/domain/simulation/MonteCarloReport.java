package gacha.expectation.core.domain.simulation;

/**
 * 몬테카를로 실행 결과
 *
 * @param pulls 시행별 뽑기 수 분포
 * @param successRate 예산 이내 성공 비율 (%) - 예산이 없으면 null
 * @param currency 부산물 통계 - 부산물 규칙이 없으면 null
 * @param trialCount 시행 횟수
 * @param seed 기준 시드
 */
public record MonteCarloReport(
    DistributionSummary pulls,
    Double successRate,
    CurrencyStatistics currency,
    int trialCount,
    long seed) {}
