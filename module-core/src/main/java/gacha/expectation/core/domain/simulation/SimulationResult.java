package gacha.expectation.core.domain.simulation;

/**
 * 최종 계산 결과
 *
 * <p>모드에 해당하지 않는 항목은 null 로 남깁니다 (직렬화 시 생략).
 *
 * @param pulls 뽑기 수 통계
 * @param successRate 성공률 (%)
 * @param currency 부산물 통계
 * @param exactMean 분포 모드에서 함께 계산한 정확 해 평균
 * @param trialCount 시행 횟수
 * @param seed 재현용 시드
 */
public record SimulationResult(
    PullStatistics pulls,
    Double successRate,
    CurrencyStatistics currency,
    Double exactMean,
    Integer trialCount,
    Long seed) {}
