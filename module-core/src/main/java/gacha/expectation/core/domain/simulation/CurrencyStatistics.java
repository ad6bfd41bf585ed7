package gacha.expectation.core.domain.simulation;

/**
 * 부산물 재화 통계
 *
 * @param currencyName 재화 이름
 * @param summary 시행별 적립량 분포
 */
public record CurrencyStatistics(String currencyName, DistributionSummary summary) {}
