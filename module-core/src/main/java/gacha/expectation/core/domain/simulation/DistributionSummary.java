package gacha.expectation.core.domain.simulation;

/**
 * 표본 분포 요약 (nearest-rank 백분위)
 *
 * @param mean 평균
 * @param p25 25 백분위
 * @param p50 중앙값
 * @param p75 75 백분위
 * @param p90 90 백분위
 * @param p95 95 백분위
 */
public record DistributionSummary(double mean, long p25, long p50, long p75, long p90, long p95) {}
