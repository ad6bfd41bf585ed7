package gacha.expectation.core.domain.simulation;

/**
 * 뽑기 수 통계
 *
 * <p>기대값 모드에서는 평균만 채워지고 백분위는 null 입니다.
 */
public record PullStatistics(double mean, Long p25, Long p50, Long p75, Long p90, Long p95) {

  public static PullStatistics meanOnly(double mean) {
    return new PullStatistics(mean, null, null, null, null, null);
  }

  public static PullStatistics of(DistributionSummary summary) {
    return new PullStatistics(
        summary.mean(), summary.p25(), summary.p50(), summary.p75(), summary.p90(), summary.p95());
  }
}
