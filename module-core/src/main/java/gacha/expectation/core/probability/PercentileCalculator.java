package gacha.expectation.core.probability;

import gacha.expectation.core.domain.simulation.DistributionSummary;
import java.util.Arrays;

/**
 * 표본 요약 계산기
 *
 * <p>백분위는 nearest-rank 규칙: 정렬된 표본에서 {@code ceil(q * n)} 번째(1-based) 값. 부동소수 오차를 피하려고 정수 연산으로
 * 순위를 구합니다.
 */
public final class PercentileCalculator {

  private PercentileCalculator() {}

  public static DistributionSummary summarize(int[] samples) {
    long[] widened = new long[samples.length];
    for (int i = 0; i < samples.length; i++) {
      widened[i] = samples[i];
    }
    return summarizeSorted(sortInPlace(widened));
  }

  public static DistributionSummary summarize(long[] samples) {
    return summarizeSorted(sortInPlace(samples.clone()));
  }

  /**
   * @param sorted 오름차순 정렬된 표본 (비어 있으면 안 됨)
   * @param percent 1..100
   */
  public static long nearestRank(long[] sorted, int percent) {
    if (sorted.length == 0) {
      throw new IllegalArgumentException("samples cannot be empty");
    }
    if (percent < 1 || percent > 100) {
      throw new IllegalArgumentException("percent must be within [1, 100]: " + percent);
    }
    long rank = ((long) percent * sorted.length + 99) / 100;
    return sorted[(int) Math.max(0, rank - 1)];
  }

  private static long[] sortInPlace(long[] samples) {
    Arrays.sort(samples);
    return samples;
  }

  private static DistributionSummary summarizeSorted(long[] sorted) {
    if (sorted.length == 0) {
      throw new IllegalArgumentException("samples cannot be empty");
    }
    double sum = 0.0;
    for (long value : sorted) {
      sum += value;
    }
    return new DistributionSummary(
        sum / sorted.length,
        nearestRank(sorted, 25),
        nearestRank(sorted, 50),
        nearestRank(sorted, 75),
        nearestRank(sorted, 90),
        nearestRank(sorted, 95));
  }
}
