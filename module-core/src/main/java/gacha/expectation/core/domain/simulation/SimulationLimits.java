package gacha.expectation.core.domain.simulation;

import gacha.expectation.error.exception.ConfigurationException;

/**
 * 시뮬레이션 한도
 *
 * <p>시행 횟수 하한/상한과 시행당 최대 뽑기 수는 필수 설정입니다. 누락되거나 모순되면 {@link ConfigurationException}.
 *
 * @param minTrialCount 시행 횟수 하한
 * @param maxTrialCount 시행 횟수 상한
 * @param maxPullsPerTrial 시행당 최대 뽑기 수
 * @param maxTargetCount 목표 획득 수 상한
 */
public record SimulationLimits(
    int minTrialCount, int maxTrialCount, int maxPullsPerTrial, int maxTargetCount) {

  public SimulationLimits {
    if (minTrialCount < 1) {
      throw ConfigurationException.invalidLimits("minTrialCount must be >= 1: " + minTrialCount);
    }
    if (maxTrialCount < minTrialCount) {
      throw ConfigurationException.invalidLimits(
          "maxTrialCount(" + maxTrialCount + ") < minTrialCount(" + minTrialCount + ")");
    }
    if (maxPullsPerTrial < 1) {
      throw ConfigurationException.invalidLimits(
          "maxPullsPerTrial must be >= 1: " + maxPullsPerTrial);
    }
    if (maxTargetCount < 1) {
      throw ConfigurationException.invalidLimits("maxTargetCount must be >= 1: " + maxTargetCount);
    }
  }

  /** 외부 설정(nullable)에서 생성합니다. 누락된 값은 기본값으로 채우지 않습니다. */
  public static SimulationLimits of(
      Integer minTrialCount, Integer maxTrialCount, Integer maxPullsPerTrial, Integer maxTargetCount) {
    return new SimulationLimits(
        require(minTrialCount, "minTrialCount"),
        require(maxTrialCount, "maxTrialCount"),
        require(maxPullsPerTrial, "maxPullsPerTrial"),
        require(maxTargetCount, "maxTargetCount"));
  }

  private static int require(Integer value, String name) {
    if (value == null) {
      throw ConfigurationException.invalidLimits(name + " is not configured");
    }
    return value;
  }

  public boolean acceptsTrialCount(int trialCount) {
    return trialCount >= minTrialCount && trialCount <= maxTrialCount;
  }
}
