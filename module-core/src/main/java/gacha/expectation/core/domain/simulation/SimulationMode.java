package gacha.expectation.core.domain.simulation;

import java.util.Arrays;
import java.util.Optional;

/** 계산 모드 */
public enum SimulationMode {
  /** 정확 해(DP)로 평균 뽑기 수만 계산 */
  EXPECTATION("expectation"),

  /** 몬테카를로 시뮬레이션으로 분포/성공률/부산물 계산 */
  DISTRIBUTION("distribution");

  private final String id;

  SimulationMode(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public static Optional<SimulationMode> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(m -> m.id.equalsIgnoreCase(id.trim())).findFirst();
  }
}
