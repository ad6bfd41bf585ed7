package gacha.expectation.core.domain.pity;

import gacha.expectation.error.exception.ConfigurationException;

/**
 * 카드풀 천장 모델 설정 (불변, 캐시 키로 사용)
 *
 * <h3>최고 등급 확률</h3>
 *
 * <pre>
 * pity &lt; softPityStart           : baseRate
 * softPityStart &lt;= pity &lt; hard-1 : min(1, baseRate + rampRate * (pity - softPityStart + 1))
 * pity == hardPity - 1            : 1.0
 * </pre>
 *
 * <p>pity 는 "직전 실패 횟수"이므로 {@code pity = hardPity - 1} 인 다음 뽑기가 천장 뽑기입니다.
 *
 * @param baseRate 기본 확률 [0, 1]
 * @param softPityStart 확률 상승이 시작되는 pity 인덱스
 * @param rampRate 소프트 천장 이후 뽑기당 상승폭
 * @param hardPity 천장 (최고 등급이 보장되는 뽑기 번호)
 * @param hasFiftyFifty 픽업 판정(50/50) 존재 여부
 * @param upProbability 비확정 상태의 픽업 확률 [0, 1]
 * @param guaranteeOnLoss 픽업 실패 시 다음 최고 등급 확정 여부
 * @param accelerator 추가 확정 메커니즘
 */
public record PityModelConfig(
    double baseRate,
    int softPityStart,
    double rampRate,
    int hardPity,
    boolean hasFiftyFifty,
    double upProbability,
    boolean guaranteeOnLoss,
    GuaranteeAccelerator accelerator) {

  public PityModelConfig {
    if (hardPity < 1) {
      throw ConfigurationException.invalidPityConfig("hardPity must be >= 1: " + hardPity);
    }
    if (softPityStart < 0 || softPityStart > hardPity) {
      throw ConfigurationException.invalidPityConfig(
          "softPityStart must be within [0, hardPity]: " + softPityStart);
    }
    if (!isProbability(baseRate)) {
      throw ConfigurationException.invalidPityConfig("baseRate must be within [0, 1]: " + baseRate);
    }
    if (!(rampRate >= 0.0) || Double.isInfinite(rampRate)) {
      throw ConfigurationException.invalidPityConfig("rampRate must be finite and >= 0: " + rampRate);
    }
    if (!isProbability(upProbability)) {
      throw ConfigurationException.invalidPityConfig(
          "upProbability must be within [0, 1]: " + upProbability);
    }
    if (accelerator == null) {
      accelerator = GuaranteeAccelerator.none();
    }
    if (!hasFiftyFifty && accelerator.mechanic() != SpecialMechanic.NONE) {
      throw ConfigurationException.invalidPityConfig(
          accelerator.mechanic() + " requires a 50/50 stage");
    }
  }

  private static boolean isProbability(double value) {
    return value >= 0.0 && value <= 1.0;
  }

  public SpecialMechanic mechanic() {
    return accelerator.mechanic();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private double baseRate;
    private int softPityStart;
    private double rampRate;
    private int hardPity;
    private boolean hasFiftyFifty;
    private double upProbability = 1.0;
    private boolean guaranteeOnLoss;
    private GuaranteeAccelerator accelerator = GuaranteeAccelerator.none();

    private Builder() {}

    public Builder baseRate(double baseRate) {
      this.baseRate = baseRate;
      return this;
    }

    public Builder softPityStart(int softPityStart) {
      this.softPityStart = softPityStart;
      return this;
    }

    public Builder rampRate(double rampRate) {
      this.rampRate = rampRate;
      return this;
    }

    public Builder hardPity(int hardPity) {
      this.hardPity = hardPity;
      return this;
    }

    /** 50/50 을 활성화합니다. 패배 시 다음 최고 등급이 확정됩니다. */
    public Builder fiftyFifty(double upProbability) {
      this.hasFiftyFifty = true;
      this.upProbability = upProbability;
      this.guaranteeOnLoss = true;
      return this;
    }

    public Builder guaranteeOnLoss(boolean guaranteeOnLoss) {
      this.guaranteeOnLoss = guaranteeOnLoss;
      return this;
    }

    public Builder accelerator(GuaranteeAccelerator accelerator) {
      this.accelerator = accelerator;
      return this;
    }

    public PityModelConfig build() {
      return new PityModelConfig(
          baseRate,
          softPityStart,
          rampRate,
          hardPity,
          hasFiftyFifty,
          upProbability,
          guaranteeOnLoss,
          accelerator);
    }
  }
}
