package gacha.expectation.core.domain.pity;

/**
 * 운명 포인트 (원신 무기)
 *
 * <p>픽업 실패마다 1 포인트가 쌓이고 임계치에 도달하면 다음 최고 등급이 확정됩니다. 픽업 획득 시 0으로 초기화됩니다.
 *
 * @param threshold 확정 임계치 (>= 1)
 */
public record PointsGuaranteeAccelerator(int threshold) implements GuaranteeAccelerator {

  public PointsGuaranteeAccelerator {
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be >= 1: " + threshold);
    }
  }

  @Override
  public SpecialMechanic mechanic() {
    return SpecialMechanic.POINTS_GUARANTEE;
  }

  @Override
  public int counterCap() {
    return threshold;
  }

  @Override
  public int counterOf(PullState state) {
    return state.fatePoints();
  }

  @Override
  public PullState withCounter(PullState state, int counter) {
    return state.withFatePoints(counter);
  }

  @Override
  public boolean forcesGuarantee(int counter) {
    return counter >= threshold;
  }

  @Override
  public boolean forcesWin(int counter) {
    return false;
  }

  @Override
  public double adjustUpProbability(double baseUpProbability, int counter) {
    return baseUpProbability;
  }

  @Override
  public int counterAfterLoss(int counter) {
    return Math.min(counter + 1, threshold);
  }

  @Override
  public int counterAfterWin(int counter, boolean wasGuaranteed) {
    return 0;
  }

  @Override
  public boolean carriesAcrossSuccess() {
    return false;
  }
}
