package gacha.expectation.core.domain.pity;

/**
 * 연속 픽업 실패 보정 (원신 캐릭터)
 *
 * <p>비확정 상태의 50/50 에서 패배할 때마다 카운터가 1 증가하고, 확정 없이 승리하면 0으로 돌아갑니다. 확정으로 얻은 픽업은
 * 카운터를 유지합니다. 카운터가 임계치에 도달하면 다음 50/50 은 승리로 고정되고, 그 전에는 {@code rescueChance} 만큼
 * 먼저 구제 판정을 받습니다: {@code p = rescue + (1 - rescue) * up}.
 *
 * @param threshold 강제 승리 임계치 (>= 1)
 * @param rescueChance 구제 확률 [0, 1]
 */
public record StreakBonusAccelerator(int threshold, double rescueChance)
    implements GuaranteeAccelerator {

  public StreakBonusAccelerator {
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be >= 1: " + threshold);
    }
    if (!(rescueChance >= 0.0 && rescueChance <= 1.0)) {
      throw new IllegalArgumentException("rescueChance must be within [0, 1]: " + rescueChance);
    }
  }

  @Override
  public SpecialMechanic mechanic() {
    return SpecialMechanic.STREAK_BONUS;
  }

  @Override
  public int counterCap() {
    return threshold;
  }

  @Override
  public int counterOf(PullState state) {
    return state.streakCounter();
  }

  @Override
  public PullState withCounter(PullState state, int counter) {
    return state.withStreakCounter(counter);
  }

  @Override
  public boolean forcesGuarantee(int counter) {
    return false;
  }

  @Override
  public boolean forcesWin(int counter) {
    return counter >= threshold;
  }

  @Override
  public double adjustUpProbability(double baseUpProbability, int counter) {
    return rescueChance + (1.0 - rescueChance) * baseUpProbability;
  }

  @Override
  public int counterAfterLoss(int counter) {
    return Math.min(counter + 1, threshold);
  }

  @Override
  public int counterAfterWin(int counter, boolean wasGuaranteed) {
    return wasGuaranteed ? counter : 0;
  }

  @Override
  public boolean carriesAcrossSuccess() {
    return true;
  }
}
