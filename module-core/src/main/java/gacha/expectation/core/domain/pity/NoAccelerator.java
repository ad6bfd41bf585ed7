package gacha.expectation.core.domain.pity;

/** 추가 메커니즘이 없는 카드풀 */
public record NoAccelerator() implements GuaranteeAccelerator {

  static final NoAccelerator INSTANCE = new NoAccelerator();

  @Override
  public SpecialMechanic mechanic() {
    return SpecialMechanic.NONE;
  }

  @Override
  public int counterCap() {
    return 0;
  }

  @Override
  public int counterOf(PullState state) {
    return 0;
  }

  @Override
  public PullState withCounter(PullState state, int counter) {
    return state;
  }

  @Override
  public boolean forcesGuarantee(int counter) {
    return false;
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
    return 0;
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
