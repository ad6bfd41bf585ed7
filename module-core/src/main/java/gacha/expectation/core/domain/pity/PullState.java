package gacha.expectation.core.domain.pity;

/**
 * 사용자의 현재 뽑기 상태 (불변)
 *
 * <p>카운터 해석은 카드풀의 {@link GuaranteeAccelerator}가 담당합니다. 카드풀에 없는 메커니즘의 카운터는 항상 0입니다.
 *
 * @param pity 마지막 최고 등급 획득 이후 연속 실패 횟수
 * @param guaranteed 다음 최고 등급이 픽업으로 확정되는지 여부
 * @param streakCounter 연속 픽업 실패 횟수 (원신 캐릭터 전용)
 * @param fatePoints 운명 포인트 (원신 무기 전용)
 */
public record PullState(int pity, boolean guaranteed, int streakCounter, int fatePoints) {

  private static final PullState INITIAL = new PullState(0, false, 0, 0);

  public static PullState initial() {
    return INITIAL;
  }

  public static PullState of(int pity, boolean guaranteed) {
    return new PullState(pity, guaranteed, 0, 0);
  }

  public PullState withPity(int newPity) {
    return new PullState(newPity, guaranteed, streakCounter, fatePoints);
  }

  public PullState withGuaranteed(boolean newGuaranteed) {
    return new PullState(pity, newGuaranteed, streakCounter, fatePoints);
  }

  public PullState withStreakCounter(int newStreakCounter) {
    return new PullState(pity, guaranteed, newStreakCounter, fatePoints);
  }

  public PullState withFatePoints(int newFatePoints) {
    return new PullState(pity, guaranteed, streakCounter, newFatePoints);
  }
}
