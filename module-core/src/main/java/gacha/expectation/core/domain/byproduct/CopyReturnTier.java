package gacha.expectation.core.domain.byproduct;

/**
 * 획득 횟수에 따른 부산물 재화 반환량
 *
 * <p>첫 획득, 중복(최대 돌파 이내), 최대 돌파 이후 세 구간으로 나뉩니다.
 *
 * @param firstCopy 첫 획득 시 반환량
 * @param duplicate 2번째 ~ maxCopies 번째 획득 시 반환량
 * @param beyondMax maxCopies 초과 획득 시 반환량
 * @param maxCopies 돌파 상한 (본체 포함 획득 수)
 */
public record CopyReturnTier(int firstCopy, int duplicate, int beyondMax, int maxCopies) {

  /** 본체 1 + 돌파 6 */
  public static final int DEFAULT_MAX_COPIES = 7;

  public CopyReturnTier {
    if (firstCopy < 0 || duplicate < 0 || beyondMax < 0) {
      throw new IllegalArgumentException("return amounts must be >= 0");
    }
    if (maxCopies < 1) {
      throw new IllegalArgumentException("maxCopies must be >= 1: " + maxCopies);
    }
  }

  public static CopyReturnTier of(int firstCopy, int duplicate, int beyondMax) {
    return new CopyReturnTier(firstCopy, duplicate, beyondMax, DEFAULT_MAX_COPIES);
  }

  /**
   * @param copyCount 이번 획득을 포함한 누적 획득 수 (1부터)
   */
  public int returnFor(int copyCount) {
    if (copyCount <= 1) {
      return firstCopy;
    }
    return copyCount <= maxCopies ? duplicate : beyondMax;
  }
}
