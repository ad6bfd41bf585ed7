package gacha.expectation.core.domain.byproduct;

/**
 * 한 단계 아래 등급(4성) 규칙
 *
 * <p>최고 등급 뽑기가 실패한 뽑기에서만 판정되며, 조건부 확률은 {@code baseRate / (1 - 최고 등급 확률)} 입니다. 자체
 * 천장({@code pity})과 50/50 확정을 가집니다.
 *
 * @param baseRate 4성 기본 확률
 * @param pity 4성 천장
 * @param upProbability 4성 픽업 확률
 * @param featuredReturn 픽업 4성 반환량
 * @param featuredMaxedReturn 픽업 4성이 이미 최대 돌파인 경우 반환량
 * @param offBannerCharacterShare 픽업 실패 시 캐릭터가 나올 비율
 * @param offBannerCharacterCount 픽업 외 4성 캐릭터 수
 * @param characterTier 픽업 외 4성 캐릭터 반환 구간
 * @param otherReturn 픽업 외 4성 무기/광추 반환량
 */
public record SecondaryRarityRule(
    double baseRate,
    int pity,
    double upProbability,
    int featuredReturn,
    int featuredMaxedReturn,
    double offBannerCharacterShare,
    int offBannerCharacterCount,
    CopyReturnTier characterTier,
    int otherReturn) {

  public SecondaryRarityRule {
    if (!(baseRate > 0.0 && baseRate < 1.0)) {
      throw new IllegalArgumentException("baseRate must be within (0, 1): " + baseRate);
    }
    if (pity < 1) {
      throw new IllegalArgumentException("pity must be >= 1: " + pity);
    }
    if (!(offBannerCharacterShare >= 0.0 && offBannerCharacterShare <= 1.0)) {
      throw new IllegalArgumentException(
          "offBannerCharacterShare must be within [0, 1]: " + offBannerCharacterShare);
    }
    if (offBannerCharacterCount < 1) {
      throw new IllegalArgumentException(
          "offBannerCharacterCount must be >= 1: " + offBannerCharacterCount);
    }
    if (characterTier == null) {
      throw new IllegalArgumentException("characterTier cannot be null");
    }
  }
}
