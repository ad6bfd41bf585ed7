package gacha.expectation.core.domain.byproduct;

/**
 * 캐릭터 카드풀 부산물 재화(스타글리터, 잔류 신호 등) 적립 규칙
 *
 * @param currencyName 재화 이름
 * @param featuredTopRarity 픽업 최고 등급 반환 구간
 * @param standardTopRarity 상시 최고 등급 반환 구간
 * @param standardTopRarityCount 상시 최고 등급 캐릭터 수
 * @param secondary 4성 규칙
 */
public record ByproductRule(
    String currencyName,
    CopyReturnTier featuredTopRarity,
    CopyReturnTier standardTopRarity,
    int standardTopRarityCount,
    SecondaryRarityRule secondary) {

  public ByproductRule {
    if (currencyName == null || currencyName.isBlank()) {
      throw new IllegalArgumentException("currencyName cannot be blank");
    }
    if (featuredTopRarity == null || standardTopRarity == null || secondary == null) {
      throw new IllegalArgumentException("tiers cannot be null");
    }
    if (standardTopRarityCount < 1) {
      throw new IllegalArgumentException(
          "standardTopRarityCount must be >= 1: " + standardTopRarityCount);
    }
  }
}
