package gacha.expectation.core.probability;

import gacha.expectation.core.domain.byproduct.ByproductRule;
import gacha.expectation.core.domain.byproduct.SecondaryRarityRule;
import java.util.SplittableRandom;

/**
 * 시행 1회 동안의 부산물 재화 적립기 (시행마다 새로 생성, 스레드 비공유)
 *
 * <p>최고 등급 판정과 같은 난수원을 사용하며 판정 순서가 고정되어 있으므로 같은 시드는 같은 적립량을 만듭니다.
 */
final class ByproductLedger {

  private final ByproductRule rule;
  private final SecondaryRarityRule secondary;
  private final boolean featuredSecondaryMaxed;
  private final int[] standardTopRarityCopies;
  private final int[] offBannerCharacterCopies;

  private int featuredTopRarityCopies;
  private int secondaryPity;
  private boolean secondaryGuaranteed;
  private long total;

  ByproductLedger(ByproductRule rule, boolean featuredSecondaryMaxed) {
    this.rule = rule;
    this.secondary = rule.secondary();
    this.featuredSecondaryMaxed = featuredSecondaryMaxed;
    this.standardTopRarityCopies = new int[rule.standardTopRarityCount()];
    this.offBannerCharacterCopies = new int[secondary.offBannerCharacterCount()];
  }

  /** 최고 등급 획득 */
  void onTopRarity(boolean featured, SplittableRandom random) {
    secondaryPity = 0;
    if (featured) {
      featuredTopRarityCopies++;
      total += rule.featuredTopRarity().returnFor(featuredTopRarityCopies);
      return;
    }
    int index = (int) (random.nextDouble() * standardTopRarityCopies.length);
    standardTopRarityCopies[index]++;
    total += rule.standardTopRarity().returnFor(standardTopRarityCopies[index]);
  }

  /**
   * 최고 등급 실패 뽑기
   *
   * @param topRarityProbability 이번 뽑기의 최고 등급 확률 (1 미만)
   */
  void onMiss(double topRarityProbability, SplittableRandom random) {
    secondaryPity++;
    double conditional = secondary.baseRate() / (1.0 - topRarityProbability);
    if (secondaryPity >= secondary.pity() || random.nextDouble() < conditional) {
      total += onSecondary(random);
    }
  }

  long total() {
    return total;
  }

  private int onSecondary(SplittableRandom random) {
    secondaryPity = 0;
    if (secondaryGuaranteed || random.nextDouble() < secondary.upProbability()) {
      secondaryGuaranteed = false;
      return featuredSecondaryMaxed ? secondary.featuredMaxedReturn() : secondary.featuredReturn();
    }
    secondaryGuaranteed = true;
    if (random.nextDouble() < secondary.offBannerCharacterShare()) {
      int index = (int) (random.nextDouble() * offBannerCharacterCopies.length);
      offBannerCharacterCopies[index]++;
      return secondary.characterTier().returnFor(offBannerCharacterCopies[index]);
    }
    return secondary.otherReturn();
  }
}
