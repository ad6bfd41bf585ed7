package gacha.expectation.core.probability;

import static org.assertj.core.api.Assertions.assertThat;

import gacha.expectation.core.domain.byproduct.ByproductRule;
import gacha.expectation.core.domain.byproduct.CopyReturnTier;
import gacha.expectation.core.domain.byproduct.SecondaryRarityRule;
import java.util.SplittableRandom;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ByproductLedger 부산물 적립 테스트")
class ByproductLedgerTest {

  private final SplittableRandom random = new SplittableRandom(1L);

  @Test
  @DisplayName("픽업 최고 등급: 7번째까지 중복 반환, 이후 최대 돌파 반환")
  void featured_copy_tiers() {
    ByproductLedger ledger = new ByproductLedger(rule(0.5), false);

    for (int i = 0; i < 8; i++) {
      ledger.onTopRarity(true, random);
    }

    assertThat(ledger.total()).isEqualTo(7 * 10 + 25);
  }

  @Test
  @DisplayName("4성은 10회 실패 시 확정, 픽업 4성 반환")
  void secondary_pity() {
    ByproductLedger ledger = new ByproductLedger(rule(1.0), false);

    for (int i = 0; i < 9; i++) {
      ledger.onMiss(0.006, random);
    }
    assertThat(ledger.total()).isZero();

    ledger.onMiss(0.006, random);
    assertThat(ledger.total()).isEqualTo(2);
  }

  @Test
  @DisplayName("최대 돌파 픽업 4성은 더 많이 반환")
  void maxed_featured_secondary() {
    ByproductLedger ledger = new ByproductLedger(rule(1.0), true);

    for (int i = 0; i < 10; i++) {
      ledger.onMiss(0.006, random);
    }

    assertThat(ledger.total()).isEqualTo(5);
  }

  @Test
  @DisplayName("최고 등급 획득은 4성 천장을 초기화")
  void top_rarity_resets_secondary_pity() {
    ByproductLedger ledger = new ByproductLedger(rule(1.0), false);

    for (int i = 0; i < 9; i++) {
      ledger.onMiss(0.006, random);
    }
    ledger.onTopRarity(true, random);
    ledger.onMiss(0.006, random);

    assertThat(ledger.total()).isEqualTo(10);
  }

  // 4성 기본 확률을 극소값으로 두어 천장으로만 4성이 나오게 한다
  private static ByproductRule rule(double secondaryUpProbability) {
    return new ByproductRule(
        "Starglitter",
        CopyReturnTier.of(10, 10, 25),
        CopyReturnTier.of(0, 10, 25),
        7,
        new SecondaryRarityRule(
            1e-12, 10, secondaryUpProbability, 2, 5, 0.5, 10, CopyReturnTier.of(0, 2, 5), 2));
  }
}
