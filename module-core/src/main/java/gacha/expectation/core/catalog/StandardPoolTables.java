package gacha.expectation.core.catalog;

import gacha.expectation.core.domain.byproduct.ByproductRule;
import gacha.expectation.core.domain.byproduct.CopyReturnTier;
import gacha.expectation.core.domain.byproduct.SecondaryRarityRule;
import gacha.expectation.core.domain.model.GameTitle;
import gacha.expectation.core.domain.model.PoolDefinition;
import gacha.expectation.core.domain.model.PoolKey;
import gacha.expectation.core.domain.model.PoolType;
import gacha.expectation.core.domain.pity.PityModelConfig;
import gacha.expectation.core.domain.pity.PointsGuaranteeAccelerator;
import gacha.expectation.core.domain.pity.StreakBonusAccelerator;
import java.util.List;

/**
 * 타이틀별 공개 확률 테이블
 *
 * <table>
 *   <tr><th>Pool</th><th>Base</th><th>Soft(pity)</th><th>Ramp</th><th>Hard</th><th>Up</th><th>Mechanic</th></tr>
 *   <tr><td>원신 캐릭터</td><td>0.6%</td><td>73</td><td>6%</td><td>90</td><td>50%</td><td>연속 실패 보정</td></tr>
 *   <tr><td>원신 무기</td><td>0.7%</td><td>63</td><td>7%</td><td>80</td><td>37.5%</td><td>운명 포인트 2</td></tr>
 *   <tr><td>스타레일 캐릭터</td><td>0.6%</td><td>73</td><td>6%</td><td>90</td><td>56.25%</td><td>-</td></tr>
 *   <tr><td>스타레일 광추</td><td>0.8%</td><td>65</td><td>8%</td><td>80</td><td>75%</td><td>-</td></tr>
 *   <tr><td>젠레스 캐릭터</td><td>0.6%</td><td>73</td><td>6%</td><td>90</td><td>50%</td><td>-</td></tr>
 *   <tr><td>젠레스 음동기</td><td>1.0%</td><td>64</td><td>6.1875%</td><td>80</td><td>75%</td><td>-</td></tr>
 * </table>
 *
 * <p>스타레일 캐릭터 56.25% 는 상시 캐릭터 구제를 포함한 실효 확률입니다.
 */
final class StandardPoolTables {

  /** 연속 3회 픽업 실패 시 다음은 확정 승리 */
  private static final int GENSHIN_STREAK_THRESHOLD = 3;

  private static final double GENSHIN_RESCUE_CHANCE = 0.00018;

  private static final int GENSHIN_FATE_POINT_THRESHOLD = 2;

  private StandardPoolTables() {}

  static List<PoolDefinition> all() {
    return List.of(
        define(
            GameTitle.GENSHIN,
            PoolType.CHARACTER,
            PityModelConfig.builder()
                .baseRate(0.006)
                .softPityStart(73)
                .rampRate(0.06)
                .hardPity(90)
                .fiftyFifty(0.5)
                .accelerator(
                    new StreakBonusAccelerator(GENSHIN_STREAK_THRESHOLD, GENSHIN_RESCUE_CHANCE))
                .build(),
            genshinStarglitter()),
        define(
            GameTitle.GENSHIN,
            PoolType.WEAPON,
            PityModelConfig.builder()
                .baseRate(0.007)
                .softPityStart(63)
                .rampRate(0.07)
                .hardPity(80)
                .fiftyFifty(0.375)
                .accelerator(new PointsGuaranteeAccelerator(GENSHIN_FATE_POINT_THRESHOLD))
                .build(),
            null),
        define(
            GameTitle.HSR,
            PoolType.CHARACTER,
            PityModelConfig.builder()
                .baseRate(0.006)
                .softPityStart(73)
                .rampRate(0.06)
                .hardPity(90)
                .fiftyFifty(0.5625)
                .build(),
            hsrUndyingStarlight()),
        define(
            GameTitle.HSR,
            PoolType.LIGHTCONE,
            PityModelConfig.builder()
                .baseRate(0.008)
                .softPityStart(65)
                .rampRate(0.08)
                .hardPity(80)
                .fiftyFifty(0.75)
                .build(),
            null),
        define(
            GameTitle.ZZZ,
            PoolType.CHARACTER,
            PityModelConfig.builder()
                .baseRate(0.006)
                .softPityStart(73)
                .rampRate(0.06)
                .hardPity(90)
                .fiftyFifty(0.5)
                .build(),
            zzzResidualSignal()),
        define(
            GameTitle.ZZZ,
            PoolType.WEAPON,
            PityModelConfig.builder()
                .baseRate(0.01)
                .softPityStart(64)
                .rampRate(0.061875)
                .hardPity(80)
                .fiftyFifty(0.75)
                .build(),
            null));
  }

  private static PoolDefinition define(
      GameTitle game, PoolType pool, PityModelConfig config, ByproductRule byproduct) {
    return new PoolDefinition(PoolKey.of(game, pool), config, byproduct);
  }

  // 스타글리터: 4성 39종 중 캐릭터 비중 39/57
  private static ByproductRule genshinStarglitter() {
    return new ByproductRule(
        "Starglitter",
        CopyReturnTier.of(10, 10, 25),
        CopyReturnTier.of(0, 10, 25),
        7,
        new SecondaryRarityRule(
            0.051, 10, 0.5, 2, 5, 39.0 / 57.0, 39, CopyReturnTier.of(0, 2, 5), 2));
  }

  private static ByproductRule hsrUndyingStarlight() {
    return new ByproductRule(
        "Undying Starlight",
        CopyReturnTier.of(40, 40, 100),
        CopyReturnTier.of(0, 40, 100),
        7,
        new SecondaryRarityRule(
            0.051, 10, 0.5, 8, 20, 22.0 / 51.0, 22, CopyReturnTier.of(0, 8, 20), 8));
  }

  // 젠레스: 4성 확률 9.4% 중 캐릭터 7.05%
  private static ByproductRule zzzResidualSignal() {
    return new ByproductRule(
        "Residual Signal",
        CopyReturnTier.of(0, 40, 100),
        CopyReturnTier.of(0, 40, 100),
        6,
        new SecondaryRarityRule(
            0.094, 10, 0.5, 8, 20, 7.05 / 9.4, 12, CopyReturnTier.of(0, 8, 20), 8));
  }
}
