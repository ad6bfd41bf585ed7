package gacha.expectation.core.catalog;

import gacha.expectation.core.domain.model.GameTitle;
import gacha.expectation.core.domain.model.PoolDefinition;
import gacha.expectation.core.domain.model.PoolKey;
import gacha.expectation.core.domain.model.PoolType;
import gacha.expectation.core.domain.simulation.SimulationLimits;
import gacha.expectation.core.probability.PityModel;
import gacha.expectation.error.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * (게임, 카드풀) → {@link PoolDefinition} 조회 테이블
 *
 * <p>불변이며 스레드 안전합니다.
 */
public class PoolCatalog {

  private final Map<PoolKey, PoolDefinition> definitions;

  public PoolCatalog(List<PoolDefinition> definitions) {
    Map<PoolKey, PoolDefinition> byKey = new LinkedHashMap<>();
    for (PoolDefinition definition : definitions) {
      if (byKey.putIfAbsent(definition.key(), definition) != null) {
        throw ConfigurationException.invalidPityConfig("duplicate pool " + definition.key());
      }
    }
    this.definitions = Collections.unmodifiableMap(byKey);
  }

  /** 공개 확률 테이블로 구성된 카탈로그 */
  public static PoolCatalog standard() {
    return new PoolCatalog(StandardPoolTables.all());
  }

  /**
   * @throws ConfigurationException 지원하지 않는 조합 (UNKNOWN_POOL)
   */
  public PoolDefinition get(GameTitle game, PoolType pool) {
    return find(game, pool)
        .orElseThrow(() -> ConfigurationException.unknownPool(game.getId(), pool.getId()));
  }

  /**
   * 요청 문자열로 조회합니다.
   *
   * @throws ConfigurationException 알 수 없는 게임/카드풀 식별자 또는 조합
   */
  public PoolDefinition get(String gameId, String poolId) {
    GameTitle game =
        GameTitle.fromId(gameId).orElseThrow(() -> ConfigurationException.unknownPool(gameId, poolId));
    PoolType pool =
        PoolType.fromId(poolId).orElseThrow(() -> ConfigurationException.unknownPool(gameId, poolId));
    return find(game, pool).orElseThrow(() -> ConfigurationException.unknownPool(gameId, poolId));
  }

  /**
   * 모든 카드풀에서 최대 목표 수를 시행당 최대 뽑기 수 안에 얻을 수 있는지 확인합니다.
   *
   * @throws ConfigurationException 최악의 경우 뽑기 수가 한도를 넘는 카드풀이 있음
   */
  public void requireWithin(SimulationLimits limits) {
    for (PoolDefinition definition : definitions.values()) {
      OptionalLong perItem = new PityModel(definition.pityConfig()).worstCasePullsPerItem();
      if (perItem.isEmpty()) {
        continue;
      }
      long worstCase = perItem.getAsLong() * limits.maxTargetCount();
      if (worstCase > limits.maxPullsPerTrial()) {
        throw ConfigurationException.invalidLimits(
            "maxPullsPerTrial("
                + limits.maxPullsPerTrial()
                + ") < maxTargetCount("
                + limits.maxTargetCount()
                + ") x worst case "
                + perItem.getAsLong()
                + " pulls per item of "
                + definition.key());
      }
    }
  }

  public Optional<PoolDefinition> find(GameTitle game, PoolType pool) {
    if (game == null || pool == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(definitions.get(PoolKey.of(game, pool)));
  }

  public Collection<PoolDefinition> definitions() {
    return definitions.values();
  }

  /** 타이틀별 지원 카드풀 */
  public Map<GameTitle, List<PoolType>> poolsByGame() {
    Map<GameTitle, List<PoolType>> result = new EnumMap<>(GameTitle.class);
    for (PoolKey key : definitions.keySet()) {
      result.computeIfAbsent(key.game(), g -> new ArrayList<>()).add(key.pool());
    }
    return result;
  }
}
