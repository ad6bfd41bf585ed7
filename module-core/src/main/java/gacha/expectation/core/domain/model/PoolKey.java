package gacha.expectation.core.domain.model;

/**
 * (게임, 카드풀) 조합 키
 *
 * @param game 게임 타이틀
 * @param pool 카드풀 종류
 */
public record PoolKey(GameTitle game, PoolType pool) {

  public PoolKey {
    if (game == null) {
      throw new IllegalArgumentException("game cannot be null");
    }
    if (pool == null) {
      throw new IllegalArgumentException("pool cannot be null");
    }
  }

  public static PoolKey of(GameTitle game, PoolType pool) {
    return new PoolKey(game, pool);
  }

  @Override
  public String toString() {
    return game.getId() + "-" + pool.getId();
  }
}
