package gacha.expectation.core.domain.model;

import gacha.expectation.core.domain.byproduct.ByproductRule;
import gacha.expectation.core.domain.pity.PityModelConfig;
import java.util.Optional;

/**
 * 카드풀 정의: 천장 모델 + (선택) 부산물 재화 규칙
 *
 * <p>솔버와 시뮬레이터는 타이틀 식별자를 보지 않고 이 정의에 담긴 데이터만 사용합니다.
 *
 * @param key (게임, 카드풀) 키
 * @param pityConfig 천장 모델 설정
 * @param byproduct 부산물 재화 규칙 (재화를 적립하지 않는 카드풀이면 null)
 */
public record PoolDefinition(PoolKey key, PityModelConfig pityConfig, ByproductRule byproduct) {

  public PoolDefinition {
    if (key == null) {
      throw new IllegalArgumentException("key cannot be null");
    }
    if (pityConfig == null) {
      throw new IllegalArgumentException("pityConfig cannot be null");
    }
  }

  public Optional<ByproductRule> byproductRule() {
    return Optional.ofNullable(byproduct);
  }

  public boolean accruesByproduct() {
    return byproduct != null;
  }
}
