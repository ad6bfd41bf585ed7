package gacha.expectation.core.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 카드풀 종류
 *
 * <p>타이틀별로 유효한 조합은 {@link gacha.expectation.core.catalog.PoolCatalog}가 결정합니다.
 */
public enum PoolType {
  /** 한정 캐릭터 */
  CHARACTER("character", "캐릭터"),

  /** 무기 / 음동기 */
  WEAPON("weapon", "무기"),

  /** 광추 */
  LIGHTCONE("lightcone", "광추");

  private final String id;
  private final String description;

  PoolType(String id, String description) {
    this.id = id;
    this.description = description;
  }

  public String getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public boolean isCharacter() {
    return this == CHARACTER;
  }

  public static Optional<PoolType> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.id.equalsIgnoreCase(id.trim())).findFirst();
  }
}
