package gacha.expectation.core.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 지원 게임 타이틀
 *
 * <p>Pure domain model - no external dependencies.
 */
public enum GameTitle {
  /** 원신 */
  GENSHIN("genshin", "원신"),

  /** 붕괴: 스타레일 */
  HSR("hsr", "붕괴: 스타레일"),

  /** 젠레스 존 제로 */
  ZZZ("zzz", "젠레스 존 제로");

  private final String id;
  private final String description;

  GameTitle(String id, String description) {
    this.id = id;
    this.description = description;
  }

  public String getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  /**
   * 요청 식별자("genshin", "hsr", "zzz")로 조회합니다. 대소문자는 구분하지 않습니다.
   *
   * @param id 게임 식별자
   * @return 일치하는 타이틀 (없으면 empty)
   */
  public static Optional<GameTitle> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.id.equalsIgnoreCase(id.trim())).findFirst();
  }
}
