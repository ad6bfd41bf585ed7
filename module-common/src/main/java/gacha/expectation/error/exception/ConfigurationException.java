package gacha.expectation.error.exception;

import gacha.expectation.error.ErrorCode;
import gacha.expectation.error.GachaErrorCode;
import gacha.expectation.error.exception.base.ServerBaseException;

/**
 * 설정 오류
 *
 * <p>알 수 없는 (게임, 카드풀) 조합이거나, 천장 설정/시뮬레이션 한도가 내부적으로 모순된 경우 발생합니다. 계산 시작 전에 표면화되며 재시도하지
 * 않습니다.
 *
 * <pre>
 * throw ConfigurationException.unknownPool("genshin", "lightcone");
 * throw new ConfigurationException(GachaErrorCode.INVALID_PITY_CONFIG, "softPityStart > hardPity");
 * </pre>
 */
public class ConfigurationException extends ServerBaseException {

  public ConfigurationException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public static ConfigurationException unknownPool(Object game, Object pool) {
    return new ConfigurationException(GachaErrorCode.UNKNOWN_POOL, game, pool);
  }

  public static ConfigurationException invalidPityConfig(String detail) {
    return new ConfigurationException(GachaErrorCode.INVALID_PITY_CONFIG, detail);
  }

  public static ConfigurationException invalidLimits(String detail) {
    return new ConfigurationException(GachaErrorCode.INVALID_SIMULATION_LIMITS, detail);
  }
}
