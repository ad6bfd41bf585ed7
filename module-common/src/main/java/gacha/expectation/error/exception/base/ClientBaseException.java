package gacha.expectation.error.exception.base;

import gacha.expectation.error.ErrorCode;

/**
 * 4xx 계열 예외
 *
 * <p>요청 값이 엔진의 정의역을 벗어났을 때 사용합니다. GlobalExceptionHandler는 WARN으로만 기록합니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
