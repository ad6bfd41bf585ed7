package gacha.expectation.error.exception.base;

import gacha.expectation.error.ErrorCode;

/**
 * 5xx 계열 예외
 *
 * <p>카드풀 설정 모순, 수렴 실패, 최대 뽑기 수 초과처럼 엔진 쪽 문제를 나타냅니다. GlobalExceptionHandler가 ERROR로 기록합니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
