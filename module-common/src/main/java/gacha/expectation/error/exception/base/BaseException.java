package gacha.expectation.error.exception.base;

import gacha.expectation.error.ErrorCode;
import lombok.Getter;

/** 엔진 예외 공통 조상. 메시지는 {@link ErrorCode#format(Object...)}로 완성됩니다. */
@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;

  protected BaseException(ErrorCode errorCode, Object... args) {
    super(errorCode.format(args));
    this.errorCode = errorCode;
  }
}
