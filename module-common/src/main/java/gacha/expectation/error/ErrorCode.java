package gacha.expectation.error;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 계약
 *
 * <p>{@link #getMessage()}는 {@link String#format} 형식 문자열이며, 예외 생성 시 인자로 완성됩니다.
 */
public interface ErrorCode {
  String getCode();

  String getMessage();

  HttpStatus getStatus();

  default int getStatusCode() {
    return getStatus().value();
  }

  /** 형식 문자열에 인자를 채운 메시지. 인자가 없으면 원문 그대로 */
  default String format(Object... args) {
    return (args == null || args.length == 0) ? getMessage() : String.format(getMessage(), args);
  }
}
