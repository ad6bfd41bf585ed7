package gacha.expectation.error.exception;

import gacha.expectation.error.GachaErrorCode;
import gacha.expectation.error.exception.base.ClientBaseException;
import lombok.Getter;

/**
 * 요청 검증 오류
 *
 * <p>요청 필드가 정의역을 벗어난 경우(음수 카운트, 천장 이상의 pity, 하한 미만의 시행 횟수 등) 발생합니다. 문제된 필드 이름을 함께 전달합니다.
 */
@Getter
public class ValidationException extends ClientBaseException {

  private final String field;

  public ValidationException(String field, String reason) {
    super(GachaErrorCode.INVALID_REQUEST_FIELD, field, reason);
    this.field = field;
  }
}
