package gacha.expectation.error.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import gacha.expectation.error.ErrorCode;
import gacha.expectation.error.exception.ValidationException;
import gacha.expectation.error.exception.base.BaseException;
import java.time.LocalDateTime;
import org.springframework.http.ResponseEntity;

/**
 * 에러 응답 본문
 *
 * @param status HTTP 상태 코드
 * @param code 엔진 에러 코드 (G101 등)
 * @param message 사용자에게 노출할 메시지
 * @param field 검증 오류일 때 문제된 요청 필드 (그 외 생략)
 * @param timestamp 발생 시각
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    int status, String code, String message, String field, LocalDateTime timestamp) {

  /**
   * 예외로부터 생성 (가공된 메시지 포함)
   *
   * <p>{@link ValidationException}이면 필드 이름을 별도 항목으로도 내려줍니다.
   */
  public static ErrorResponse from(BaseException e) {
    String field = e instanceof ValidationException ve ? ve.getField() : null;
    return of(e.getErrorCode(), e.getMessage(), field);
  }

  /**
   * 에러 코드로부터 생성 (정적 메시지)
   *
   * <p>예상하지 못한 예외의 상세 내용은 숨기고 Enum에 정의된 기본 메시지만 사용합니다.
   */
  public static ErrorResponse from(ErrorCode errorCode) {
    return of(errorCode, errorCode.getMessage(), null);
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(from(e));
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return ResponseEntity.status(errorCode.getStatus()).body(from(errorCode));
  }

  private static ErrorResponse of(ErrorCode errorCode, String message, String field) {
    return new ErrorResponse(
        errorCode.getStatusCode(), errorCode.getCode(), message, field, LocalDateTime.now());
  }
}
