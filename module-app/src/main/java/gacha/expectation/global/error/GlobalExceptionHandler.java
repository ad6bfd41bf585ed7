package gacha.expectation.global.error;

import gacha.expectation.error.GachaErrorCode;
import gacha.expectation.error.dto.ErrorResponse;
import gacha.expectation.error.exception.ValidationException;
import gacha.expectation.error.exception.base.BaseException;
import gacha.expectation.error.exception.base.ServerBaseException;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** 시뮬레이션 Executor 포화 시 재시도 권장 시간 (초) */
  private static final String RETRY_AFTER_SECONDS = "5";

  /** 비즈니스 예외 처리 (동적 메시지 포함) */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ServerBaseException) {
      log.error("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    } else {
      log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ErrorResponse.toResponseEntity(e);
  }

  /** DTO Bean Validation 실패: 첫 번째 필드 오류를 INVALID_REQUEST_FIELD 로 변환 */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException e) {
    FieldError fieldError = e.getBindingResult().getFieldError();
    String field = fieldError != null ? fieldError.getField() : "request";
    String reason = fieldError != null ? fieldError.getDefaultMessage() : "invalid";

    log.warn("Validation Failed: field={} | reason={}", field, reason);
    return invalidField(field, reason);
  }

  /** 본문 파싱 실패 (타입 불일치, 잘못된 JSON) */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  protected ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable Request Body: {}", e.getMostSpecificCause().getMessage());
    return invalidField("body", "malformed JSON request");
  }

  /** 시뮬레이션 Executor 포화: 503 + Retry-After */
  @ExceptionHandler(RejectedExecutionException.class)
  protected ResponseEntity<ErrorResponse> handleRejected(RejectedExecutionException e) {
    log.warn("Simulation Rejected: {}", e.getMessage());
    return ResponseEntity.status(GachaErrorCode.SIMULATION_BUSY.getStatus())
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(ErrorResponse.from(GachaErrorCode.SIMULATION_BUSY));
  }

  /** 예측하지 못한 시스템 예외: 상세 메시지는 숨기고 공통 코드만 반환 */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(GachaErrorCode.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<ErrorResponse> invalidField(String field, String reason) {
    return ErrorResponse.toResponseEntity(new ValidationException(field, reason));
  }
}
