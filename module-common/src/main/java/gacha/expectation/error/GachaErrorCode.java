package gacha.expectation.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 가챠 기대값 엔진 에러 코드
 *
 * <ul>
 *   <li>G0xx: 설정 오류 (ConfigurationException)
 *   <li>G1xx: 요청 검증 오류 (ValidationException)
 *   <li>G2xx: 계산 오류 (ComputeException)
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum GachaErrorCode implements ErrorCode {
  // === Configuration ===
  UNKNOWN_POOL("G001", "지원하지 않는 게임/카드풀 조합입니다 (game: %s, pool: %s)", HttpStatus.NOT_FOUND),
  INVALID_PITY_CONFIG("G002", "천장 설정값이 올바르지 않습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  INVALID_SIMULATION_LIMITS(
      "G003", "시뮬레이션 한도 설정이 올바르지 않습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),

  // === Validation ===
  INVALID_REQUEST_FIELD("G101", "잘못된 요청 값입니다 (field: %s): %s", HttpStatus.BAD_REQUEST),

  // === Compute ===
  NON_CONVERGENT_MODEL("G201", "기대값 계산이 수렴하지 않습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  TRIAL_PULL_CEILING_EXCEEDED(
      "G202", "시행당 최대 뽑기 횟수를 초과했습니다 (trial: %s, ceiling: %s)", HttpStatus.INTERNAL_SERVER_ERROR),

  // === Common ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  SIMULATION_BUSY(
      "S002", "시뮬레이션 작업 큐가 가득 찼습니다. 잠시 후 다시 시도해주세요.", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
