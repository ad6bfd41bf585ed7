package gacha.expectation.error.exception;

import gacha.expectation.error.ErrorCode;
import gacha.expectation.error.GachaErrorCode;
import gacha.expectation.error.exception.base.ServerBaseException;

/**
 * 계산 오류
 *
 * <p>DP 해가 수렴하지 않거나(상태 공간 순환, 0 확률 분모) 시행이 최대 뽑기 횟수 안에 끝나지 않은 경우 발생합니다. 근사값으로 대체하지 않습니다.
 */
public class ComputeException extends ServerBaseException {

  public ComputeException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public static ComputeException nonConvergent(String detail) {
    return new ComputeException(GachaErrorCode.NON_CONVERGENT_MODEL, detail);
  }

  public static ComputeException pullCeilingExceeded(int trialIndex, int ceiling) {
    return new ComputeException(GachaErrorCode.TRIAL_PULL_CEILING_EXCEEDED, trialIndex, ceiling);
  }
}
