package gacha.expectation.config;

import gacha.expectation.core.domain.model.PoolType;
import gacha.expectation.core.domain.simulation.SimulationLimits;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 가챠 시뮬레이션 설정 프로퍼티
 *
 * <h3>application.yml 설정 예시</h3>
 *
 * <pre>
 * gacha:
 *   simulation:
 *     min-trial-count: 1000
 *     max-trial-count: 1000000
 *     max-pulls-per-trial: 20000
 *     max-target-count: 100
 *     character-trial-count: 50000
 *     default-trial-count: 25000
 *     cross-check-exact-mean: true
 *     cross-check-tolerance-percent: 2.0
 *     worker-threads: 4
 *     queue-capacity: 64
 * </pre>
 *
 * <p>시행 횟수 하한/상한과 시행당 최대 뽑기 수는 기본값이 없습니다. 누락 시 기동 단계에서 바인딩 검증이 실패합니다.
 *
 * @param minTrialCount 시행 횟수 하한
 * @param maxTrialCount 시행 횟수 상한
 * @param maxPullsPerTrial 시행당 최대 뽑기 수
 * @param maxTargetCount 목표 획득 수 상한
 * @param characterTrialCount 캐릭터 카드풀 기본 시행 횟수
 * @param defaultTrialCount 그 외 카드풀 기본 시행 횟수
 * @param crossCheckExactMean 분포 모드에서 정확 해 평균을 함께 계산할지 여부
 * @param crossCheckTolerancePercent 시뮬레이션 평균과 정확 해의 허용 오차 (%)
 * @param workerThreads 시뮬레이션 워커 스레드 수 (= 청크 수)
 * @param queueCapacity 시뮬레이션 작업 큐 크기
 */
@Validated
@ConfigurationProperties(prefix = "gacha.simulation")
public record SimulationProperties(
    @NotNull @Min(1) Integer minTrialCount,
    @NotNull @Min(1) Integer maxTrialCount,
    @NotNull @Min(1) Integer maxPullsPerTrial,
    @DefaultValue("100") @Min(1) int maxTargetCount,
    @DefaultValue("50000") @Min(1) int characterTrialCount,
    @DefaultValue("25000") @Min(1) int defaultTrialCount,
    @DefaultValue("true") boolean crossCheckExactMean,
    @DefaultValue("2.0") @DecimalMin("0.0") double crossCheckTolerancePercent,
    @DefaultValue("4") @Min(1) int workerThreads,
    @DefaultValue("64") @Min(1) int queueCapacity) {

  /**
   * 코어 한도 값 객체로 변환
   *
   * @throws gacha.expectation.error.exception.ConfigurationException 누락/모순된 한도
   */
  public SimulationLimits toLimits() {
    return SimulationLimits.of(minTrialCount, maxTrialCount, maxPullsPerTrial, maxTargetCount);
  }

  /** 요청에 시행 횟수가 없을 때 사용할 카드풀 기본값 */
  public int trialCountFor(PoolType pool) {
    return pool.isCharacter() ? characterTrialCount : defaultTrialCount;
  }
}
