package gacha.expectation.core.result;

import gacha.expectation.core.domain.simulation.MonteCarloReport;
import gacha.expectation.core.domain.simulation.PullStatistics;
import gacha.expectation.core.domain.simulation.SimulationRequest;
import gacha.expectation.core.domain.simulation.SimulationResult;

/**
 * 모드별 결과 조립
 *
 * <ul>
 *   <li>expectation: 정확 해 평균만
 *   <li>distribution: 시뮬레이션 분포 + (예산 있으면) 성공률 + (부산물 규칙 있으면) 재화 + 정확 해 평균(선택)
 * </ul>
 */
public class ResultAggregator {

  public SimulationResult aggregate(
      SimulationRequest request, Double exactMean, MonteCarloReport report) {
    if (!request.isDistribution()) {
      if (exactMean == null) {
        throw new IllegalStateException("expectation mode requires the exact mean");
      }
      return new SimulationResult(PullStatistics.meanOnly(exactMean), null, null, null, null, null);
    }
    if (report == null) {
      throw new IllegalStateException("distribution mode requires a simulation report");
    }
    return new SimulationResult(
        PullStatistics.of(report.pulls()),
        request.budget() != null ? report.successRate() : null,
        report.currency(),
        exactMean,
        report.trialCount(),
        report.seed());
  }
}
