package gacha.expectation.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import gacha.expectation.core.domain.simulation.CurrencyStatistics;
import gacha.expectation.core.domain.simulation.DistributionSummary;
import gacha.expectation.core.domain.simulation.PullStatistics;
import gacha.expectation.core.domain.simulation.SimulationResult;

/**
 * 시뮬레이션 응답 DTO
 *
 * <p>모드에 해당하지 않는 항목은 직렬화에서 생략됩니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GachaSimulationResponse(
    Pulls pulls,
    Double successRate,
    Currency currency,
    Double exactMean,
    Integer trialCount,
    Long seed) {

  public static GachaSimulationResponse from(SimulationResult result) {
    return new GachaSimulationResponse(
        Pulls.from(result.pulls()),
        result.successRate(),
        Currency.from(result.currency()),
        result.exactMean(),
        result.trialCount(),
        result.seed());
  }

  /** 뽑기 수 통계 */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Pulls(double mean, Long p25, Long p50, Long p75, Long p90, Long p95) {

    static Pulls from(PullStatistics statistics) {
      return new Pulls(
          statistics.mean(),
          statistics.p25(),
          statistics.p50(),
          statistics.p75(),
          statistics.p90(),
          statistics.p95());
    }
  }

  /** 부산물 재화 통계 */
  public record Currency(
      String name, double mean, long p25, long p50, long p75, long p90, long p95) {

    static Currency from(CurrencyStatistics statistics) {
      if (statistics == null) {
        return null;
      }
      DistributionSummary summary = statistics.summary();
      return new Currency(
          statistics.currencyName(),
          summary.mean(),
          summary.p25(),
          summary.p50(),
          summary.p75(),
          summary.p90(),
          summary.p95());
    }
  }
}
