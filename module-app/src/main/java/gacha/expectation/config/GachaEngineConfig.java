package gacha.expectation.config;

import gacha.expectation.core.catalog.PoolCatalog;
import gacha.expectation.core.domain.simulation.SimulationLimits;
import gacha.expectation.core.probability.ExactExpectationSolver;
import gacha.expectation.core.probability.MonteCarloSimulator;
import gacha.expectation.core.result.ResultAggregator;
import gacha.expectation.core.validation.SimulationRequestValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 순수 Java 엔진(module-core) 컴포넌트 Bean 등록
 *
 * <p>코어는 Spring 에 의존하지 않으므로 이 설정에서 생성자 주입으로 조립합니다.
 */
@Configuration
@EnableConfigurationProperties(SimulationProperties.class)
public class GachaEngineConfig {

  @Bean
  public SimulationLimits simulationLimits(SimulationProperties properties) {
    return properties.toLimits();
  }

  /** 최대 목표 수가 시행당 최대 뽑기 수 안에 들어오지 않으면 기동 실패 */
  @Bean
  public PoolCatalog poolCatalog(SimulationLimits limits) {
    PoolCatalog catalog = PoolCatalog.standard();
    catalog.requireWithin(limits);
    return catalog;
  }

  @Bean
  public ExactExpectationSolver exactExpectationSolver() {
    return new ExactExpectationSolver();
  }

  @Bean
  public MonteCarloSimulator monteCarloSimulator(
      @Qualifier(ExecutorConfig.SIMULATION_EXECUTOR) ThreadPoolTaskExecutor simulationExecutor,
      SimulationProperties properties,
      SimulationLimits limits) {
    return new MonteCarloSimulator(simulationExecutor, properties.workerThreads(), limits);
  }

  @Bean
  public SimulationRequestValidator simulationRequestValidator(SimulationLimits limits) {
    return new SimulationRequestValidator(limits);
  }

  @Bean
  public ResultAggregator resultAggregator() {
    return new ResultAggregator();
  }
}
