package gacha.expectation.controller;

import gacha.expectation.application.service.GachaSimulationApplicationService;
import gacha.expectation.controller.dto.GachaSimulationRequest;
import gacha.expectation.controller.dto.GachaSimulationResponse;
import gacha.expectation.controller.dto.PoolSummaryResponse;
import gacha.expectation.core.domain.simulation.SimulationResult;
import gacha.expectation.global.response.ApiResponse;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 가챠 기대값 API
 *
 * <p>엔드포인트:
 *
 * <ul>
 *   <li>POST /api/v1/gacha/simulations - 기대값/분포 계산
 *   <li>GET /api/v1/gacha/pools - 지원 카드풀 목록
 * </ul>
 *
 * <p>시뮬레이션은 내부에서 전용 Executor로 병렬화되므로 컨트롤러는 동기로 응답합니다.
 */
@RestController
@RequestMapping("/api/v1/gacha")
@RequiredArgsConstructor
public class GachaSimulationController {

  private final GachaSimulationApplicationService simulationService;

  @PostMapping("/simulations")
  public ResponseEntity<ApiResponse<GachaSimulationResponse>> simulate(
      @Valid @RequestBody GachaSimulationRequest request) {
    SimulationResult result = simulationService.simulate(request.toDomain());
    return ResponseEntity.ok(ApiResponse.success(GachaSimulationResponse.from(result)));
  }

  @GetMapping("/pools")
  public ResponseEntity<ApiResponse<List<PoolSummaryResponse>>> pools() {
    List<PoolSummaryResponse> pools =
        simulationService.listPools().stream()
            .map(p -> PoolSummaryResponse.of(p, simulationService.defaultTrialCount(p)))
            .toList();
    return ResponseEntity.ok(ApiResponse.success(pools));
  }
}
