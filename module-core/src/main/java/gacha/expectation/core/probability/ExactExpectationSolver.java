package gacha.expectation.core.probability;

import gacha.expectation.core.domain.pity.GuaranteeAccelerator;
import gacha.expectation.core.domain.pity.PityModelConfig;
import gacha.expectation.core.domain.pity.PullState;
import gacha.expectation.error.exception.ComputeException;
import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 정확 해 기대 뽑기 수 계산기 (Markov Chain 후진 대입)
 *
 * <h3>상태 공간</h3>
 *
 * <p>(guaranteed, counter) 레이어마다 pity 0..hardPity-1 의 선형 사슬이 있고, 레이어 사이는 픽업 실패로만 이동합니다.
 *
 * <h3>핵심 알고리즘</h3>
 *
 * <p>레이어 안의 값을 "픽업 실패 시 도착하는 값 X" 에 대한 아핀 식으로 표현합니다.
 *
 * <pre>
 * V[p] = a[p] * X + b[p]
 * a[p] = h*l + (1-h) * a[p+1]
 * b[p] = c   + (1-h) * b[p+1]      (p = hardPity-1 에서 h = 1)
 * </pre>
 *
 * <p>X 가 같은 레이어의 pity 0 이면 {@code X = b[0] / (1 - a[0])} 로 닫고, 다른 레이어면 그 레이어를 먼저 풉니다. 값은
 * [기대 뽑기 수, 리셋 카운터별 흡수 확률...] 벡터이며, 흡수 확률로 여러 목표의 카운터 이월을 합성합니다.
 *
 * <p>설정별 해는 {@link ConcurrentHashMap}에 캐시됩니다.
 */
public class ExactExpectationSolver {

  private static final Logger log = LoggerFactory.getLogger(ExactExpectationSolver.class);

  /** 자기 순환 분모 하한 */
  private static final double EPSILON = 1e-12;

  private final ConcurrentHashMap<PityModelConfig, SolvedTable> cache = new ConcurrentHashMap<>();

  /** 1개 획득 기대 뽑기 수 */
  public double expectedPulls(PityModelConfig config, PullState initialState) {
    return expectedPulls(config, initialState, 1);
  }

  /**
   * 목표 픽업 수를 모두 얻을 때까지의 기대 뽑기 수
   *
   * @param config 천장 설정
   * @param initialState 시작 상태
   * @param targetCount 목표 픽업 수 (>= 1)
   * @return 기대 뽑기 수
   * @throws ComputeException 해가 수렴하지 않는 설정
   */
  public double expectedPulls(PityModelConfig config, PullState initialState, int targetCount) {
    if (targetCount < 1) {
      throw new IllegalArgumentException("targetCount must be >= 1: " + targetCount);
    }
    PullState start = new PityModel(config).normalize(initialState);
    SolvedTable table = table(config);

    double total = table.expectation(start);
    if (targetCount == 1) {
      return total;
    }
    if (!config.accelerator().carriesAcrossSuccess()) {
      return total + (targetCount - 1) * table.expectation(PullState.initial());
    }

    // 카운터가 이월되는 경우: 리셋 상태 분포를 따라 누적
    double[] carried = table.absorption(start);
    for (int k = 1; k < targetCount; k++) {
      double[] next = new double[carried.length];
      for (int r = 0; r < carried.length; r++) {
        if (carried[r] == 0.0) {
          continue;
        }
        PullState reset = table.resetState(r);
        total += carried[r] * table.expectation(reset);
        double[] absorbed = table.absorption(reset);
        for (int j = 0; j < next.length; j++) {
          next[j] += carried[r] * absorbed[j];
        }
      }
      carried = next;
    }
    return total;
  }

  SolvedTable table(PityModelConfig config) {
    return cache.computeIfAbsent(config, this::solve);
  }

  int cachedTableCount() {
    return cache.size();
  }

  private SolvedTable solve(PityModelConfig config) {
    LayerSolver solver = new LayerSolver(new PityModel(config));
    for (int layer = 0; layer < solver.layerCount(); layer++) {
      solver.solve(layer);
    }
    log.debug(
        "[ExactSolver] Table solved. hardPity={}, mechanic={}, layers={}",
        config.hardPity(),
        config.mechanic(),
        solver.layerCount());
    return new SolvedTable(solver.values, config.accelerator(), config.hardPity());
  }

  /** 레이어 단위 후진 대입. 레이어 간 의존은 재귀로 먼저 풀고, 순환이면 실패합니다. */
  private static final class LayerSolver {

    private static final byte PENDING = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte SOLVED = 2;

    private final PityModel model;
    private final GuaranteeAccelerator accelerator;
    private final int cap;
    private final int hardPity;
    private final int width;
    private final double[][][] values;
    private final byte[] status;

    private LayerSolver(PityModel model) {
      this.model = model;
      this.accelerator = model.config().accelerator();
      this.cap = accelerator.counterCap();
      this.hardPity = model.config().hardPity();
      this.width = cap + 2;
      this.values = new double[layerCount()][][];
      this.status = new byte[layerCount()];
    }

    private int layerCount() {
      return 2 * (cap + 1);
    }

    private double[][] solve(int layer) {
      if (status[layer] == SOLVED) {
        return values[layer];
      }
      if (status[layer] == IN_PROGRESS) {
        throw ComputeException.nonConvergent("cyclic dependency between guarantee layers");
      }
      status[layer] = IN_PROGRESS;

      boolean guaranteed = layer > cap;
      int counter = layer % (cap + 1);
      int winReset =
          accelerator.carriesAcrossSuccess() ? accelerator.counterAfterWin(counter, guaranteed) : 0;

      double[] a = new double[hardPity];
      double[][] b = new double[hardPity][width];
      double maxLoss = 0.0;
      for (int p = hardPity - 1; p >= 0; p--) {
        PullState state = accelerator.withCounter(PullState.of(p, guaranteed), counter);
        double hit = model.hitProbability(state);
        double up = model.upProbability(state);
        double miss = 1.0 - hit;

        a[p] = hit * (1.0 - up);
        b[p][0] = 1.0;
        b[p][1 + winReset] += hit * up;
        if (p < hardPity - 1 && miss > 0.0) {
          a[p] += miss * a[p + 1];
          for (int k = 0; k < width; k++) {
            b[p][k] += miss * b[p + 1][k];
          }
        }
        maxLoss = Math.max(maxLoss, a[p]);
      }

      double[] lossValue = new double[width];
      if (maxLoss > 0.0) {
        int lossLayer = lossLayerOf(counter);
        if (lossLayer == layer) {
          double denominator = 1.0 - a[0];
          if (denominator < EPSILON) {
            throw ComputeException.nonConvergent(
                "target is unreachable (loss probability " + a[0] + ")");
          }
          for (int k = 0; k < width; k++) {
            lossValue[k] = b[0][k] / denominator;
          }
        } else {
          lossValue = solve(lossLayer)[0];
        }
      }

      double[][] result = new double[hardPity][width];
      for (int p = 0; p < hardPity; p++) {
        for (int k = 0; k < width; k++) {
          result[p][k] = a[p] * lossValue[k] + b[p][k];
        }
        if (!Double.isFinite(result[p][0])) {
          throw ComputeException.nonConvergent("non-finite expectation at pity " + p);
        }
      }
      values[layer] = result;
      status[layer] = SOLVED;
      return result;
    }

    private int lossLayerOf(int counter) {
      int next = accelerator.counterAfterLoss(counter);
      boolean guaranteed = model.config().guaranteeOnLoss() || accelerator.forcesGuarantee(next);
      return (guaranteed ? cap + 1 : 0) + next;
    }
  }

  /** 풀린 값 테이블: values[layer][pity] = [E, absorb(0), ..., absorb(cap)] */
  static final class SolvedTable {

    private final double[][][] values;
    private final GuaranteeAccelerator accelerator;
    private final int cap;
    private final int hardPity;

    private SolvedTable(double[][][] values, GuaranteeAccelerator accelerator, int hardPity) {
      this.values = values;
      this.accelerator = accelerator;
      this.cap = accelerator.counterCap();
      this.hardPity = hardPity;
    }

    double expectation(PullState state) {
      return row(state)[0];
    }

    double[] absorption(PullState state) {
      double[] row = row(state);
      return Arrays.copyOfRange(row, 1, row.length);
    }

    PullState resetState(int counter) {
      return accelerator.withCounter(PullState.initial(), counter);
    }

    private double[] row(PullState state) {
      if (state.pity() < 0 || state.pity() >= hardPity) {
        throw new IllegalArgumentException(
            "pity must be within [0, " + (hardPity - 1) + "]: " + state.pity());
      }
      int counter = accelerator.counterOf(state);
      if (counter < 0 || counter > cap) {
        throw new IllegalArgumentException("counter must be within [0, " + cap + "]: " + counter);
      }
      int layer = (state.guaranteed() ? cap + 1 : 0) + counter;
      return values[layer][state.pity()];
    }
  }
}
