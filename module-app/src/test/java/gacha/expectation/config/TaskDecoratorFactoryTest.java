package gacha.expectation.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

@DisplayName("TaskDecoratorFactory MDC 전파 테스트")
class TaskDecoratorFactoryTest {

  private final TaskDecorator decorator = new TaskDecoratorFactory().createMdcPropagatingDecorator();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  @DisplayName("제출 시점의 requestId가 워커에서 보이고 실행 후 원복된다")
  void propagates_and_restores() throws InterruptedException {
    MDC.put("requestId", "req-1");
    AtomicReference<String> seen = new AtomicReference<>();
    AtomicReference<String> after = new AtomicReference<>();
    Runnable decorated = decorator.decorate(() -> seen.set(MDC.get("requestId")));

    Thread worker =
        new Thread(
            () -> {
              MDC.put("requestId", "stale");
              decorated.run();
              after.set(MDC.get("requestId"));
            });
    worker.start();
    worker.join();

    assertThat(seen.get()).isEqualTo("req-1");
    assertThat(after.get()).isEqualTo("stale");
  }

  @Test
  @DisplayName("제출 시점에 MDC가 비어 있으면 워커 MDC도 비운다")
  void clears_when_nothing_captured() {
    AtomicReference<String> seen = new AtomicReference<>("unset");
    Runnable decorated = decorator.decorate(() -> seen.set(MDC.get("requestId")));

    MDC.put("requestId", "leftover");
    decorated.run();

    assertThat(seen.get()).isNull();
    assertThat(MDC.get("requestId")).isEqualTo("leftover");
  }
}
