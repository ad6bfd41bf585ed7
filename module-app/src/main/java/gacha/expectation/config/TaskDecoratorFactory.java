package gacha.expectation.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/**
 * Task Decorator Factory - MDC 전파용 TaskDecorator 생성
 *
 * <h4>MDCFilter 연계</h4>
 *
 * <p>HTTP 요청 진입 시 {@link gacha.expectation.global.filter.MDCFilter}가 설정한 requestId가 이
 * TaskDecorator를 통해 시뮬레이션 워커 스레드로 전파됩니다.
 *
 * <h4>전파 원리 (snapshot/restore 패턴)</h4>
 *
 * <ol>
 *   <li>호출 스레드에서 contextMap = MDC.getCopyOfContextMap()
 *   <li>워커 스레드 진입 시 MDC.setContextMap(contextMap)
 *   <li>작업 완료 후 finally에서 워커 스레드의 이전 상태로 원복
 * </ol>
 */
public class TaskDecoratorFactory {

  public TaskDecorator createMdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> captured = MDC.getCopyOfContextMap();

      return () -> {
        Map<String, String> before = MDC.getCopyOfContextMap();
        apply(captured);
        try {
          runnable.run();
        } finally {
          // 스레드풀 재사용 시 이전 요청의 requestId 누수 방지
          apply(before);
        }
      };
    };
  }

  private static void apply(Map<String, String> contextMap) {
    if (contextMap != null) {
      MDC.setContextMap(contextMap);
    } else {
      MDC.clear();
    }
  }
}
