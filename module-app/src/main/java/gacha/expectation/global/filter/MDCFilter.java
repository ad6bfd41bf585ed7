package gacha.expectation.global.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 요청 단위 Correlation ID 를 MDC 에 심는 필터
 *
 * <p>외부에서 받은 {@value #CORRELATION_ID_HEADER}는 로그에 그대로 찍히므로 영숫자, '-', '_' 로 된 64자 이하 값만
 * 받아들이고, 그 외에는 새 UUID 를 발급합니다.
 *
 * <p>시뮬레이션 워커 스레드로의 전파는 {@link gacha.expectation.config.TaskDecoratorFactory}가 담당합니다.
 */
@Component
public class MDCFilter extends OncePerRequestFilter {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  public static final String REQUEST_ID_KEY = "requestId";

  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String correlationId = correlationIdOf(request);
    MDC.put(REQUEST_ID_KEY, correlationId);
    response.setHeader(CORRELATION_ID_HEADER, correlationId);
    try {
      chain.doFilter(request, response);
    } finally {
      MDC.remove(REQUEST_ID_KEY);
    }
  }

  private static String correlationIdOf(HttpServletRequest request) {
    String id = request.getHeader(CORRELATION_ID_HEADER);
    return (id != null && SAFE_ID.matcher(id).matches()) ? id : UUID.randomUUID().toString();
  }
}
