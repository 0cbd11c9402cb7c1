package user.management.global.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;
import user.management.config.UserManagementProperties;
import user.management.config.UserManagementProperties.HttpLogging;

/**
 * 요청/응답 로깅 필터
 *
 * <h4>동작 순서</h4>
 *
 * <ol>
 *   <li>Correlation ID 확보 후 MDC({@link #REQUEST_ID_KEY})와 응답 헤더에 설정
 *   <li>요청 본문을 버퍼링하고 요청 라인 + 본문 로그
 *   <li>응답을 {@link ContentCachingResponseWrapper}에 받아둔 채 다음 체인 실행
 *   <li>상태 코드 + 응답 본문 로그 후 버퍼 내용을 실제 응답으로 복사
 * </ol>
 *
 * <p>응답 스트림은 한 번 쓰면 되돌릴 수 없으므로, 본문을 로그로 남기려면 중간에서 버퍼링한 뒤 전달해야 합니다.
 *
 * @see user.management.config.WebConfig
 */
@Slf4j
@Component
public class RequestResponseLoggingFilter extends OncePerRequestFilter {

  /** HTTP 헤더 이름: X-Correlation-ID */
  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  /** MDC 키: requestId */
  public static final String REQUEST_ID_KEY = "requestId";

  private static final String TRUNCATED_SUFFIX = "...(truncated)";

  private final HttpLogging httpLogging;

  public RequestResponseLoggingFilter(UserManagementProperties properties) {
    this.httpLogging = properties.httpLogging();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String correlationId = resolveCorrelationId(request);
    MDC.put(REQUEST_ID_KEY, correlationId);
    response.setHeader(CORRELATION_ID_HEADER, correlationId);

    try {
      if (!httpLogging.enabled()) {
        filterChain.doFilter(request, response);
        return;
      }

      CachedBodyHttpServletRequest cachedRequest = new CachedBodyHttpServletRequest(request);
      log.info("Incoming Request: {}", formatRequest(cachedRequest));

      ContentCachingResponseWrapper cachedResponse = new ContentCachingResponseWrapper(response);
      boolean completed = false;
      try {
        filterChain.doFilter(cachedRequest, cachedResponse);
        completed = true;
      } finally {
        log.info("Outgoing Response: {}", formatResponse(cachedResponse, completed));
      }
      // 예외 시에는 커밋하지 않음 (컨테이너의 /error 포워딩 유지)
      cachedResponse.copyBodyToResponse();
    } finally {
      // 스레드 풀 재사용 시 다른 요청으로 ID가 새지 않도록 반드시 제거
      MDC.remove(REQUEST_ID_KEY);
    }
  }

  /** 외부 헤더 확인 후 없으면 생성 */
  private String resolveCorrelationId(HttpServletRequest request) {
    String id = request.getHeader(CORRELATION_ID_HEADER);
    return (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
  }

  /** {scheme} {host}{path} {?query} {body} */
  private String formatRequest(CachedBodyHttpServletRequest request) {
    String query = request.getQueryString() != null ? "?" + request.getQueryString() : "";
    return String.format(
        "%s %s%s %s %s",
        request.getScheme(),
        resolveHost(request),
        request.getRequestURI(),
        query,
        truncate(request.getBodyAsString()));
  }

  /** {status}: {body}, 체인이 예외로 끝났으면 {status} (aborted): {body} */
  private String formatResponse(ContentCachingResponseWrapper response, boolean completed) {
    String body = new String(response.getContentAsByteArray(), StandardCharsets.UTF_8);
    String status =
        completed ? String.valueOf(response.getStatus()) : response.getStatus() + " (aborted)";
    return status + ": " + truncate(body);
  }

  private String resolveHost(HttpServletRequest request) {
    String host = request.getHeader("Host");
    if (host != null && !host.isBlank()) {
      return host;
    }
    int port = request.getServerPort();
    boolean defaultPort = port == 80 || port == 443 || port <= 0;
    return defaultPort ? request.getServerName() : request.getServerName() + ":" + port;
  }

  private String truncate(String body) {
    int max = httpLogging.maxPayloadLength();
    return body.length() <= max ? body : body.substring(0, max) + TRUNCATED_SUFFIX;
  }
}
