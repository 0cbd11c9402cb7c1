package user.management.global.error;

import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import user.management.global.error.dto.ProblemResponses;

/**
 * {@code /error} 폴백 경로
 *
 * <p>DispatcherServlet 밖(필터 등)에서 터진 예외는 컨테이너가 이 경로로 포워딩합니다. 기록된 예외 메시지를 detail로 담은 Problem
 * 응답을 만들며, 컨테이너가 4xx/5xx 상태를 기록하지 않았다면 500으로 응답합니다. 기록된 4xx 상태에는 {@code code}를 붙이지
 * 않습니다.
 */
@Slf4j
@RestController
public class ProblemErrorController implements ErrorController {

  @RequestMapping("${server.error.path:/error}")
  public ResponseEntity<ProblemDetail> handleError(HttpServletRequest request) {
    Throwable error = (Throwable) request.getAttribute(RequestDispatcher.ERROR_EXCEPTION);
    HttpStatusCode status = resolveStatus(request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE));

    String detail;
    if (error != null) {
      log.error("Unhandled failure forwarded to error path: ", error);
      detail = error.getMessage();
    } else {
      detail = (String) request.getAttribute(RequestDispatcher.ERROR_MESSAGE);
    }

    // S001 코드는 서버 오류에만 붙임
    if (status.is5xxServerError()) {
      return ProblemResponses.of(CommonErrorCode.INTERNAL_SERVER_ERROR, status, detail);
    }
    return ProblemResponses.of(status, detail);
  }

  private HttpStatusCode resolveStatus(Object statusCode) {
    if (statusCode instanceof Integer code && code >= 400 && code < 600) {
      return HttpStatusCode.valueOf(code);
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
