package user.management.global.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import user.management.global.error.dto.ProblemResponses;
import user.management.global.error.exception.base.BaseException;

/**
 * 전역 예외 처리기
 *
 * <p>잘못된 JSON, 숫자가 아닌 path/query 파라미터, 없는 경로, 지원하지 않는 메서드 등 프레임워크 수준의 클라이언트 오류는 {@link
 * ResponseEntityExceptionHandler}가 4xx Problem 응답으로 변환합니다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  /** 비즈니스 예외 처리 (동적 메시지 포함) */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ProblemDetail> handleBaseException(BaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ProblemResponses.of(e);
  }

  /**
   * 예측하지 못한 시스템 예외 처리
   *
   * <p>응답 detail에 예외 메시지를 그대로 담습니다. 운영 로그에는 스택 트레이스를 남깁니다.
   */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ProblemDetail> handleUnexpectedException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ProblemResponses.of(
        CommonErrorCode.INTERNAL_SERVER_ERROR,
        CommonErrorCode.INTERNAL_SERVER_ERROR.getStatus(),
        e.getMessage());
  }
}
