package user.management.global.error.dto;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import user.management.global.error.ErrorCode;
import user.management.global.error.exception.base.BaseException;

/**
 * RFC 7807 Problem 응답 생성 헬퍼
 *
 * <p>Problem 본문은 {@code detail}에 메시지를 담고, ErrorCode가 있으면 {@code code} 속성에 코드를 담습니다.
 */
public final class ProblemResponses {

  private static final String CODE_PROPERTY = "code";

  private ProblemResponses() {}

  /** 비즈니스 예외: 동적으로 가공된 e.getMessage()를 그대로 전달합니다. */
  public static ResponseEntity<ProblemDetail> of(BaseException e) {
    return of(e.getErrorCode(), e.getErrorCode().getStatus(), e.getMessage());
  }

  /**
   * 예상치 못한 예외: 메시지가 없으면 ErrorCode 기본 메시지로 대체합니다.
   *
   * @param status 응답 상태 (컨테이너가 기록한 에러 상태를 그대로 쓰기 위해 분리)
   */
  public static ResponseEntity<ProblemDetail> of(
      ErrorCode errorCode, HttpStatusCode status, String detail) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            status, (detail == null || detail.isBlank()) ? errorCode.getMessage() : detail);
    problem.setProperty(CODE_PROPERTY, errorCode.getCode());
    return ResponseEntity.status(status).body(problem);
  }

  /** ErrorCode가 없는 응답 (컨테이너가 기록한 4xx 등): code 속성 없이 상태와 detail만 담습니다. */
  public static ResponseEntity<ProblemDetail> of(HttpStatusCode status, String detail) {
    return ResponseEntity.status(status).body(ProblemDetail.forStatusAndDetail(status, detail));
  }
}
