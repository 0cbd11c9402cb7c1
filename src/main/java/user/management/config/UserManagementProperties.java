package user.management.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 애플리케이션 설정 외부화
 *
 * <h3>설정 경로</h3>
 *
 * <pre>
 * user-management:
 *   greeting: Root
 *   pagination:
 *     default-page: 1
 *     default-page-size: 10
 *   http-logging:
 *     enabled: true
 *     max-payload-length: 4096
 * </pre>
 *
 * <p>잘못된 값은 기동 시점에 실패합니다 (fail-fast).
 */
@Validated
@ConfigurationProperties(prefix = "user-management")
public record UserManagementProperties(
    @DefaultValue("Root") @NotBlank String greeting,
    @DefaultValue @Valid Pagination pagination,
    @DefaultValue @Valid HttpLogging httpLogging) {

  /**
   * 목록 조회 기본값
   *
   * @param defaultPage page 파라미터 생략 시 사용 (1부터 시작)
   * @param defaultPageSize pageSize 파라미터 생략 시 사용
   */
  public record Pagination(
      @DefaultValue("1") @Min(1) int defaultPage,
      @DefaultValue("10") @Min(1) int defaultPageSize) {}

  /**
   * 요청/응답 로깅 필터 설정
   *
   * @param enabled false면 로그 없이 요청만 통과시킴
   * @param maxPayloadLength 로그에 남길 본문 최대 글자 수 (초과분은 잘라냄)
   */
  public record HttpLogging(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("4096") @Min(0) int maxPayloadLength) {}
}
