package user.management.controller.dto.user;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import user.management.domain.User;

/**
 * 사용자 생성/수정 요청 DTO
 *
 * <p>검증은 {@link user.management.validation.UserValidator}가 명시적으로 수행합니다. (PUT은 존재 확인이 검증보다 먼저이므로
 * {@code @Valid} 자동 검증을 쓰지 않음)
 *
 * @param id 사용자 ID (필수)
 * @param name 이름 (공백 불가)
 * @param email 이메일 (local@domain.tld 형식)
 */
public record UserRequest(
    @NotNull(message = "Id is required.") Integer id,
    @NotBlank(message = "Name is required.") String name,
    @NotBlank(message = "Email is required.")
        @Pattern(regexp = UserRequest.EMAIL_PATTERN, message = "Email must be a valid email address.")
        String email) {

  /**
   * 공백 없이 '@' 하나, 도메인에 '.' 하나 이상. 빈 문자열은 {@code @NotBlank}가 보고하므로 여기서는 통과시킵니다.
   */
  public static final String EMAIL_PATTERN = "^$|^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$";

  /** 검증을 통과한 요청에만 호출합니다. */
  public User toDomain() {
    return new User(id, name, email);
  }
}
