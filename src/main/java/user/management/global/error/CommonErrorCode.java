package user.management.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  DUPLICATE_USER_ID("U001", "User with id %s already exists.", HttpStatus.CONFLICT),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR(
      "S001", "An unexpected error occurred.", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
