package user.management.validation;

import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import user.management.controller.dto.user.UserRequest;
import user.management.global.error.dto.FieldErrorResponse;

/**
 * 사용자 요청 검증기
 *
 * <p>Bean Validation 제약 조건 위반을 예외 대신 {@link FieldErrorResponse} 목록으로 반환합니다. 빈 목록이면 유효한 요청입니다.
 * 오류는 필드명, 메시지 순으로 정렬됩니다.
 */
@Component
@RequiredArgsConstructor
public class UserValidator {

  private static final Comparator<FieldErrorResponse> ERROR_ORDER =
      Comparator.comparing(FieldErrorResponse::propertyName)
          .thenComparing(FieldErrorResponse::errorMessage);

  private final Validator validator;

  public List<FieldErrorResponse> validate(UserRequest request) {
    return validator.validate(request).stream()
        .map(v -> new FieldErrorResponse(v.getPropertyPath().toString(), v.getMessage()))
        .sorted(ERROR_ORDER)
        .toList();
  }

  /** 수정 요청: 기본 검증 + 본문 id와 경로 id 일치 여부 */
  public List<FieldErrorResponse> validateForUpdate(int pathId, UserRequest request) {
    List<FieldErrorResponse> errors = new ArrayList<>(validate(request));
    if (request.id() != null && request.id() != pathId) {
      errors.add(new FieldErrorResponse("id", "Id must match the id in the request path."));
      errors.sort(ERROR_ORDER);
    }
    return errors;
  }
}
