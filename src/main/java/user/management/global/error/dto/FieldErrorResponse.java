package user.management.global.error.dto;

/**
 * 필드 단위 검증 실패 정보
 *
 * @param propertyName 실패한 필드명 (예: name, email)
 * @param errorMessage 실패 사유
 */
public record FieldErrorResponse(String propertyName, String errorMessage) {}
