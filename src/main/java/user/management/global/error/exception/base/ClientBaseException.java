package user.management.global.error.exception.base;

import user.management.global.error.ErrorCode;

/**
 * ClientBaseException: 요청 내용이 비즈니스 규칙과 충돌할 때 발생하는 4xx 계열 예외. 클라이언트에게 구체적인 실패 원인을 전달하는
 * 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "User with id %s already exists."와 같은 메시지 완성용
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
