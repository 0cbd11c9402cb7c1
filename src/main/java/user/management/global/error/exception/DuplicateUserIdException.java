package user.management.global.error.exception;

import user.management.global.error.CommonErrorCode;
import user.management.global.error.exception.base.ClientBaseException;

public class DuplicateUserIdException extends ClientBaseException {
  public DuplicateUserIdException(int id) {
    super(CommonErrorCode.DUPLICATE_USER_ID, id);
  }
}
