package user.management.controller.dto.user;

import user.management.domain.User;

public record UserResponse(int id, String name, String email) {
  public static UserResponse from(User user) {
    return new UserResponse(user.id(), user.name(), user.email());
  }
}
