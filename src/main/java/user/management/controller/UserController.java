package user.management.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import user.management.controller.dto.user.UserRequest;
import user.management.controller.dto.user.UserResponse;
import user.management.domain.User;
import user.management.global.error.dto.FieldErrorResponse;
import user.management.service.UserService;
import user.management.validation.UserValidator;

/**
 * 사용자 CRUD API 컨트롤러
 *
 * <p>API 목록:
 *
 * <ul>
 *   <li>GET /users?page=&pageSize= - 목록 조회 (offset 페이징)
 *   <li>GET /users/{id} - 단건 조회 (없으면 404)
 *   <li>POST /users - 생성 (검증 실패 400, 중복 id 409)
 *   <li>PUT /users/{id} - 전체 교체 (없으면 404, 검증 실패 400)
 *   <li>DELETE /users/{id} - 삭제 (없으면 404)
 * </ul>
 *
 * <p>404/400은 예외 없이 여기서 직접 응답을 만듭니다. 404 본문은 비어 있고, 400 본문은 {@link FieldErrorResponse} 배열입니다.
 */
@Slf4j
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@Tag(name = "User", description = "사용자 CRUD API")
public class UserController {

  private final UserService userService;
  private final UserValidator userValidator;

  @GetMapping
  @Operation(summary = "사용자 목록 조회", description = "page는 1부터 시작합니다. 범위를 벗어나면 빈 배열을 반환합니다.")
  public ResponseEntity<List<UserResponse>> getUsers(
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    List<UserResponse> users =
        userService.findUsers(page, pageSize).stream().map(UserResponse::from).toList();
    return ResponseEntity.ok(users);
  }

  @GetMapping("/{id}")
  @Operation(summary = "사용자 단건 조회")
  public ResponseEntity<UserResponse> getUser(@PathVariable int id) {
    return userService
        .findUser(id)
        .map(UserResponse::from)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping
  @Operation(summary = "사용자 생성", description = "생성된 리소스 경로를 Location 헤더로 반환합니다.")
  public ResponseEntity<?> createUser(@RequestBody UserRequest request) {
    List<FieldErrorResponse> errors = userValidator.validate(request);
    if (!errors.isEmpty()) {
      log.warn("[User] Create rejected: {}", errors);
      return ResponseEntity.badRequest().body(errors);
    }

    User created = userService.createUser(request.toDomain());
    return ResponseEntity.created(URI.create("/users/" + created.id()))
        .body(UserResponse.from(created));
  }

  @PutMapping("/{id}")
  @Operation(summary = "사용자 수정", description = "본문의 id는 경로의 id와 같아야 합니다.")
  public ResponseEntity<?> updateUser(@PathVariable int id, @RequestBody UserRequest request) {
    if (!userService.exists(id)) {
      return ResponseEntity.notFound().build();
    }

    List<FieldErrorResponse> errors = userValidator.validateForUpdate(id, request);
    if (!errors.isEmpty()) {
      log.warn("[User] Update rejected: id={}, errors={}", id, errors);
      return ResponseEntity.badRequest().body(errors);
    }

    // 존재 확인 이후 다른 요청이 먼저 삭제했을 수 있음
    if (!userService.updateUser(id, request.toDomain())) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "사용자 삭제")
  public ResponseEntity<Void> deleteUser(@PathVariable int id) {
    return userService.deleteUser(id)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }
}
