package user.management.service;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import user.management.config.UserManagementProperties;
import user.management.domain.User;
import user.management.domain.repository.UserRepository;
import user.management.global.error.exception.DuplicateUserIdException;

/**
 * 사용자 관리 서비스
 *
 * <p>존재하지 않는 id는 예외가 아닌 값({@link Optional}, {@code false})으로 반환합니다. 중복 id 생성만 {@link
 * DuplicateUserIdException}(409)으로 거절합니다.
 *
 * <h4>메트릭</h4>
 *
 * <ul>
 *   <li>{@code user.commands} (tags: command=create|update|delete, result=success|not_found|conflict)
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

  private static final String COMMAND_METRIC = "user.commands";

  private final UserRepository userRepository;
  private final UserManagementProperties properties;
  private final MeterRegistry meterRegistry;

  /** page/pageSize가 null이면 설정된 기본값을 사용합니다. */
  public List<User> findUsers(Integer page, Integer pageSize) {
    int resolvedPage = page != null ? page : properties.pagination().defaultPage();
    int resolvedPageSize = pageSize != null ? pageSize : properties.pagination().defaultPageSize();
    return userRepository.listUsers(resolvedPage, resolvedPageSize);
  }

  public Optional<User> findUser(int id) {
    return userRepository.getUser(id);
  }

  public boolean exists(int id) {
    return userRepository.getUser(id).isPresent();
  }

  public User createUser(User user) {
    // 존재 확인과 추가를 한 번의 write lock 안에서 처리 (동시 POST 중복 방지)
    if (!userRepository.addIfAbsent(user)) {
      recordCommand("create", "conflict");
      throw new DuplicateUserIdException(user.id());
    }
    recordCommand("create", "success");
    log.info("[User] Created: id={}", user.id());
    return user;
  }

  /**
   * @return 대상이 없으면 {@code false} (저장소는 변경되지 않음)
   */
  public boolean updateUser(int id, User user) {
    boolean updated = userRepository.updateUser(id, user);
    recordCommand("update", updated ? "success" : "not_found");
    if (updated) {
      log.info("[User] Updated: id={}", id);
    }
    return updated;
  }

  public boolean deleteUser(int id) {
    int removed = userRepository.deleteUser(id);
    recordCommand("delete", removed > 0 ? "success" : "not_found");
    if (removed > 1) {
      log.warn("[User] Removed {} records sharing id={}", removed, id);
    } else if (removed == 1) {
      log.info("[User] Deleted: id={}", id);
    }
    return removed > 0;
  }

  private void recordCommand(String command, String result) {
    meterRegistry.counter(COMMAND_METRIC, "command", command, "result", result).increment();
  }
}
