package user.management.domain.repository;

import java.util.List;
import java.util.Optional;
import user.management.domain.User;

/**
 * User Repository Interface (Port)
 *
 * <p><b>Purpose:</b> Defines the contract for user record storage. The collection is ordered and
 * keeps insertion order.
 *
 * <p><b>Contract:</b>
 *
 * <ul>
 *   <li>No operation throws for a missing id; absence is an empty {@link Optional}, {@code false}
 *       or {@code 0}
 *   <li>{@link #addUser(User)} appends unconditionally; {@link #addIfAbsent(User)} enforces id
 *       uniqueness atomically
 *   <li>{@link #deleteUser(int)} removes every record carrying the id
 *   <li>Implementations must be safe to share between request threads
 * </ul>
 *
 * <p><b>Usage Example:</b>
 *
 * <pre>{@code
 * userRepository.addUser(new User(1, "Alice", "alice@example.com"));
 * Optional<User> alice = userRepository.getUser(1);
 * List<User> secondPage = userRepository.listUsers(2, 10);
 * }</pre>
 */
public interface UserRepository {

  /**
   * Returns the slice starting at {@code (page - 1) * pageSize} with at most {@code pageSize}
   * records. A negative offset counts as zero; a non-positive {@code pageSize} or an offset past the
   * end yields an empty list.
   */
  List<User> listUsers(int page, int pageSize);

  Optional<User> getUser(int id);

  void addUser(User user);

  /**
   * Appends the user only if no record carries its id. The check and the append are one atomic
   * step with respect to every other operation on this repository.
   *
   * @return {@code false} if the id was already present (nothing is stored)
   */
  boolean addIfAbsent(User user);

  /**
   * Replaces the first record with the given id, keeping its position. The replacement's own id is
   * stored as given.
   *
   * @return {@code true} if a record was replaced
   */
  boolean updateUser(int id, User user);

  /**
   * @return number of removed records
   */
  int deleteUser(int id);

  int count();
}
