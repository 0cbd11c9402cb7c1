package user.management.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import user.management.config.UserManagementProperties;
import user.management.config.UserManagementProperties.HttpLogging;
import user.management.config.UserManagementProperties.Pagination;
import user.management.domain.User;
import user.management.global.error.exception.DuplicateUserIdException;
import user.management.infrastructure.persistence.InMemoryUserRepository;

/**
 * 동시 요청에서의 저장소/서비스 일관성 검증
 *
 * <p>실제 {@link InMemoryUserRepository}를 사용하며, 모든 스레드를 latch로 묶어 동시에 출발시킵니다.
 */
@Tag("unit")
class UserServiceConcurrencyTest {

  private static final UserManagementProperties PROPERTIES =
      new UserManagementProperties("Root", new Pagination(1, 10), new HttpLogging(true, 4096));

  private final ExecutorService executor = Executors.newFixedThreadPool(8);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("같은 id로 동시에 생성하면 1건만 성공하고 나머지는 DuplicateUserIdException")
  void concurrentCreateWithSameId() throws InterruptedException {
    // Given: 두 스레드가 모두 저장소 진입 직전까지 도달한 뒤에야 진행
    int threadCount = 2;
    CountDownLatch arrived = new CountDownLatch(threadCount);
    InMemoryUserRepository repository =
        new InMemoryUserRepository() {
          @Override
          public boolean addIfAbsent(User user) {
            arrived.countDown();
            awaitQuietly(arrived);
            return super.addIfAbsent(user);
          }
        };
    UserService userService = new UserService(repository, PROPERTIES, new SimpleMeterRegistry());

    AtomicInteger successes = new AtomicInteger();
    AtomicInteger conflicts = new AtomicInteger();

    // When
    runConcurrently(
        threadCount,
        i -> {
          try {
            userService.createUser(new User(1, "user" + i, "user" + i + "@example.com"));
            successes.incrementAndGet();
          } catch (DuplicateUserIdException e) {
            conflicts.incrementAndGet();
          }
        });

    // Then
    assertThat(successes.get()).isEqualTo(1);
    assertThat(conflicts.get()).isEqualTo(1);
    assertThat(repository.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("서로 다른 id를 동시에 생성/삭제해도 목록이 손상되지 않는다")
  void concurrentMutationsKeepStoreConsistent() throws InterruptedException {
    // Given
    int threadCount = 8;
    int perThread = 250;
    InMemoryUserRepository repository = new InMemoryUserRepository();
    UserService userService = new UserService(repository, PROPERTIES, new SimpleMeterRegistry());

    // When: 각 스레드가 자기 구간의 id를 추가하고 짝수 id는 바로 삭제
    runConcurrently(
        threadCount,
        i -> {
          for (int n = 0; n < perThread; n++) {
            int id = i * perThread + n;
            userService.createUser(new User(id, "user" + id, "user" + id + "@example.com"));
            if (id % 2 == 0) {
              userService.deleteUser(id);
            }
          }
        });

    // Then
    assertThat(repository.count()).isEqualTo(threadCount * perThread / 2);
    assertThat(repository.listUsers(1, threadCount * perThread))
        .allSatisfy(user -> assertThat(user.id() % 2).isEqualTo(1));
  }

  private void runConcurrently(int threadCount, IndexedTask task) throws InterruptedException {
    CountDownLatch startLatch = new CountDownLatch(1);
    CountDownLatch endLatch = new CountDownLatch(threadCount);

    for (int i = 0; i < threadCount; i++) {
      int index = i;
      executor.submit(
          () -> {
            try {
              startLatch.await(); // 모든 스레드가 동시에 시작
              task.run(index);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            } finally {
              endLatch.countDown();
            }
          });
    }

    startLatch.countDown();
    assertThat(endLatch.await(10, TimeUnit.SECONDS)).isTrue();
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @FunctionalInterface
  private interface IndexedTask {
    void run(int index);
  }
}
