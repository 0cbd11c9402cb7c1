package user.management.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;
import user.management.domain.User;
import user.management.domain.repository.UserRepository;

/**
 * 프로세스 메모리 기반 UserRepository 구현체
 *
 * <p>애플리케이션 컨텍스트당 하나의 싱글톤으로 생성되며 재시작 시 모든 데이터가 사라집니다.
 *
 * <p>삽입 순서를 유지하는 {@link ArrayList}를 {@link ReentrantReadWriteLock}으로 보호합니다. 조회는 read lock, 변경은
 * write lock을 사용합니다.
 */
@Repository
public class InMemoryUserRepository implements UserRepository {

  private final List<User> users = new ArrayList<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public List<User> listUsers(int page, int pageSize) {
    lock.readLock().lock();
    try {
      long offset = Math.max(0L, ((long) page - 1) * pageSize);
      if (pageSize <= 0 || offset >= users.size()) {
        return List.of();
      }
      int toIndex = (int) Math.min(users.size(), offset + pageSize);
      return List.copyOf(users.subList((int) offset, toIndex));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Optional<User> getUser(int id) {
    lock.readLock().lock();
    try {
      return users.stream().filter(user -> user.id() == id).findFirst();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void addUser(User user) {
    lock.writeLock().lock();
    try {
      users.add(user);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public boolean addIfAbsent(User user) {
    lock.writeLock().lock();
    try {
      if (indexOf(user.id()) != -1) {
        return false;
      }
      users.add(user);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public boolean updateUser(int id, User user) {
    lock.writeLock().lock();
    try {
      int index = indexOf(id);
      if (index == -1) {
        return false;
      }
      users.set(index, user);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public int deleteUser(int id) {
    lock.writeLock().lock();
    try {
      int before = users.size();
      users.removeIf(user -> user.id() == id);
      return before - users.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public int count() {
    lock.readLock().lock();
    try {
      return users.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private int indexOf(int id) {
    for (int i = 0; i < users.size(); i++) {
      if (users.get(i).id() == id) {
        return i;
      }
    }
    return -1;
  }
}
