package user.management.domain;

/**
 * 사용자 도메인 (불변)
 *
 * @param id 사용자 ID (클라이언트가 지정)
 * @param name 이름
 * @param email 이메일
 */
public record User(int id, String name, String email) {}
