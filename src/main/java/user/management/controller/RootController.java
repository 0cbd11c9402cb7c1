package user.management.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import user.management.config.UserManagementProperties;

@RestController
@RequiredArgsConstructor
@Tag(name = "Root", description = "헬스 체크용 인사 응답")
public class RootController {

  private final UserManagementProperties properties;

  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(summary = "인사", description = "설정된 인사 문구를 반환합니다.")
  public String greet() {
    return properties.greeting();
  }
}
