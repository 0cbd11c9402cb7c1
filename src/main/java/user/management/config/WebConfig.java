package user.management.config;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import user.management.global.filter.RequestResponseLoggingFilter;

@Configuration
public class WebConfig {

  @Bean
  public FilterRegistrationBean<RequestResponseLoggingFilter> requestResponseLoggingFilterRegistration(
      RequestResponseLoggingFilter loggingFilter) {
    FilterRegistrationBean<RequestResponseLoggingFilter> registrationBean =
        new FilterRegistrationBean<>(loggingFilter);

    // 모든 필터보다 먼저 실행되어야 이후 로그 전체에 requestId가 찍힙니다.
    registrationBean.setOrder(Ordered.HIGHEST_PRECEDENCE);
    registrationBean.addUrlPatterns("/*");

    return registrationBean;
  }
}
