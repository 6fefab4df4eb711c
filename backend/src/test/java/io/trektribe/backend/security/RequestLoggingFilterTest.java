package io.trektribe.backend.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class RequestLoggingFilterTest {

  private final RequestLoggingFilter filter = new RequestLoggingFilter();

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void populatesMdcDuringRequestAndClearsAfterwards() throws Exception {
    var jwt = Jwt.withTokenValue("token").header("alg", "none").subject("user_42").build();
    SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
    Map<String, String> seen = new HashMap<>();

    filter.doFilter(
        new MockHttpServletRequest("GET", "/api/notifications"),
        new MockHttpServletResponse(),
        (req, res) -> seen.putAll(MDC.getCopyOfContextMap()));

    assertThat(seen).containsEntry(RequestLoggingFilter.MDC_USER_ID, "user_42");
    assertThat(seen).containsKey(RequestLoggingFilter.MDC_REQUEST_ID);
    assertThat(MDC.get(RequestLoggingFilter.MDC_USER_ID)).isNull();
    assertThat(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID)).isNull();
  }

  @Test
  void anonymousRequestHasNoUserId() throws Exception {
    Map<String, String> seen = new HashMap<>();

    filter.doFilter(
        new MockHttpServletRequest("GET", "/actuator/health"),
        new MockHttpServletResponse(),
        (req, res) -> seen.putAll(MDC.getCopyOfContextMap()));

    assertThat(seen).doesNotContainKey(RequestLoggingFilter.MDC_USER_ID);
    assertThat(seen).containsKey(RequestLoggingFilter.MDC_REQUEST_ID);
  }
}
