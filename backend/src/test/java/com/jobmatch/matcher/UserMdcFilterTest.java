package com.jobmatch.matcher;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("UserMdcFilter Tests")
class UserMdcFilterTest {

  private final UserMdcFilter filter = new UserMdcFilter();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  @DisplayName("Should expose the user and correlation ids while the request runs")
  void shouldPopulateMdcDuringRequest() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/analytics/predict");
    request.addHeader(UserMdcFilter.USER_ID_HEADER, "user-42");
    request.addHeader(UserMdcFilter.CORRELATION_ID_HEADER, "corr-7");
    Map<String, String> seen = new HashMap<>();

    filter.doFilter(
        request,
        new MockHttpServletResponse(),
        (req, res) -> {
          seen.put("user", MDC.get(UserMdcFilter.USER_ID_MDC_KEY));
          seen.put("correlation", MDC.get(UserMdcFilter.CORRELATION_ID_MDC_KEY));
        });

    assertThat(seen).containsEntry("user", "user-42").containsEntry("correlation", "corr-7");
    assertThat(MDC.get(UserMdcFilter.USER_ID_MDC_KEY)).isNull();
    assertThat(MDC.get(UserMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  @Test
  @DisplayName("Should fall back to anonymous without a user header")
  void shouldDefaultToAnonymous() throws Exception {
    Map<String, String> seen = new HashMap<>();

    filter.doFilter(
        new MockHttpServletRequest("GET", "/analytics/training-status"),
        new MockHttpServletResponse(),
        (req, res) -> {
          seen.put("user", MDC.get(UserMdcFilter.USER_ID_MDC_KEY));
          seen.put("correlation", MDC.get(UserMdcFilter.CORRELATION_ID_MDC_KEY));
        });

    assertThat(seen.get("user")).isEqualTo(UserMdcFilter.DEFAULT_USER_ID);
    assertThat(seen.get("correlation")).isNull();
  }
}
