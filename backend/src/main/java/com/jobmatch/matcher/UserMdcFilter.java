package com.jobmatch.matcher;

import java.io.IOException;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
@Order(1)
public class UserMdcFilter extends OncePerRequestFilter {

  static final String USER_ID_MDC_KEY = "userId";
  static final String USER_ID_HEADER = "X-User-Id";
  static final String DEFAULT_USER_ID = "anonymous";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String userId = request.getHeader(USER_ID_HEADER);
      if (userId == null || userId.isBlank()) {
        userId = DEFAULT_USER_ID;
      }
      MDC.put(USER_ID_MDC_KEY, userId);

      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId != null && !correlationId.isEmpty()) {
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(USER_ID_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }
}
