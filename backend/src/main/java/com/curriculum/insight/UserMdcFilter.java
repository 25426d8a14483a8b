package com.curriculum.insight;

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

  static final String USERNAME_MDC_KEY = "username";
  static final String USERNAME_HEADER = "X-Username";
  static final String DEFAULT_USERNAME = "anonymous";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    MDC.put(USERNAME_MDC_KEY, headerOrDefault(request, USERNAME_HEADER, DEFAULT_USERNAME));
    String correlationId = headerOrDefault(request, CORRELATION_ID_HEADER, null);
    if (correlationId != null) {
      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      response.setHeader(CORRELATION_ID_HEADER, correlationId);
    }
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(USERNAME_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }

  private static String headerOrDefault(
      HttpServletRequest request, String header, String fallback) {
    String value = request.getHeader(header);
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
