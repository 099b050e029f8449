package com.nfservice.plugboleto.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs one line per HTTP request with method, path, status and latency.
 *
 * <p>A correlation id is put in the SLF4J MDC for the lifetime of the request; a caller
 * supplied {@code X-Correlation-Id} header is reused. Return-file and print calls can block
 * for minutes while polling, so the latency here includes the polling waits. The MDC is
 * cleared in a {@code finally} block.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger LOG = LoggerFactory.getLogger(RequestLoggingFilter.class);

  static final String CORRELATION_HEADER = "X-Correlation-Id";

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {
    String correlationId = request.getHeader(CORRELATION_HEADER);
    if (correlationId == null || correlationId.isBlank()) {
      correlationId = UUID.randomUUID().toString();
    }
    MDC.put("correlationId", correlationId);
    response.setHeader(CORRELATION_HEADER, correlationId);

    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      LOG.info("event=http.request method={} path={} status={} durationMs={}",
          request.getMethod(), request.getRequestURI(), response.getStatus(), duration);
      MDC.clear();
    }
  }
}
