package io.strativerse.curation.config;

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
 * Resolves the acting curator from {@code X-Curator} for audit attribution and tags the request's
 * log lines with it. The generated request id is echoed in {@code X-Request-Id}.
 */
@Component
public class CuratorLoggingFilter extends OncePerRequestFilter {

  public static final String CURATOR_HEADER = "X-Curator";
  public static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final Logger log = LoggerFactory.getLogger(CuratorLoggingFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String requestId = UUID.randomUUID().toString();
    String curator = curatorOf(request);
    MDC.put("requestId", requestId);
    if (curator != null) {
      MDC.put("curator", curator);
      CuratorContext.setCurrentCurator(curator);
    }
    response.setHeader(REQUEST_ID_HEADER, requestId);
    long started = System.nanoTime();
    try {
      chain.doFilter(request, response);
    } finally {
      log.debug(
          "{} {} -> {} in {} ms",
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          (System.nanoTime() - started) / 1_000_000);
      CuratorContext.clear();
      MDC.remove("curator");
      MDC.remove("requestId");
    }
  }

  private static String curatorOf(HttpServletRequest request) {
    String header = request.getHeader(CURATOR_HEADER);
    return header == null || header.isBlank() ? null : header.trim();
  }
}
