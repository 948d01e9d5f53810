package com.ospicorp.abundanceindex.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One line per API call with the payload format and size, since season tables are posted in
 * bulk and dominate request time. Documentation routes are logged at debug only.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long started = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("{} {} with a {} body failed: {}", request.getMethod(), target(request),
          payload(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long elapsed = System.currentTimeMillis() - started;
      if (isDocumentation(request)) {
        log.debug("{} {} -> {} ({} ms)", request.getMethod(), target(request),
            response.getStatus(), elapsed);
      } else {
        log.info("{} {} with a {} body -> {} {} ({} ms)", request.getMethod(), target(request),
            payload(request), response.getStatus(), response.getContentType(), elapsed);
      }
    }
  }

  private static String target(HttpServletRequest request) {
    String query = request.getQueryString();
    if (query == null || query.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + query;
  }

  private static String payload(HttpServletRequest request) {
    String type = request.getContentType();
    if (type == null) {
      return "empty";
    }
    long length = request.getContentLengthLong();
    return length < 0 ? type : type + " " + length + " B";
  }

  private static boolean isDocumentation(HttpServletRequest request) {
    String uri = request.getRequestURI();
    return uri.startsWith("/v3/api-docs") || uri.startsWith("/swagger-ui");
  }
}
