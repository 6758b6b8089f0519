package io.b2mash.timetracker.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.timetracker.security.BearerTokens;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies {@link TokenRateLimiter} to {@code /api/} requests that carry a bearer token. Sits after
 * bearer authentication, so only tokens that verified are counted.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  static final String API_PATH_MARKER = "/api/";
  static final String LIMIT_REACHED_TYPE = "/errors/limit-reached";
  static final String LIMIT_REACHED_TITLE = "Limit reached";
  static final String LIMIT_REACHED_DETAIL = "Token limit reached, operation cancelled";

  private final TokenRateLimiter rateLimiter;
  private final RateLimitProperties properties;
  private final ObjectMapper objectMapper;

  public RateLimitFilter(
      TokenRateLimiter rateLimiter, RateLimitProperties properties, ObjectMapper objectMapper) {
    this.rateLimiter = rateLimiter;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.enabled()
        || !request.getRequestURI().toLowerCase(Locale.ROOT).contains(API_PATH_MARKER);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String token = BearerTokens.resolve(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (token == null) {
      filterChain.doFilter(request, response);
      return;
    }

    var decision = rateLimiter.tryAcquire(token);
    if (decision.allowed()) {
      filterChain.doFilter(request, response);
      return;
    }

    log.warn(
        "Rate limit reached: path={}, method={}, retry_after={}s",
        request.getRequestURI(),
        request.getMethod(),
        decision.retryAfterSeconds());
    writeLimitReached(request, response, decision.retryAfterSeconds());
  }

  private void writeLimitReached(
      HttpServletRequest request, HttpServletResponse response, long retryAfterSeconds)
      throws IOException {
    Map<String, Object> problem = new LinkedHashMap<>();
    problem.put("type", LIMIT_REACHED_TYPE);
    problem.put("title", LIMIT_REACHED_TITLE);
    problem.put("status", HttpStatus.TOO_MANY_REQUESTS.value());
    problem.put("detail", LIMIT_REACHED_DETAIL);
    problem.put("instance", request.getRequestURI());

    response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
    objectMapper.writeValue(response.getOutputStream(), problem);
  }
}
