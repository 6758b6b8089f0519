package io.b2mash.timetracker.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import io.b2mash.timetracker.ratelimit.TokenRateLimiterTest.FakeTicker;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitFilterTest {

  private FakeTicker ticker;
  private RateLimitFilter filter;

  @BeforeEach
  void setUp() {
    ticker = new FakeTicker();
    var properties =
        new RateLimitProperties(true, Duration.ofSeconds(5), true, Duration.ofMinutes(10), 1_000);
    filter =
        new RateLimitFilter(
            new TokenRateLimiter(properties, ticker), properties, new ObjectMapper());
  }

  private MockHttpServletResponse perform(String uri, String authorization) throws Exception {
    var request = new MockHttpServletRequest("GET", uri);
    if (authorization != null) {
      request.addHeader("Authorization", authorization);
    }
    var response = new MockHttpServletResponse();
    filter.doFilter(request, response, new MockFilterChain());
    return response;
  }

  @Test
  void secondRequestWithinCooldown_gets429ProblemBody() throws Exception {
    assertThat(perform("/api/users", "Bearer abc").getStatus()).isEqualTo(200);

    var response = perform("/api/users/1", "Bearer abc");

    assertThat(response.getStatus()).isEqualTo(429);
    assertThat(response.getContentType()).startsWith("application/problem+json");
    assertThat(response.getHeader("Retry-After")).isEqualTo("5");
    String body = response.getContentAsString();
    assertThat((String) JsonPath.read(body, "$.type")).isEqualTo("/errors/limit-reached");
    assertThat((String) JsonPath.read(body, "$.title")).isEqualTo("Limit reached");
    assertThat((Integer) JsonPath.read(body, "$.status")).isEqualTo(429);
    assertThat((String) JsonPath.read(body, "$.detail"))
        .isEqualTo("Token limit reached, operation cancelled");
    assertThat((String) JsonPath.read(body, "$.instance")).isEqualTo("/api/users/1");
  }

  @Test
  void bearerPrefixIsCaseInsensitive() throws Exception {
    perform("/api/users", "Bearer abc");

    assertThat(perform("/api/users", "bearer abc").getStatus()).isEqualTo(429);
  }

  @Test
  void pathMatchIsCaseInsensitive() throws Exception {
    perform("/API/users", "Bearer abc");

    assertThat(perform("/Api/clients", "Bearer abc").getStatus()).isEqualTo(429);
  }

  @Test
  void requestWithoutToken_isNotLimited() throws Exception {
    perform("/api/users", null);

    assertThat(perform("/api/users", null).getStatus()).isEqualTo(200);
  }

  @Test
  void nonApiPath_isNotLimited() throws Exception {
    perform("/get-token", "Bearer abc");

    assertThat(perform("/get-token", "Bearer abc").getStatus()).isEqualTo(200);
    assertThat(perform("/actuator/health", "Bearer abc").getStatus()).isEqualTo(200);
  }

  @Test
  void afterCooldown_requestPassesAgain() throws Exception {
    perform("/api/users", "Bearer abc");
    ticker.advance(Duration.ofSeconds(5));

    assertThat(perform("/api/users", "Bearer abc").getStatus()).isEqualTo(200);
  }
}
