package io.b2mash.timetracker.security;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated token vending for local use and the integration tests. Disable with {@code
 * timetracker.tokens.demo-endpoint-enabled=false} anywhere real callers can reach the service.
 */
@RestController
@ConditionalOnProperty(
    prefix = "timetracker.tokens",
    name = "demo-endpoint-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DemoTokenController {

  static final String DEFAULT_NAME = "timetracker-demo";

  private final AccessTokenService accessTokenService;

  public DemoTokenController(AccessTokenService accessTokenService) {
    this.accessTokenService = accessTokenService;
  }

  @GetMapping(value = "/get-token", produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> getToken(
      @RequestParam(defaultValue = DEFAULT_NAME) String name,
      @RequestParam(defaultValue = "false") boolean admin) {
    return ResponseEntity.ok(accessTokenService.issueToken(name, admin));
  }
}
