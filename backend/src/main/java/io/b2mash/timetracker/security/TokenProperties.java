package io.b2mash.timetracker.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Token signing configuration.
 *
 * @param issuer value of the {@code iss} and {@code aud} claims, checked on every request
 * @param key HMAC-SHA256 signing key; at least 32 bytes of UTF-8
 * @param lifetime validity of issued tokens
 * @param demoEndpointEnabled whether {@code GET /get-token} is exposed
 */
@ConfigurationProperties(prefix = "timetracker.tokens")
public record TokenProperties(
    String issuer,
    String key,
    @DefaultValue("365d") Duration lifetime,
    @DefaultValue("true") boolean demoEndpointEnabled) {

  static final int MIN_KEY_BYTES = 32;

  public TokenProperties {
    if (issuer == null || issuer.isBlank()) {
      throw new IllegalArgumentException("timetracker.tokens.issuer must be set");
    }
    if (key == null || key.getBytes(StandardCharsets.UTF_8).length < MIN_KEY_BYTES) {
      throw new IllegalArgumentException(
          "timetracker.tokens.key must be at least " + MIN_KEY_BYTES + " bytes for HS256");
    }
    if (lifetime.isNegative() || lifetime.isZero()) {
      throw new IllegalArgumentException("timetracker.tokens.lifetime must be positive");
    }
  }

  public byte[] keyBytes() {
    return key.getBytes(StandardCharsets.UTF_8);
  }
}
