package io.b2mash.timetracker.ratelimit;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Per-token request cooldown.
 *
 * @param enabled switches the filter off entirely when false
 * @param cooldown minimum gap between two accepted requests carrying the same token
 * @param restampOnReject when true a rejected request also resets the cooldown, so a client that
 *     keeps retrying inside the window stays locked out
 * @param retention how long an idle token is remembered; never shorter than {@code cooldown}
 * @param maxTrackedTokens upper bound on remembered tokens
 */
@ConfigurationProperties(prefix = "timetracker.rate-limit")
public record RateLimitProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("5s") Duration cooldown,
    @DefaultValue("true") boolean restampOnReject,
    @DefaultValue("10m") Duration retention,
    @DefaultValue("100000") long maxTrackedTokens) {

  public RateLimitProperties {
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException("timetracker.rate-limit.cooldown must not be negative");
    }
    if (retention.compareTo(cooldown) < 0 || retention.isZero()) {
      throw new IllegalArgumentException(
          "timetracker.rate-limit.retention must be positive and at least the cooldown");
    }
    if (maxTrackedTokens < 1) {
      throw new IllegalArgumentException(
          "timetracker.rate-limit.max-tracked-tokens must be positive");
    }
  }
}
