package io.b2mash.timetracker.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Remembers when each bearer token was last seen and refuses a token that comes back within the
 * cooldown. Single-process only.
 */
@Service
@EnableConfigurationProperties(RateLimitProperties.class)
public class TokenRateLimiter {

  private final long cooldownNanos;
  private final boolean restampOnReject;
  private final Ticker ticker;
  private final Cache<String, Long> lastSeen;

  @Autowired
  public TokenRateLimiter(RateLimitProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  TokenRateLimiter(RateLimitProperties properties, Ticker ticker) {
    this.cooldownNanos = properties.cooldown().toNanos();
    this.restampOnReject = properties.restampOnReject();
    this.ticker = ticker;
    this.lastSeen =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.retention())
            .maximumSize(properties.maxTrackedTokens())
            .ticker(ticker)
            .build();
  }

  /**
   * Records an attempt for {@code token} and decides whether it may proceed. The read, compare and
   * write for one token happen under the map's per-key lock.
   */
  public RateLimitDecision tryAcquire(String token) {
    var decision = new AtomicReference<RateLimitDecision>();
    lastSeen
        .asMap()
        .compute(
            token,
            (key, previous) -> {
              long now = ticker.read();
              if (previous == null || now - previous >= cooldownNanos) {
                decision.set(RateLimitDecision.allow());
                return now;
              }
              if (restampOnReject) {
                decision.set(RateLimitDecision.reject(Duration.ofNanos(cooldownNanos)));
                return now;
              }
              long remaining = cooldownNanos - (now - previous);
              decision.set(RateLimitDecision.reject(Duration.ofNanos(remaining)));
              return previous;
            });
    return decision.get();
  }

  long trackedTokens() {
    lastSeen.cleanUp();
    return lastSeen.estimatedSize();
  }

  public record RateLimitDecision(boolean allowed, Duration retryAfter) {

    static RateLimitDecision allow() {
      return new RateLimitDecision(true, Duration.ZERO);
    }

    static RateLimitDecision reject(Duration retryAfter) {
      return new RateLimitDecision(false, retryAfter);
    }

    /** Whole seconds for a {@code Retry-After} header, rounded up. */
    public long retryAfterSeconds() {
      long seconds = retryAfter.getSeconds();
      return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
  }
}
