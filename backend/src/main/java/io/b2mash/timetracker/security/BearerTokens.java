package io.b2mash.timetracker.security;

/** Extracts the raw token from an {@code Authorization} header value. */
public final class BearerTokens {

  private static final String PREFIX = "Bearer ";

  private BearerTokens() {}

  /**
   * @return the token with the {@code Bearer } prefix removed (prefix matched case-insensitively),
   *     or {@code null} when the header is absent, uses another scheme, or carries no token
   */
  public static String resolve(String authorizationHeader) {
    if (authorizationHeader == null) {
      return null;
    }
    String header = authorizationHeader.trim();
    if (!header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      return null;
    }
    String token = header.substring(PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }
}
