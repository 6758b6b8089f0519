package io.b2mash.timetracker.security;

import java.util.Collection;
import org.springframework.security.oauth2.jwt.Jwt;

/** Caller identity decoded from a verified bearer token. */
public record TokenIdentity(String subject, String tokenId, boolean admin) {

  public static TokenIdentity from(Jwt jwt) {
    return new TokenIdentity(jwt.getSubject(), jwt.getId(), hasAdminRole(jwt));
  }

  private static boolean hasAdminRole(Jwt jwt) {
    Object role = jwt.getClaim(Roles.ROLE_CLAIM);
    if (role instanceof String value) {
      return Roles.ADMIN.equals(value);
    }
    if (role instanceof Collection<?> values) {
      return values.contains(Roles.ADMIN);
    }
    return false;
  }
}
