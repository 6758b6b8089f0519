package io.b2mash.timetracker.security;

/**
 * Role constants shared by token issuance, token conversion and {@code @PreAuthorize} checks.
 *
 * <p>A token carries at most one role, in the {@code role} claim. Its absence means an ordinary
 * authenticated caller; there is no intermediate role.
 */
public final class Roles {

  public static final String ROLE_CLAIM = "role";

  public static final String ADMIN = "admin";

  // Spring Security granted authority
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";

  private Roles() {}
}
