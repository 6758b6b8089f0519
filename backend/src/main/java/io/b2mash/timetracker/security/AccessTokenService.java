package io.b2mash.timetracker.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies the HS256 bearer tokens accepted by {@code /api/**}.
 *
 * <p>Issuance is a demo-only authority: any caller can ask for any name, admin included, and
 * tokens cannot be revoked. Verification goes through the same {@link JwtDecoder} the resource
 * server uses, so both paths accept exactly the same tokens.
 */
@Service
public class AccessTokenService {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenService.class);

  private final TokenProperties properties;
  private final JwtDecoder jwtDecoder;
  private final Clock clock;
  private final byte[] secret;

  @Autowired
  public AccessTokenService(TokenProperties properties, JwtDecoder jwtDecoder) {
    this(properties, jwtDecoder, Clock.systemUTC());
  }

  AccessTokenService(TokenProperties properties, JwtDecoder jwtDecoder, Clock clock) {
    this.properties = properties;
    this.jwtDecoder = jwtDecoder;
    this.clock = clock;
    this.secret = properties.keyBytes();
  }

  /**
   * Signs a token for {@code name}. NOT FOR PRODUCTION: there is no credential check.
   *
   * @param name becomes the {@code sub} claim
   * @param admin adds {@code role: "admin"} when true
   * @return compact JWS serialization
   */
  public String issueToken(String name, boolean admin) {
    try {
      Instant now = clock.instant();
      var claimsBuilder =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(name)
              .issuer(properties.issuer())
              .audience(properties.issuer())
              .issueTime(Date.from(now))
              .expirationTime(Date.from(now.plus(properties.lifetime())));
      if (admin) {
        claimsBuilder.claim(Roles.ROLE_CLAIM, Roles.ADMIN);
      }

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claimsBuilder.build());
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.warn("Issued demo token: subject={}, admin={} (non-production issuer)", name, admin);
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign access token", e);
    }
  }

  /**
   * Verifies signature, expiry, issuer and audience.
   *
   * @throws InvalidTokenException if any check fails
   */
  public TokenIdentity verifyToken(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidTokenException("Token is empty", null);
    }
    try {
      return TokenIdentity.from(jwtDecoder.decode(token));
    } catch (JwtException e) {
      throw new InvalidTokenException("Invalid token: " + e.getMessage(), e);
    }
  }
}
