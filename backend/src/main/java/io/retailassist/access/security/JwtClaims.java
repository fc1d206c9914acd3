package io.retailassist.access.security;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads the identity claims the provider puts in session tokens. The provider emits either
 * {@code email} or {@code email_address} depending on the token template.
 */
public final class JwtClaims {

  private static final String[] EMAIL_CLAIMS = {"email", "email_address"};
  private static final String NAME_CLAIM = "name";

  public static String extractEmail(Jwt jwt) {
    for (String claim : EMAIL_CLAIMS) {
      String value = jwt.getClaimAsString(claim);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  public static String extractName(Jwt jwt) {
    return jwt.getClaimAsString(NAME_CLAIM);
  }

  private JwtClaims() {}
}
