package io.fairway.platform.security;

import java.util.Optional;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Resolves identities from JWTs validated by the OAuth2 resource server. */
@Component
public class JwtIdentityAdapter implements IdentityAdapter {

  @Override
  public Optional<ResolvedIdentity> resolve(Authentication authentication) {
    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      var jwt = jwtAuth.getToken();
      return Optional.of(
          new ResolvedIdentity(
              jwt.getSubject(), JwtClaims.extractTenantId(jwt), JwtClaims.extractRoles(jwt)));
    }
    return Optional.empty();
  }
}
