package io.fairway.platform.security;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class FairwayJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.OWNER, Roles.AUTHORITY_OWNER,
          Roles.ADMIN, Roles.AUTHORITY_ADMIN,
          Roles.BILLING, Roles.AUTHORITY_BILLING,
          Roles.MEMBER, Roles.AUTHORITY_MEMBER,
          Roles.CHAIN_ADMIN, Roles.AUTHORITY_CHAIN_ADMIN,
          Roles.PLATFORM_ADMIN, Roles.AUTHORITY_PLATFORM_ADMIN);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    return JwtClaims.extractRoles(jwt).stream()
        .map(ROLE_MAPPING::get)
        .filter(Objects::nonNull)
        .<GrantedAuthority>map(SimpleGrantedAuthority::new)
        .toList();
  }
}
