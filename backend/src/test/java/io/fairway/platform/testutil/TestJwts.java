package io.fairway.platform.testutil;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;

import io.fairway.platform.security.JwtClaims;
import java.util.Arrays;
import java.util.List;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;

/** JWT request post-processors shaped like the identity provider's tokens. */
public final class TestJwts {

  private TestJwts() {}

  public static JwtRequestPostProcessor tenantJwt(String userId, Object tenantId, String... roles) {
    return jwt()
        .jwt(
            j ->
                j.subject(userId)
                    .claim(JwtClaims.TENANT_CLAIM, tenantId.toString())
                    .claim(JwtClaims.ROLES_CLAIM, List.of(roles)))
        .authorities(authorities(roles));
  }

  public static JwtRequestPostProcessor platformAdminJwt(String userId) {
    return jwt()
        .jwt(j -> j.subject(userId).claim(JwtClaims.ROLES_CLAIM, List.of("platform-admin")))
        .authorities(authorities("platform-admin"));
  }

  private static List<GrantedAuthority> authorities(String... roles) {
    return Arrays.stream(roles)
        .<GrantedAuthority>map(
            role -> new SimpleGrantedAuthority("ROLE_" + role.toUpperCase().replace('-', '_')))
        .toList();
  }
}
