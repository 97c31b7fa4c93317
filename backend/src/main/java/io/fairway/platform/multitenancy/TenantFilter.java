package io.fairway.platform.multitenancy;

import io.fairway.platform.exception.ResourceNotFoundException;
import io.fairway.platform.security.IdentityAdapter;
import io.fairway.platform.security.ResolvedIdentity;
import io.fairway.platform.security.RoleAssignmentRepository;
import io.fairway.platform.security.Roles;
import io.fairway.platform.tenant.TenantRegistry;
import io.fairway.platform.tenant.TenantStatus;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the {@link ResolvedIdentity} of an authenticated request to {@link TenantContext} for the
 * rest of the chain. Requests for unknown, suspended or archived tenants are rejected here.
 *
 * <p>Roles assigned to the user inside the tenant are added to the request's authorities, so
 * {@code @PreAuthorize} role checks see them alongside the roles carried by the token.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  private final IdentityAdapter identityAdapter;
  private final TenantRegistry tenantRegistry;
  private final RoleAssignmentRepository roleAssignmentRepository;

  public TenantFilter(
      IdentityAdapter identityAdapter,
      TenantRegistry tenantRegistry,
      RoleAssignmentRepository roleAssignmentRepository) {
    this.identityAdapter = identityAdapter;
    this.tenantRegistry = tenantRegistry;
    this.roleAssignmentRepository = roleAssignmentRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    var identity = identityAdapter.resolve(authentication).orElse(null);

    if (identity != null && identity.tenantId() != null) {
      TenantStatus status = lookupStatus(identity.tenantId());
      if (status == null) {
        response.sendError(HttpServletResponse.SC_FORBIDDEN, "Tenant not provisioned");
        return;
      }
      if (status == TenantStatus.SUSPENDED || status == TenantStatus.ARCHIVED) {
        log.info("Rejected request for {} tenant {}", status, identity.tenantId());
        response.sendError(HttpServletResponse.SC_FORBIDDEN, "Tenant is " + status);
        return;
      }
      SecurityContext original = SecurityContextHolder.getContext();
      var withAssignedRoles = withAssignedRoles(authentication, identity);
      if (withAssignedRoles != authentication) {
        var context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(withAssignedRoles);
        SecurityContextHolder.setContext(context);
      }
      TenantContext.bind(identity);
      try {
        filterChain.doFilter(request, response);
      } finally {
        TenantContext.clear();
        SecurityContextHolder.setContext(original);
      }
      return;
    }

    // Platform-level token or unauthenticated path: continue unbound
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private Authentication withAssignedRoles(
      Authentication authentication, ResolvedIdentity identity) {
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth) || identity.userId() == null) {
      return authentication;
    }
    Set<String> granted =
        authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .collect(Collectors.toSet());
    var authorities = new ArrayList<GrantedAuthority>(authentication.getAuthorities());
    for (String role : roleAssignmentRepository.findRoles(identity.userId(), identity.tenantId())) {
      String authority = Roles.authorityOf(role);
      if (!granted.contains(authority)) {
        authorities.add(new SimpleGrantedAuthority(authority));
      }
    }
    if (authorities.size() == authentication.getAuthorities().size()) {
      return authentication;
    }
    return new JwtAuthenticationToken(jwtAuth.getToken(), authorities, jwtAuth.getName());
  }

  private TenantStatus lookupStatus(String tenantId) {
    try {
      return tenantRegistry.resolveTenant(tenantId).getStatus();
    } catch (ResourceNotFoundException e) {
      log.debug("Token names unknown tenant {}", tenantId);
      return null;
    }
  }
}
