package io.fairway.platform.security;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Static role to permission catalogue. Identities carry roles; what those roles allow is decided
 * here.
 */
@Component
public class PermissionCatalog {

  private final Map<String, List<Permission>> permissionsByRole;

  public PermissionCatalog() {
    var all = EnumSet.allOf(ResourceType.class);
    var readWrite = EnumSet.of(Action.READ, Action.WRITE);
    var readOnly = EnumSet.of(Action.READ);
    var billingResources =
        EnumSet.of(
            ResourceType.CUSTOMER,
            ResourceType.SUBSCRIPTION,
            ResourceType.INVOICE,
            ResourceType.REVENUE);
    var chainResources =
        EnumSet.of(
            ResourceType.TENANT,
            ResourceType.USAGE,
            ResourceType.REVENUE,
            ResourceType.ANALYTICS,
            ResourceType.EXPORT);

    var owner = grant(Roles.OWNER, all, readWrite, PermissionScope.TENANT);
    var admin = grant(Roles.ADMIN, all, readWrite, PermissionScope.TENANT);
    var billing =
        concat(
            grant(Roles.BILLING, billingResources, readWrite, PermissionScope.TENANT),
            grant(
                Roles.BILLING,
                EnumSet.of(ResourceType.TENANT, ResourceType.USAGE, ResourceType.ANALYTICS),
                readOnly,
                PermissionScope.TENANT));
    var member =
        concat(
            grant(
                Roles.MEMBER,
                EnumSet.of(ResourceType.TENANT, ResourceType.USAGE),
                readOnly,
                PermissionScope.TENANT),
            grant(
                Roles.MEMBER,
                EnumSet.of(ResourceType.SUBSCRIPTION, ResourceType.INVOICE),
                readOnly,
                PermissionScope.SELF));
    var chainAdmin =
        concat(
            grant(Roles.CHAIN_ADMIN, chainResources, readOnly, PermissionScope.TENANT),
            grant(Roles.CHAIN_ADMIN, chainResources, readOnly, PermissionScope.PARENT_CHAIN));
    var system = grant(Roles.SYSTEM, all, readWrite, PermissionScope.TENANT);

    this.permissionsByRole =
        Map.of(
            Roles.OWNER, owner,
            Roles.ADMIN, admin,
            Roles.BILLING, billing,
            Roles.MEMBER, member,
            Roles.CHAIN_ADMIN, chainAdmin,
            Roles.SYSTEM, system);
  }

  public List<Permission> permissionsOf(String role) {
    return permissionsByRole.getOrDefault(role, List.of());
  }

  /** True when any of {@code roles} grants {@code action} on {@code resource} in {@code scope}. */
  public boolean permits(
      Set<String> roles, ResourceType resource, Action action, PermissionScope scope) {
    return roles.stream()
        .flatMap(role -> permissionsOf(role).stream())
        .anyMatch(p -> p.grants(resource, action, scope));
  }

  private static List<Permission> grant(
      String role, Set<ResourceType> resources, Set<Action> actions, PermissionScope scope) {
    var permissions = new ArrayList<Permission>();
    for (ResourceType resource : resources) {
      for (Action action : actions) {
        permissions.add(new Permission(role, resource, action, scope));
      }
    }
    return List.copyOf(permissions);
  }

  private static List<Permission> concat(List<Permission> first, List<Permission> second) {
    var merged = new ArrayList<Permission>(first);
    merged.addAll(second);
    return List.copyOf(merged);
  }
}
