package io.fairway.platform.security;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryRoleAssignmentRepository implements RoleAssignmentRepository {

  private record Key(String userId, String tenantId) {}

  private final Map<Key, Map<String, RoleAssignment>> assignments = new ConcurrentHashMap<>();

  @Override
  public boolean assign(RoleAssignment assignment) {
    var roles =
        assignments.computeIfAbsent(
            new Key(assignment.userId(), assignment.tenantId()), k -> new ConcurrentHashMap<>());
    return roles.putIfAbsent(assignment.role(), assignment) == null;
  }

  @Override
  public boolean revoke(String userId, String tenantId, String role) {
    var roles = assignments.get(new Key(userId, tenantId));
    return roles != null && roles.remove(role) != null;
  }

  @Override
  public Set<String> findRoles(String userId, String tenantId) {
    var roles = assignments.get(new Key(userId, tenantId));
    return roles == null ? Set.of() : Set.copyOf(roles.keySet());
  }

  @Override
  public List<RoleAssignment> findByTenantId(String tenantId) {
    return assignments.entrySet().stream()
        .filter(e -> e.getKey().tenantId().equals(tenantId))
        .flatMap(e -> e.getValue().values().stream())
        .sorted(Comparator.comparing(RoleAssignment::userId).thenComparing(RoleAssignment::role))
        .collect(Collectors.toList());
  }
}
