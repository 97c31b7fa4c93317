package io.fairway.platform.security;

import java.util.List;
import java.util.Set;

public interface RoleAssignmentRepository {

  /** Returns false when the assignment already exists. */
  boolean assign(RoleAssignment assignment);

  boolean revoke(String userId, String tenantId, String role);

  Set<String> findRoles(String userId, String tenantId);

  List<RoleAssignment> findByTenantId(String tenantId);
}
