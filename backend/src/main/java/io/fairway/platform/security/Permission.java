package io.fairway.platform.security;

/** A role may perform {@code action} on {@code resource} within {@code scope}. */
public record Permission(String role, ResourceType resource, Action action, PermissionScope scope) {

  public boolean grants(ResourceType resource, Action action, PermissionScope scope) {
    return this.resource == resource && this.action == action && this.scope == scope;
  }
}
