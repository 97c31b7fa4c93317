package io.fairway.platform.security;

public enum Action {
  READ,
  WRITE
}
