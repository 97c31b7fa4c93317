package io.fairway.platform.security;

import java.util.Optional;
import org.springframework.security.core.Authentication;

/**
 * Maps an authentication that the identity provider integration has already verified to the
 * internal identity. No protocol validation happens behind this interface.
 */
public interface IdentityAdapter {

  /** Returns empty when the authentication is not one this adapter understands. */
  Optional<ResolvedIdentity> resolve(Authentication authentication);
}
