package io.retailassist.access.identity;

/**
 * Port to the external authentication provider that owns credentials. Selected system-wide via
 * {@code identity.provider.mode}.
 */
public interface IdentityProvider {

  /** Provider identifier (e.g. "http", "local"). */
  String providerId();

  /**
   * Returns the provider subject id for the account with this email, creating the account with the
   * given credential when none exists. Idempotent: calling it again after a crash between account
   * creation and user linkage returns the same subject id.
   */
  String ensureAccount(String email, String credential);
}
