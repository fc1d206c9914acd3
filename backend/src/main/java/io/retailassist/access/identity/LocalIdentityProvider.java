package io.retailassist.access.identity;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Identity provider for local development and tests. An email that already belongs to a linked
 * user keeps that user's subject; otherwise a stable subject is derived from the email.
 * Credentials are not stored.
 */
@Component
@ConditionalOnProperty(name = "identity.provider.mode", havingValue = "local", matchIfMissing = true)
public class LocalIdentityProvider implements IdentityProvider {

  private static final Logger log = LoggerFactory.getLogger(LocalIdentityProvider.class);

  private final UserRepository userRepository;

  public LocalIdentityProvider(UserRepository userRepository) {
    this.userRepository = userRepository;
  }

  @Override
  public String providerId() {
    return "local";
  }

  @Override
  public String ensureAccount(String email, String credential) {
    String normalized = User.normalizeEmail(email);
    String subject =
        userRepository
            .findByEmail(normalized)
            .map(User::getExternalAuthId)
            .orElseGet(
                () ->
                    "local_"
                        + UUID.nameUUIDFromBytes(normalized.getBytes(StandardCharsets.UTF_8)));
    log.info("Local identity provider: account {} for {}", subject, normalized);
    return subject;
  }
}
