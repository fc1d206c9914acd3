package io.retailassist.access.identity;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param mode {@code local} (deterministic ids, no remote calls) or {@code http}
 * @param baseUrl base URL of the provider's backend API, used in {@code http} mode
 * @param secretKey bearer secret for the provider's backend API
 */
@ConfigurationProperties(prefix = "identity.provider")
public record IdentityProviderProperties(
    @DefaultValue("local") String mode, String baseUrl, String secretKey) {}
