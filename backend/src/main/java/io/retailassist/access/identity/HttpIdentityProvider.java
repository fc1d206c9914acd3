package io.retailassist.access.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.retailassist.access.exception.IdentityProviderException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Talks to the identity provider's backend user API ({@code GET/POST /v1/users}). Looks the
 * account up by email first and only creates it when missing; a creation rejected as a duplicate
 * (concurrent acceptance) is followed by a second lookup.
 */
@Component
@ConditionalOnProperty(name = "identity.provider.mode", havingValue = "http")
public class HttpIdentityProvider implements IdentityProvider {

  private static final Logger log = LoggerFactory.getLogger(HttpIdentityProvider.class);

  private final RestClient restClient;

  public HttpIdentityProvider(
      RestClient.Builder restClientBuilder, IdentityProviderProperties properties) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException("identity.provider.base-url is required in http mode");
    }
    this.restClient =
        restClientBuilder
            .baseUrl(properties.baseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.secretKey())
            .build();
  }

  @Override
  public String providerId() {
    return "http";
  }

  @Override
  public String ensureAccount(String email, String credential) {
    String normalized = User.normalizeEmail(email);
    try {
      String existing = findAccountId(normalized);
      if (existing != null) {
        return existing;
      }
      try {
        return createAccount(normalized, credential);
      } catch (HttpClientErrorException e) {
        if (e.getStatusCode() != HttpStatus.UNPROCESSABLE_ENTITY
            && e.getStatusCode() != HttpStatus.CONFLICT) {
          throw new IdentityProviderException("Identity provider rejected the account request", e);
        }
        String raced = findAccountId(normalized);
        if (raced == null) {
          throw new IdentityProviderException("Identity provider rejected the account request", e);
        }
        log.debug("Account for {} was created concurrently, using {}", normalized, raced);
        return raced;
      }
    } catch (RestClientException e) {
      throw new IdentityProviderException("Identity provider is unavailable", e);
    }
  }

  private String findAccountId(String email) {
    List<ProviderUser> users =
        restClient
            .get()
            .uri(uri -> uri.path("/v1/users").queryParam("email_address", email).build())
            .retrieve()
            .body(new ParameterizedTypeReference<List<ProviderUser>>() {});
    if (users == null || users.isEmpty()) {
      return null;
    }
    return users.get(0).id();
  }

  private String createAccount(String email, String credential) {
    ProviderUser created =
        restClient
            .post()
            .uri("/v1/users")
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("email_address", List.of(email), "password", credential))
            .retrieve()
            .body(ProviderUser.class);
    if (created == null || created.id() == null) {
      throw new IdentityProviderException("Identity provider returned no account id", null);
    }
    log.info("Created identity provider account {} for {}", created.id(), email);
    return created.id();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ProviderUser(@JsonProperty("id") String id) {}
}
