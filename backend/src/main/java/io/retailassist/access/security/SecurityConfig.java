package io.retailassist.access.security;

import io.retailassist.access.gate.RouteGateFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * One stateless chain. {@code /internal/**} is API-key authenticated, {@code /api/**} requires a
 * JWT, and page routes are handed to the {@link RouteGateFilter}, which redirects rather than
 * rejects. Role checks happen in the services, not in request matchers.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private static final String[] PAGE_ROUTES = {
    "/", "/invite/**", "/onboarding/**", "/admin/**", "/dashboard/**", "/employees/**"
  };

  private final SubjectJwtAuthenticationConverter jwtAuthConverter;
  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final PrincipalFilter principalFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final RouteGateFilter routeGateFilter;
  private final AuthFailureEntryPoint authFailureEntryPoint;
  private final Environment environment;

  public SecurityConfig(
      SubjectJwtAuthenticationConverter jwtAuthConverter,
      ApiKeyAuthFilter apiKeyAuthFilter,
      PrincipalFilter principalFilter,
      RequestLoggingFilter requestLoggingFilter,
      RouteGateFilter routeGateFilter,
      AuthFailureEntryPoint authFailureEntryPoint,
      Environment environment) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.principalFilter = principalFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.routeGateFilter = routeGateFilter;
    this.authFailureEntryPoint = authFailureEntryPoint;
    this.environment = environment;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .requestMatchers("/api/public/**")
                    .permitAll()
                    .requestMatchers(PAGE_ROUTES)
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .authenticated()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(authFailureEntryPoint))
        .addFilterBefore(apiKeyAuthFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(principalFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, PrincipalFilter.class)
        .addFilterAfter(routeGateFilter, RequestLoggingFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
