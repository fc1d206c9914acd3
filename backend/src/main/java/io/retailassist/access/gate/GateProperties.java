package io.retailassist.access.gate;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param loginPath where unauthenticated callers and callers without a role are sent
 * @param sharedPaths routes every resolved role may reach without a workspace
 * @param retryAttempts extra resolution attempts after a transient failure
 * @param retryBackoff delay before the first retry, doubled for each further one
 */
@ConfigurationProperties(prefix = "access.gate")
public record GateProperties(
    @DefaultValue("/login") String loginPath,
    @DefaultValue({"/", "/invite", "/onboarding"}) List<String> sharedPaths,
    @DefaultValue("2") int retryAttempts,
    @DefaultValue("25ms") Duration retryBackoff) {}
