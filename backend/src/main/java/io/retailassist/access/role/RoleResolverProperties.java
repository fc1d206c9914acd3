package io.retailassist.access.role;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param timeout deadline for a single resolution; exceeding it is a resolution error
 * @param poolSize threads available for concurrent resolutions
 */
@ConfigurationProperties(prefix = "access.resolver")
public record RoleResolverProperties(
    @DefaultValue("150ms") Duration timeout, @DefaultValue("16") int poolSize) {}
