package io.retailassist.access.invite;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** @param ttl lifetime of a new invite */
@ConfigurationProperties(prefix = "access.invite")
public record InviteProperties(@DefaultValue("30d") Duration ttl) {}
