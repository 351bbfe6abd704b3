package io.b2mash.b2b.isolation.multitenancy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param defaultSchema namespace every idle pooled connection must point at
 * @param queryTimeoutSeconds per-statement timeout for work done through tenant and registry
 *     handles; 0 disables it
 * @param cleanupTimeoutSeconds timeout for the reset and verification statements; a reset that
 *     times out counts as failed and the connection is destroyed
 */
@ConfigurationProperties("isolation.broker")
public record BrokerProperties(
    @DefaultValue("public") String defaultSchema,
    @DefaultValue("30") int queryTimeoutSeconds,
    @DefaultValue("5") int cleanupTimeoutSeconds) {}
