package io.b2mash.b2b.isolation.config;

import io.b2mash.b2b.isolation.multitenancy.BrokerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BrokerProperties.class)
public class BrokerConfig {}
