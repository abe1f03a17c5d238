package io.eventasaurus.ticketing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ticketing.auth")
public record AuthProperties(String jwtSecret) {
}
