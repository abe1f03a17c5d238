package io.eventasaurus.ticketing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ticketing.checkout")
public record CheckoutProperties(int maxQuantityPerOrder) {
}
