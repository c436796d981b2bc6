package org.neurosync.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Resilience settings of the HTTP layer, read from the {@code neurosync.http} section.
 *
 * @param maxGatewayRetries maximum number of retries after a 504 before giving up
 * @param gatewayRetryDelay pause before each 504 retry
 * @param connectTimeout    TCP connect timeout of the transport
 */
public record HttpSettings(int maxGatewayRetries, Duration gatewayRetryDelay, Duration connectTimeout) {

    public static final HttpSettings DEFAULTS = new HttpSettings(10, Duration.ofMillis(200), Duration.ofSeconds(10));

    public HttpSettings {
        if (maxGatewayRetries < 0) {
            throw new IllegalArgumentException("maxGatewayRetries must not be negative");
        }
    }

    /**
     * @param config the {@code neurosync.http} section, missing keys fall back to {@link #DEFAULTS}
     */
    public static HttpSettings fromConfig(Config config) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "max-gateway-retries", DEFAULTS.maxGatewayRetries(),
            "gateway-retry-delay", DEFAULTS.gatewayRetryDelay().toMillis() + "ms",
            "connect-timeout", DEFAULTS.connectTimeout().toSeconds() + "s"
        ));
        Config merged = config.withFallback(defaults);
        return new HttpSettings(
            merged.getInt("max-gateway-retries"),
            merged.getDuration("gateway-retry-delay"),
            merged.getDuration("connect-timeout"));
    }
}
