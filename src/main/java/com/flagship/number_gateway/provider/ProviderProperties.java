package com.flagship.number_gateway.provider;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the number-provisioning provider.
 */
@Data
@Component
@ConfigurationProperties(prefix = "provider")
public class ProviderProperties {

    private String baseUrl;

    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);
}
