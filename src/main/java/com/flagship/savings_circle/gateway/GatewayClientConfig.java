package com.flagship.savings_circle.gateway;

import com.flagship.savings_circle.config.GatewayProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client and retry policy for gateway verification calls.
 */
@Configuration
@Slf4j
public class GatewayClientConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        return builder
            .rootUri(properties.getBaseUrl())
            .setConnectTimeout(properties.getConnectTimeout())
            .setReadTimeout(properties.getReadTimeout())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getSecretKey())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    /**
     * Exponential backoff over unreachable and not-yet-visible transactions.
     * Anything else fails on the first attempt.
     */
    @Bean
    public Retry gatewayRetry(GatewayProperties properties) {
        GatewayProperties.Retry settings = properties.getRetry();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(settings.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                settings.getInitialBackoff(), settings.getMultiplier()))
            .retryExceptions(GatewayUnreachableException.class, TransactionNotFoundException.class)
            .build();

        Retry retry = Retry.of("paymentGateway", config);
        retry.getEventPublisher().onRetry(event -> log.warn(
            "Gateway call attempt {} failed, retrying: {}",
            event.getNumberOfRetryAttempts(),
            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
