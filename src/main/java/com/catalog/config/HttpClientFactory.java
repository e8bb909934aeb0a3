package com.catalog.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Creates the HTTP client used to fetch remote OpenAPI documents.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Creates a WebClient that retries HTTP 429 and 503 responses with exponential backoff,
     * starting at 500ms and doubling, for at most 3 attempts.
     *
     * @param maxInMemorySize The largest document body, in bytes, the client will buffer.
     * @return The configured client.
     */
    @Bean
    public WebClient webClient(@Value("${catalog.http.max-in-memory-size:16777216}") int maxInMemorySize) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnException(e -> e instanceof WebClientResponseException.ServiceUnavailable ||
                        e instanceof WebClientResponseException.TooManyRequests)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        Retry retry = registry.retry("catalog-document-fetch");

        return WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                // Throttling statuses must surface as errors for the retry operator to see them.
                .filter((request, next) -> next.exchange(request)
                        .flatMap(response -> isRetryable(response.statusCode().value())
                                ? response.createException().flatMap(Mono::error)
                                : Mono.just(response))
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    private static boolean isRetryable(int status) {
        return status == HttpStatus.SERVICE_UNAVAILABLE.value() || status == HttpStatus.TOO_MANY_REQUESTS.value();
    }
}
