package com.docverify.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.HttpClient;

/**
 * Shared HTTP client configuration for everything that talks to the deployment under test
 * (fixture seeding and api assertions).
 */
@Configuration
public class HttpClientFactory {

    @Value("${docverify.http.timeout-seconds:30}")
    private long timeoutSeconds;

    /**
     * A WebClient that retries transport failures (refused or reset connections) up to 3 attempts with
     * exponential backoff starting at 500ms. Responses are never retried, whatever their status: api assertions
     * judge 4xx and 5xx answers, including documented 429s and 503s.
     *
     * @return The configured client.
     */
    @Bean
    public WebClient webClient() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnException(e -> e instanceof WebClientRequestException)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        Retry retry = registry.retry("doc-verify-http");

        HttpClient httpClient = HttpClient.create().responseTimeout(Duration.ofSeconds(timeoutSeconds));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .filter((request, next) -> next.exchange(request)
                        .transform(RetryOperator.of(retry)))
                .build();
    }
}
