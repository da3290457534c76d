package com.bridge.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Creates the {@link WebClient} shared by every provider transport.
 */
@Configuration
@Slf4j
public class HttpClientFactory {

    /**
     * Creates the shared WebClient with a built-in retry.
     * <p>
     * Responses with HTTP 429 (Too Many Requests) or 503 (Service Unavailable) are turned into
     * errors and retried with exponential backoff, starting at {@code bridge.http.retry.initial-interval}
     * and doubling, for at most {@code bridge.http.retry.max-attempts} attempts. The last error is
     * passed on to the caller.
     *
     * @param properties The bound {@code bridge.*} settings.
     * @return the configured client; transports derive their own from it with {@link WebClient#mutate()}.
     */
    @Bean
    public WebClient webClient(BridgeProperties properties) {
        BridgeProperties.Http.Retry settings = properties.getHttp().getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.getInitialInterval(), 2))
                .retryOnException(e -> e instanceof WebClientResponseException.ServiceUnavailable
                        || e instanceof WebClientResponseException.TooManyRequests)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        Retry retry = registry.retry("capability-bridge-http");
        retry.getEventPublisher().onRetry(event -> log.info("Retrying provider request (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));

        return WebClient.builder()
                .filter((request, next) -> next.exchange(request)
                        .flatMap(HttpClientFactory::failOnTransientStatus)
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    private static Mono<ClientResponse> failOnTransientStatus(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value() || status == HttpStatus.SERVICE_UNAVAILABLE.value()) {
            return response.createException().flatMap(Mono::error);
        }
        return Mono.just(response);
    }
}
