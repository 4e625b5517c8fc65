package com.example.accountscheduler.client;

import com.example.accountscheduler.client.ClientModels.AutomationRequest;
import com.example.accountscheduler.client.ClientModels.AutomationResponse;
import com.example.accountscheduler.config.AutomationServiceProperties;
import com.example.accountscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the automation service that drives the actual platform sessions.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - WebClient for HTTP calls
 * <p>
 * No client-side retry: retries are scheduled by the job queue with backoff.
 */
@Slf4j
@Component
public class AutomationServiceClient {

    static final String SERVICE_NAME = "Automation Service";

    private final WebClient webClient;
    private final AutomationServiceProperties properties;

    public AutomationServiceClient(@Qualifier("automationServiceWebClient") WebClient webClient,
                                   AutomationServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Publish one piece of content through one account
     *
     * @throws ExternalServiceException if the call fails or returns an error status
     */
    @CircuitBreaker(name = "automationService", fallbackMethod = "publishFallback")
    public AutomationResponse publish(AutomationRequest request) {
        log.info("Calling Automation Service for job {} ({} / {})", request.getJobId(), request.getPlatform(), request.getAccountId());

        try {
            return webClient.post()
                    .uri("/api/v1/automation/{platform}/posts", request.getPlatform())
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(new ExternalServiceException(
                                            SERVICE_NAME,
                                            response.statusCode().value(),
                                            body,
                                            parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER))))))
                    .bodyToMono(AutomationResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Automation Service call failed for job {}: {}", request.getJobId(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e.getMessage(), e);
        }
    }

    /**
     * Fallback when the circuit breaker is open or the call failed
     */
    @SuppressWarnings("unused")
    private AutomationResponse publishFallback(AutomationRequest request, Exception e) {
        if (e instanceof ExternalServiceException externalServiceException) {
            throw externalServiceException;
        }
        log.warn("Circuit breaker open for Automation Service, job: {}, error: {}", request.getJobId(), e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    /**
     * Retry-After in delta-seconds form; HTTP-date values are ignored
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            var seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", header);
            return null;
        }
    }
}
