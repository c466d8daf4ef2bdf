package com.salesops.crmsync.config;

import com.salesops.crmsync.exception.PermanentException;
import com.salesops.crmsync.exception.RetryableException;
import com.salesops.crmsync.service.events.LifecycleEvent;
import com.salesops.crmsync.service.events.LifecycleEventDispatcher;
import com.salesops.crmsync.service.events.LifecycleEventType;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Named resilience4j instances. {@code crmApi} guards every outbound CRM call,
 * {@code webhookIngress} throttles inbound deliveries.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String CRM_API = "crmApi";
    public static final String WEBHOOK_INGRESS = "webhookIngress";

    @Bean
    public RateLimiter crmApiRateLimiter(RateLimiterRegistry registry, CrmSyncProperties properties) {
        return rateLimiter(registry, CRM_API, properties.getRemote().getRateLimit());
    }

    @Bean
    public RateLimiter webhookIngressRateLimiter(RateLimiterRegistry registry, CrmSyncProperties properties) {
        return rateLimiter(registry, WEBHOOK_INGRESS, properties.getWebhook().getRateLimit());
    }

    @Bean
    public CircuitBreaker crmApiCircuitBreaker(CircuitBreakerRegistry registry,
                                               CrmSyncProperties properties,
                                               LifecycleEventDispatcher dispatcher) {
        CrmSyncProperties.CircuitBreaker settings = properties.getRemote().getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getSlidingWindowSize())
                .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
                .failureRateThreshold(settings.getFailureRateThreshold())
                .waitDurationInOpenState(settings.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(settings.getPermittedCallsInHalfOpenState())
                .ignoreExceptions(PermanentException.class)
                .build();
        CircuitBreaker circuitBreaker = registry.circuitBreaker(CRM_API, config);
        circuitBreaker.getEventPublisher().onStateTransition(event -> {
            log.warn("Circuit breaker '{}' transitioned {}", event.getCircuitBreakerName(), event.getStateTransition());
            dispatcher.publish(LifecycleEvent.of(LifecycleEventType.CIRCUIT_STATE_CHANGED, event.getCircuitBreakerName(), null,
                    Map.of("from", event.getStateTransition().getFromState().name(),
                            "to", event.getStateTransition().getToState().name())));
        });
        return circuitBreaker;
    }

    @Bean
    public Retry crmApiRetry(RetryRegistry registry, CrmSyncProperties properties) {
        CrmSyncProperties.RemoteRetry settings = properties.getRemote().getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.getInitialInterval(), settings.getMultiplier()))
                .retryOnException(RetryableException.class::isInstance)
                .build();
        Retry retry = registry.retry(CRM_API, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying CRM call, attempt {} after {}: {}", event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(), event.getLastThrowable().getMessage()));
        return retry;
    }

    private RateLimiter rateLimiter(RateLimiterRegistry registry, String name, CrmSyncProperties.RateLimit settings) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(settings.getLimitForPeriod())
                .limitRefreshPeriod(settings.getLimitRefreshPeriod())
                .timeoutDuration(settings.getTimeout())
                .build();
        log.info("Rate limiter '{}': {} calls per {}", name, settings.getLimitForPeriod(), settings.getLimitRefreshPeriod());
        return registry.rateLimiter(name, config);
    }
}
