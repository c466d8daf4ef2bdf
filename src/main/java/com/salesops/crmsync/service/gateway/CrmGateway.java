package com.salesops.crmsync.service.gateway;

import com.salesops.crmsync.client.CrmApiClient;
import com.salesops.crmsync.exception.CircuitOpenException;
import com.salesops.crmsync.exception.RateLimitExceededException;
import com.salesops.crmsync.exception.RemoteUnavailableException;
import com.salesops.crmsync.exception.RetryableException;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.WebhookSubscription;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The only path to the CRM. Every call is retried on transient failure, rate limited and
 * guarded by the circuit breaker, in that order from the outside in.
 */
@Slf4j
@Service
public class CrmGateway {

    private final CrmApiClient client;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    public CrmGateway(CrmApiClient client,
                      @Qualifier("crmApiRateLimiter") RateLimiter rateLimiter,
                      @Qualifier("crmApiCircuitBreaker") CircuitBreaker circuitBreaker,
                      @Qualifier("crmApiRetry") Retry retry) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
    }

    public List<CrmRecord> fetchRecords(String module, Instant modifiedSince) {
        return execute("fetchRecords " + module, () -> client.fetchRecords(module, modifiedSince));
    }

    public Optional<CrmRecord> fetchRecord(String module, String recordId) {
        return execute("fetchRecord " + module + "/" + recordId, () -> client.fetchRecord(module, recordId));
    }

    public CrmRecord createRecord(CrmRecord record) {
        return execute("createRecord " + record.module() + "/" + record.id(), () -> client.createRecord(record));
    }

    public CrmRecord updateRecord(String module, String recordId, Map<String, Object> fields) {
        return execute("updateRecord " + module + "/" + recordId, () -> client.updateRecord(module, recordId, fields));
    }

    public void registerWebhook(WebhookSubscription subscription) {
        execute("registerWebhook " + subscription.module(), () -> {
            client.registerWebhook(subscription);
            return null;
        });
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    public boolean isCircuitOpen() {
        CircuitBreaker.State state = circuitBreaker.getState();
        return state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN;
    }

    public CircuitBreaker.Metrics circuitMetrics() {
        return circuitBreaker.getMetrics();
    }

    private <T> T execute(String operation, Supplier<T> call) {
        Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, call);
        Supplier<T> limited = RateLimiter.decorateSupplier(rateLimiter, guarded);
        Supplier<T> retried = Retry.decorateSupplier(retry, limited);
        try {
            return retried.get();
        } catch (RequestNotPermitted e) {
            log.warn("CRM rate limit reached for {}", operation);
            throw new RateLimitExceededException("CRM rate limit reached for " + operation,
                    rateLimiter.getRateLimiterConfig().getLimitRefreshPeriod());
        } catch (CallNotPermittedException e) {
            log.warn("Circuit '{}' is open, rejecting {}", circuitBreaker.getName(), operation);
            throw new CircuitOpenException("CRM circuit is open, rejected " + operation, e);
        } catch (RetryableException e) {
            log.error("CRM call {} failed after retries: {}", operation, e.getMessage());
            throw new RemoteUnavailableException("CRM unavailable for " + operation, e);
        }
    }
}
