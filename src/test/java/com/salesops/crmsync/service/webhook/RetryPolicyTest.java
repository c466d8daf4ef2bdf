package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.exception.RemoteUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(new CrmSyncProperties());

    @Test
    @DisplayName("Should allow retries up to the configured maximum")
    void shouldLimitRetries() {
        assertThat(policy.canRetry(0)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    @DisplayName("Should double the delay for each retry")
    void shouldBackOffExponentially() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Should retry only transient failures")
    void shouldClassifyErrors() {
        assertThat(policy.isRetryable(new RemoteUnavailableException("down", null))).isTrue();
        assertThat(policy.isRetryable(new QueryTimeoutException("slow"))).isTrue();
        assertThat(policy.isRetryable(new PayloadValidationException("bad"))).isFalse();
        assertThat(policy.isRetryable(new IllegalStateException("bug"))).isFalse();
    }
}
