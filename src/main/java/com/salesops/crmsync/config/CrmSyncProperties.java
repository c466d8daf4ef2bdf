package com.salesops.crmsync.config;

import com.salesops.crmsync.model.domain.ConflictPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All tunables of the sync service, bound from the {@code app.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app")
public class CrmSyncProperties {

    private Sync sync = new Sync();
    private Webhook webhook = new Webhook();
    private Remote remote = new Remote();
    private Backup backup = new Backup();
    private Kafka kafka = new Kafka();
    private Events events = new Events();
    private Workers workers = new Workers();
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Sync {
        private List<String> modules = new ArrayList<>(List.of("Accounts", "Contacts", "Leads", "Deals"));
        private Duration lockTtl = Duration.ofMinutes(30);
        private String fullCron = "0 0 2 * * *";
        private String incrementalCron = "0 */15 * * * *";
        private boolean schedulesEnabled = true;
        private ConflictPolicy defaultPolicy = ConflictPolicy.MERGE;
        /** Per-module overrides of {@link #defaultPolicy}. */
        private Map<String, ConflictPolicy> policies = new LinkedHashMap<>();
        private boolean bidirectionalPush = true;
        private int pageSize = 200;
        private Validation validation = new Validation();

        public ConflictPolicy policyFor(String module) {
            return policies.getOrDefault(module, defaultPolicy);
        }
    }

    @Getter
    @Setter
    public static class Validation {
        private int sampleSize = 100;
        /** Module name to the rules its records must satisfy. */
        private Map<String, List<ValidationRule>> rules = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class ValidationRule {
        private String field;
        private boolean required;
        /** One of string, number, boolean, date, email, phone. */
        private String type;
        private Integer minLength;
        private Integer maxLength;
        private Double min;
        private Double max;
        private String pattern;
    }

    @Getter
    @Setter
    public static class Webhook {
        private String path = "/webhooks/crm";
        private String signatureHeader = "X-CRM-Signature";
        private String secret;
        /** Public base URL the CRM calls back on; joined with {@link #path} for registrations. */
        private String baseUrl = "http://localhost:8080";
        private List<Filter> filters = new ArrayList<>();
        private Batching batching = new Batching();
        private Retry retry = new Retry();
        private Duration eventRetention = Duration.ofHours(24);
        private String housekeepingCron = "0 0 * * * *";
        private Registration registration = new Registration();
        private RateLimit rateLimit = new RateLimit(100, Duration.ofSeconds(1), Duration.ZERO);
    }

    @Getter
    @Setter
    public static class Filter {
        private String module;
        /** create, update, delete or {@code *}. */
        private String operation = "*";
        /** Field to required value, compared as strings. */
        private Map<String, String> conditions = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Batching {
        private boolean enabled = true;
        private int maxSize = 50;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Registration {
        private boolean enabled;
    }

    @Getter
    @Setter
    public static class Remote {
        private String baseUrl = "https://www.zohoapis.com/crm/v2";
        private String tokenUrl = "https://accounts.zoho.com/oauth/v2/token";
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private RateLimit rateLimit = new RateLimit(100, Duration.ofMinutes(1), Duration.ofSeconds(5));
        private CircuitBreaker circuitBreaker = new CircuitBreaker();
        private RemoteRetry retry = new RemoteRetry();
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int limitForPeriod;
        private Duration limitRefreshPeriod;
        private Duration timeout;

        public RateLimit() {
        }

        public RateLimit(int limitForPeriod, Duration limitRefreshPeriod, Duration timeout) {
            this.limitForPeriod = limitForPeriod;
            this.limitRefreshPeriod = limitRefreshPeriod;
            this.timeout = timeout;
        }
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        private float failureRateThreshold = 50;
        private int slidingWindowSize = 10;
        private int minimumNumberOfCalls = 5;
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);
        private int permittedCallsInHalfOpenState = 3;
    }

    @Getter
    @Setter
    public static class RemoteRetry {
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofMillis(500);
        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Backup {
        private String storagePath = "./backups";
        private boolean compression = true;
        private boolean verifyIntegrity = true;
        private boolean incremental = true;
        private String cron = "0 30 3 * * *";
        private boolean scheduleEnabled = true;
        private Retention retention = new Retention();
    }

    @Getter
    @Setter
    public static class Retention {
        private int daily = 7;
        private int weekly = 30;
        private int monthly = 365;
    }

    @Getter
    @Setter
    public static class Kafka {
        private boolean enabled;
        private String lifecycleTopic = "crm-sync.lifecycle";
        private String deadLetterTopic = "crm-sync.change-events.DLT";
    }

    @Getter
    @Setter
    public static class Events {
        private int queueCapacity = 1000;
    }

    @Getter
    @Setter
    public static class Workers {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
        private int schedulerPoolSize = 4;
    }

    @Getter
    @Setter
    public static class Cache {
        /** {@code redis} or {@code memory} */
        private String type = "redis";
        private String keyPrefix = "crm-sync:";
    }
}
