package com.salesops.crmsync.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesops.crmsync.cache.DistributedCache;
import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.dto.WebhookSubscription;
import com.salesops.crmsync.service.gateway.CrmGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Subscribes the service to CRM change notifications for each configured module once the
 * application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookRegistrar {

    static final String REGISTRATION_PREFIX = "webhook:registration:";
    private static final List<String> OPERATIONS = List.of("create", "update", "delete");

    private final CrmGateway gateway;
    private final DistributedCache cache;
    private final ObjectMapper objectMapper;
    private final CrmSyncProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void registerAll() {
        CrmSyncProperties.Webhook webhook = properties.getWebhook();
        if (!webhook.getRegistration().isEnabled()) {
            log.info("Webhook registration is disabled");
            return;
        }
        String notifyUrl = webhook.getBaseUrl() + webhook.getPath();
        int registered = 0;
        for (String module : properties.getSync().getModules()) {
            WebhookSubscription subscription = new WebhookSubscription(notifyUrl, module, OPERATIONS, webhook.getSecret());
            try {
                gateway.registerWebhook(subscription);
                cache.put(REGISTRATION_PREFIX + module, toJson(subscription), null);
                registered++;
            } catch (JsonProcessingException | RuntimeException e) {
                log.error("Failed to register webhook for {}", module, e);
            }
        }
        log.info("Registered webhooks for {}/{} modules", registered, properties.getSync().getModules().size());
    }

    private String toJson(WebhookSubscription subscription) throws JsonProcessingException {
        // the shared secret is not kept in the cache
        return objectMapper.writeValueAsString(
                new WebhookSubscription(subscription.notifyUrl(), subscription.module(), subscription.operations(), null));
    }
}
