package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.dto.WebhookPayload;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a delivery should be processed. An event passes when any configured filter
 * matches it; with no filters every event passes.
 */
@Component
public class WebhookFilter {

    private static final String ANY_OPERATION = "*";

    private final CrmSyncProperties properties;

    public WebhookFilter(CrmSyncProperties properties) {
        this.properties = properties;
    }

    public boolean accepts(WebhookPayload payload) {
        List<CrmSyncProperties.Filter> filters = properties.getWebhook().getFilters();
        if (filters.isEmpty()) {
            return true;
        }
        return filters.stream().anyMatch(filter -> matches(filter, payload));
    }

    private static boolean matches(CrmSyncProperties.Filter filter, WebhookPayload payload) {
        if (!Objects.equals(filter.getModule(), payload.module())) {
            return false;
        }
        String operation = filter.getOperation();
        if (operation != null && !ANY_OPERATION.equals(operation)
                && !operation.equalsIgnoreCase(payload.operation().wireValue())) {
            return false;
        }
        for (Map.Entry<String, String> condition : filter.getConditions().entrySet()) {
            Object actual = payload.data().get(condition.getKey());
            if (actual == null || !String.valueOf(actual).equals(condition.getValue())) {
                return false;
            }
        }
        return true;
    }
}
