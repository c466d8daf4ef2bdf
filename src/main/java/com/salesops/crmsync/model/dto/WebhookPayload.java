package com.salesops.crmsync.model.dto;

import com.salesops.crmsync.model.domain.ChangeOperation;

import java.time.Instant;
import java.util.Map;

/**
 * Parsed body of an inbound CRM webhook delivery.
 */
public record WebhookPayload(
        String module,
        ChangeOperation operation,
        String recordId,
        Map<String, Object> data,
        Instant timestamp
) {}
