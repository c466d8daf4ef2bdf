package com.salesops.crmsync.model.dto;

import java.util.List;

/**
 * Notification channel registered with the CRM for one module.
 */
public record WebhookSubscription(String notifyUrl, String module, List<String> operations, String token) {}
