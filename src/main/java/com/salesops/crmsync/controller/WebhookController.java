package com.salesops.crmsync.controller;

import com.salesops.crmsync.exception.RateLimitExceededException;
import com.salesops.crmsync.model.dto.IngestionResult;
import com.salesops.crmsync.service.webhook.WebhookIngestionService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound CRM notifications. The raw body is handed on untouched so the signature can be checked
 * against the exact bytes that were signed.
 */
@Slf4j
@RestController
public class WebhookController {

    private final WebhookIngestionService ingestionService;
    private final RateLimiter rateLimiter;

    public WebhookController(WebhookIngestionService ingestionService,
                             @Qualifier("webhookIngressRateLimiter") RateLimiter rateLimiter) {
        this.ingestionService = ingestionService;
        this.rateLimiter = rateLimiter;
    }

    @PostMapping("${app.webhook.path:/webhooks/crm}")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = "${app.webhook.signature-header:X-CRM-Signature}", required = false) String signature) {
        if (!rateLimiter.acquirePermission()) {
            throw new RateLimitExceededException("Too many webhook deliveries",
                    rateLimiter.getRateLimiterConfig().getLimitRefreshPeriod());
        }
        IngestionResult result = ingestionService.ingest(body == null ? new byte[0] : body, signature);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", result.status().name().toLowerCase());
        response.put("eventId", result.eventId());
        if (result.duplicate()) {
            response.put("duplicate", true);
        }
        return ResponseEntity.ok(response);
    }
}
