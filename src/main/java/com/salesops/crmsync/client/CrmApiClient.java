package com.salesops.crmsync.client;

import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.WebhookSubscription;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw access to the external CRM. Allows swapping between mock and production implementations.
 * Implementations throw {@link com.salesops.crmsync.exception.PermanentException} for client
 * errors and {@link com.salesops.crmsync.exception.RetryableException} for server or I/O errors;
 * rate limiting, circuit breaking and retries are applied by the gateway in front of them.
 */
public interface CrmApiClient {

    /**
     * @param modifiedSince only records changed after this instant; {@code null} for all records
     */
    List<CrmRecord> fetchRecords(String module, Instant modifiedSince);

    Optional<CrmRecord> fetchRecord(String module, String recordId);

    /**
     * Creates a record. The returned record carries the id the CRM assigned, which may differ
     * from {@code record.id()}.
     */
    CrmRecord createRecord(CrmRecord record);

    CrmRecord updateRecord(String module, String recordId, Map<String, Object> fields);

    void registerWebhook(WebhookSubscription subscription);
}
