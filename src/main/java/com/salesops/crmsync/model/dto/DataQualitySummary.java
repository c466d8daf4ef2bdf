package com.salesops.crmsync.model.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Result of validating a sample of a module's local records.
 *
 * @param errorsByField number of violations per field name
 */
public record DataQualitySummary(
        String module,
        int checked,
        int valid,
        int invalid,
        Map<String, Integer> errorsByField,
        Instant checkedAt
) {

    public double validRatio() {
        return checked == 0 ? 1.0 : (double) valid / checked;
    }
}
