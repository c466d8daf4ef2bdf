package com.salesops.crmsync.model.domain;

import java.util.Locale;

public enum ChangeOperation {
    CREATE, UPDATE, DELETE;

    /**
     * Parses the lowercase wire value used by the CRM ({@code create|update|delete}).
     *
     * @return the operation, or {@code null} when the value is not recognised
     */
    public static ChangeOperation fromWire(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ChangeOperation.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
