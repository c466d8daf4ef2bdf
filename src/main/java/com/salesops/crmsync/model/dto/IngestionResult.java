package com.salesops.crmsync.model.dto;

public record IngestionResult(Status status, String eventId, boolean duplicate) {

    public enum Status { RECEIVED, FILTERED }

    public static IngestionResult received(String eventId) {
        return new IngestionResult(Status.RECEIVED, eventId, false);
    }

    public static IngestionResult filtered(String eventId) {
        return new IngestionResult(Status.FILTERED, eventId, false);
    }

    public static IngestionResult duplicateOf(String eventId, Status status) {
        return new IngestionResult(status, eventId, true);
    }
}
