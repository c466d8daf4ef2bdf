package com.salesops.crmsync.model.dto;

/**
 * One diverging field: the value held remotely and the value held locally.
 */
public record FieldConflict(String field, Object remoteValue, Object localValue) {}
