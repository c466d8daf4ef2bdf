package com.salesops.crmsync.model.domain;

public enum ResolverType {
    AUTOMATIC, MANUAL
}
