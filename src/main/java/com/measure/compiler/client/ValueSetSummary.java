package com.measure.compiler.client;

import java.util.Objects;

/**
 * Identifying fields of a value set as published by a terminology server.
 */
public final class ValueSetSummary {
    private final String oid;
    private final String name;
    private final String publisher;
    private final String version;

    public ValueSetSummary(String oid, String name, String publisher, String version) {
        this.oid = Objects.requireNonNull(oid, "oid");
        this.name = name;
        this.publisher = publisher;
        this.version = version;
    }

    public String getOid() {
        return oid;
    }

    public String getName() {
        return name;
    }

    public String getPublisher() {
        return publisher;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "ValueSetSummary[" + oid + ", " + name + "]";
    }
}
