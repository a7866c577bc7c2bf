package com.measure.compiler.extraction;

import java.util.List;
import java.util.Objects;

/**
 * A known value set: its OID, canonical name and the other names it is published under.
 */
public final class CatalogMatch {
    private final String oid;
    private final String name;
    private final List<String> alternateNames;
    private final String steward;
    private final String purpose;

    public CatalogMatch(String oid, String name, List<String> alternateNames, String steward, String purpose) {
        this.oid = Objects.requireNonNull(oid, "oid");
        this.name = name != null ? name : "";
        this.alternateNames = alternateNames != null ? List.copyOf(alternateNames) : List.of();
        this.steward = steward;
        this.purpose = purpose;
    }

    public String getOid() {
        return oid;
    }

    public String getName() {
        return name;
    }

    public List<String> getAlternateNames() {
        return alternateNames;
    }

    public String getSteward() {
        return steward;
    }

    public String getPurpose() {
        return purpose;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatalogMatch that)) return false;
        return oid.equals(that.oid) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(oid, name);
    }

    @Override
    public String toString() {
        return oid + " (" + name + ")";
    }
}
