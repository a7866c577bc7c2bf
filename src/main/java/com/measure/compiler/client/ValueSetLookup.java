package com.measure.compiler.client;

import java.util.Optional;

/**
 * Resolves a value-set OID against an authoritative terminology source.
 */
public interface ValueSetLookup {

    /**
     * @param oid The value-set OID
     * @return The published value set, or empty when the source does not know the OID
     * @throws TerminologyServerException when the source cannot be reached
     */
    Optional<ValueSetSummary> findValueSet(String oid);
}
