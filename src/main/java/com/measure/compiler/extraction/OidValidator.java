package com.measure.compiler.extraction;

/**
 * Checks a value-set OID extracted from a document, optionally against the name it was extracted with.
 */
public interface OidValidator {

    /**
     * @param oid The OID as extracted
     * @param name The extracted value-set name, or null
     * @return The validation outcome; never null
     */
    OidValidationResult validate(String oid, String name);
}
