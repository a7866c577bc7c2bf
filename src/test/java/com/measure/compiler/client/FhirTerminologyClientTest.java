package com.measure.compiler.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FhirTerminologyClient
 */
public class FhirTerminologyClientTest {

    private static final String OFFICE_VISIT_OID = "2.16.840.1.113883.3.464.1003.101.12.1001";

    @Test
    public void testFindValueSet_UnreachableServer() {
        FhirTerminologyClient client = new FhirTerminologyClient("http://localhost:1/fhir", null, new long[]{0, 0, 0});

        TerminologyServerException ex = assertThrows(TerminologyServerException.class,
                () -> client.findValueSet(OFFICE_VISIT_OID));

        assertEquals("Failed to read ValueSet " + OFFICE_VISIT_OID + " after 3 attempts", ex.getMessage());
        assertNotNull(ex.getCause());
    }

    @Test
    public void testGetServerUrl() {
        FhirTerminologyClient client = new FhirTerminologyClient("http://localhost:1/fhir", "secret");

        assertEquals("http://localhost:1/fhir", client.getServerUrl());
    }
}
