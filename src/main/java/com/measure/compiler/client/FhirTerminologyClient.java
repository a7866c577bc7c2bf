package com.measure.compiler.client;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.rest.client.api.IGenericClient;
import ca.uhn.fhir.rest.client.api.ServerValidationModeEnum;
import ca.uhn.fhir.rest.client.exceptions.FhirClientConnectionException;
import ca.uhn.fhir.rest.client.interceptor.BasicAuthInterceptor;
import ca.uhn.fhir.rest.server.exceptions.ResourceGoneException;
import ca.uhn.fhir.rest.server.exceptions.ResourceNotFoundException;
import org.hl7.fhir.r4.model.ValueSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * FhirTerminologyClient reads value sets from a FHIR R4 terminology server such as the VSAC FHIR endpoint,
 * where the value-set OID is the resource id.
 */
public class FhirTerminologyClient implements ValueSetLookup {
    private static final Logger logger = LoggerFactory.getLogger(FhirTerminologyClient.class);
    private static final String DEFAULT_TERMINOLOGY_SERVER_URL = "https://cts.nlm.nih.gov/fhir";
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final long[] DEFAULT_RETRY_DELAYS_MS = {1000, 2000, 4000}; // 1s, 2s, 4s

    private final IGenericClient client;
    private final String serverUrl;
    private final long[] retryDelaysMs;

    /**
     * Create a client for the public VSAC FHIR endpoint without credentials
     */
    public FhirTerminologyClient() {
        this(DEFAULT_TERMINOLOGY_SERVER_URL, null);
    }

    /**
     * Create a client for a custom terminology server
     * @param serverUrl The FHIR server base URL
     * @param apiKey VSAC-style API key sent as basic auth, or null for anonymous access
     */
    public FhirTerminologyClient(String serverUrl, String apiKey) {
        this(serverUrl, apiKey, DEFAULT_RETRY_DELAYS_MS);
    }

    FhirTerminologyClient(String serverUrl, String apiKey, long[] retryDelaysMs) {
        this.serverUrl = serverUrl;
        this.retryDelaysMs = retryDelaysMs.clone();

        FhirContext ctx = FhirContext.forR4();
        // Terminology servers often restrict /metadata; skip the conformance check
        ctx.getRestfulClientFactory().setServerValidationMode(ServerValidationModeEnum.NEVER);
        this.client = ctx.newRestfulGenericClient(serverUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            client.registerInterceptor(new BasicAuthInterceptor("apikey", apiKey));
        }

        logger.info("FhirTerminologyClient initialized with server URL: {}", serverUrl);
    }

    /**
     * Read ValueSet/{oid}
     * @param oid The value-set OID
     * @return The value set summary, or empty when the server does not have it
     */
    @Override
    public Optional<ValueSetSummary> findValueSet(String oid) {
        logger.debug("Looking up value set {}", oid);
        ValueSet valueSet = executeWithRetry(() -> client.read()
                .resource(ValueSet.class)
                .withId(oid)
                .execute(), "read ValueSet " + oid);

        if (valueSet == null) {
            return Optional.empty();
        }
        String name = valueSet.hasTitle() ? valueSet.getTitle() : valueSet.getName();
        return Optional.of(new ValueSetSummary(oid, name, valueSet.getPublisher(), valueSet.getVersion()));
    }

    /**
     * Execute a FHIR API call with retry logic and exponential backoff
     * @param operation The operation to execute
     * @param operationDescription Description of the operation for logging
     * @param <T> The return type
     * @return The result of the operation, or null if the resource does not exist
     * @throws TerminologyServerException if all attempts fail
     */
    private <T> T executeWithRetry(Supplier<T> operation, String operationDescription) {
        Exception lastException = null;

        for (int attempt = 0; attempt < MAX_RETRY_ATTEMPTS; attempt++) {
            try {
                return operation.get();
            } catch (ResourceNotFoundException | ResourceGoneException e) {
                // Unknown OID - don't retry
                logger.info("Resource not found while attempting to {}: {}", operationDescription, e.getMessage());
                return null;
            } catch (FhirClientConnectionException e) {
                lastException = e;
                logger.warn("Connection error on attempt {} while attempting to {}: {}",
                        attempt + 1, operationDescription, e.getMessage());
            } catch (Exception e) {
                lastException = e;
                logger.warn("Error on attempt {} while attempting to {}: {}",
                        attempt + 1, operationDescription, e.getMessage());
            }

            if (attempt < MAX_RETRY_ATTEMPTS - 1) {
                long delay = retryDelaysMs[Math.min(attempt, retryDelaysMs.length - 1)];
                logger.info("Retrying in {} ms...", delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TerminologyServerException("Retry interrupted for operation: " + operationDescription, ie);
                }
            }
        }

        logger.error("Failed to {} after {} attempts. Last error: {}",
                operationDescription, MAX_RETRY_ATTEMPTS, lastException.getMessage());
        throw new TerminologyServerException(
                "Failed to " + operationDescription + " after " + MAX_RETRY_ATTEMPTS + " attempts", lastException);
    }

    /**
     * Get the configured server URL
     * @return The terminology server URL
     */
    public String getServerUrl() {
        return serverUrl;
    }
}
