package com.measure.compiler.extraction;

import com.measure.compiler.client.TerminologyServerException;
import com.measure.compiler.client.ValueSetLookup;
import com.measure.compiler.client.ValueSetSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs the local checks first and confirms OIDs that pass them against a terminology server.
 * An unreachable server only adds a warning.
 */
public class TerminologyServerOidValidator implements OidValidator {
    private static final Logger logger = LoggerFactory.getLogger(TerminologyServerOidValidator.class);

    private final OidValidator localValidator;
    private final ValueSetLookup lookup;

    public TerminologyServerOidValidator(ValueSetLookup lookup) {
        this(new CatalogOidValidator(), lookup);
    }

    public TerminologyServerOidValidator(OidValidator localValidator, ValueSetLookup lookup) {
        this.localValidator = localValidator;
        this.lookup = lookup;
    }

    @Override
    public OidValidationResult validate(String oid, String name) {
        OidValidationResult local = localValidator.validate(oid, name);
        if (!local.isValid()) {
            return local;
        }

        Optional<ValueSetSummary> published;
        try {
            published = lookup.findValueSet(local.getOid());
        } catch (TerminologyServerException e) {
            logger.warn("Terminology server unavailable for {}: {}", oid, e.getMessage());
            return local.withWarning(new OidIssue(OidIssueCode.TERMINOLOGY_UNAVAILABLE, e.getMessage()));
        }

        if (published.isEmpty()) {
            return local.withError(new OidIssue(OidIssueCode.TERMINOLOGY_NOT_FOUND,
                    "OID not found on terminology server",
                    "Verify the OID is correct or check if the value set has been retired"));
        }

        ValueSetSummary summary = published.get();
        List<String> alternates = local.getCatalogMatch().map(CatalogMatch::getAlternateNames).orElse(List.of());
        return local.withCatalogMatch(new CatalogMatch(summary.getOid(), summary.getName(), alternates,
                summary.getPublisher(), null));
    }
}
