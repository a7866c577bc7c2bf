package com.measure.compiler.model;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A named, optionally OID-identified collection of codes.
 */
public final class ValueSetReference {
    public static final String VSAC_FHIR_BASE = "http://cts.nlm.nih.gov/fhir/ValueSet/";

    private final String id;
    private final String name;
    private final String oid;
    private final String url;
    private final List<CodeReference> codes;
    private final ConfidenceLevel confidence;

    public ValueSetReference(String id, String name, String oid, String url,
                             List<CodeReference> codes, ConfidenceLevel confidence) {
        this.id = id;
        this.name = name;
        this.oid = StringUtils.trimToNull(oid);
        this.url = StringUtils.trimToNull(url);
        this.codes = codes != null ? List.copyOf(codes) : List.of();
        this.confidence = confidence != null ? confidence : ConfidenceLevel.MEDIUM;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getOid() {
        return oid;
    }

    public String getUrl() {
        return url;
    }

    public List<CodeReference> getCodes() {
        return codes;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    /**
     * The explicit url, else the VSAC FHIR url derived from the OID, else null.
     */
    public String resolvedUrl() {
        if (url != null) {
            return url;
        }
        return oid != null ? VSAC_FHIR_BASE + oid : null;
    }

    /**
     * Deduplication key: the OID when present, else the lower-cased trimmed name.
     */
    public String dedupKey() {
        if (oid != null) {
            return oid;
        }
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public ValueSetReference withCodes(List<CodeReference> newCodes) {
        return new ValueSetReference(id, name, oid, url, newCodes, confidence);
    }

    public ValueSetReference withUrl(String newUrl) {
        return new ValueSetReference(id, name, oid, newUrl, codes, confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueSetReference that)) return false;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name)
                && Objects.equals(oid, that.oid) && Objects.equals(url, that.url)
                && codes.equals(that.codes) && confidence == that.confidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, oid, url, codes, confidence);
    }

    @Override
    public String toString() {
        return "ValueSet[" + name + (oid != null ? ", " + oid : "") + "]";
    }
}
