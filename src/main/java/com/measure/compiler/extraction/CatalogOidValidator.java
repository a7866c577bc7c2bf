package com.measure.compiler.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Offline OID validation against a catalog of frequently used eCQM value sets.
 * Checks the dotted-decimal format, the issuing root, catalog membership and the extracted name.
 */
public class CatalogOidValidator implements OidValidator {
    private static final Logger logger = LoggerFactory.getLogger(CatalogOidValidator.class);

    public static final String DEFAULT_CATALOG_RESOURCE = "/oid/ecqm-oid-catalog.json";
    private static final Pattern OID_PATTERN = Pattern.compile("^[0-2](\\.(0|[1-9]\\d*))+$");
    private static final String FORMAT_SUGGESTION =
            "OID should be a sequence of numbers separated by dots (e.g., 2.16.840.1.113883.3.464.1003.101.12.1001)";
    private static final int DEFAULT_MAX_OID_PART_DIFFERENCES = 2;
    private static final int DEFAULT_SUGGESTION_LIMIT = 5;
    private static final double CONTAINMENT_MATCH_THRESHOLD = 0.7;
    private static final double SIMILARITY_MATCH_THRESHOLD = 0.8;
    private static final double SUGGESTION_THRESHOLD = 0.3;

    private static final Map<String, String> KNOWN_ROOTS = knownRoots();

    private final Map<String, CatalogMatch> catalog;

    /**
     * Create a validator over the bundled catalog
     */
    public CatalogOidValidator() {
        this(loadCatalog(DEFAULT_CATALOG_RESOURCE));
    }

    public CatalogOidValidator(List<CatalogMatch> entries) {
        this.catalog = new LinkedHashMap<>();
        for (CatalogMatch entry : entries) {
            catalog.put(entry.getOid(), entry);
        }
        logger.debug("OID catalog initialized with {} value sets", catalog.size());
    }

    @Override
    public OidValidationResult validate(String oid, String name) {
        List<OidIssue> errors = new ArrayList<>();
        List<OidIssue> warnings = new ArrayList<>();

        String formatError = checkFormat(oid);
        if (formatError != null) {
            errors.add(new OidIssue(OidIssueCode.MALFORMED_FORMAT, formatError, FORMAT_SUGGESTION));
            return new OidValidationResult(oid, null, errors, warnings);
        }
        String trimmed = oid.trim();

        if (rootOrganization(trimmed).isEmpty()) {
            warnings.add(new OidIssue(OidIssueCode.NOT_IN_CATALOG,
                    "OID root not recognized. May be valid but not in common eCQM catalog."));
        }

        CatalogMatch match = catalog.get(trimmed);
        if (match != null) {
            if (StringUtils.isNotBlank(name) && !matchesAnyName(name, match)) {
                String expected = match.getName() + (match.getAlternateNames().isEmpty()
                        ? ""
                        : " (or: " + String.join(", ", match.getAlternateNames()) + ")");
                errors.add(new OidIssue(OidIssueCode.NAME_MISMATCH,
                        "Extracted name \"" + name + "\" does not match catalog name \"" + match.getName() + "\"",
                        "Expected name similar to: " + expected));
            }
        } else {
            warnings.add(new OidIssue(OidIssueCode.NOT_IN_CATALOG,
                    "OID not found in common eCQM value set catalog. Verify it is correct."));
            List<CatalogMatch> similar = findSimilarOids(trimmed, DEFAULT_MAX_OID_PART_DIFFERENCES);
            if (!similar.isEmpty()) {
                warnings.add(new OidIssue(OidIssueCode.SIMILAR_OID_EXISTS, "Similar OIDs in catalog: "
                        + similar.stream().map(CatalogMatch::toString).collect(Collectors.joining(", "))));
            }
        }

        return new OidValidationResult(trimmed, match, errors, warnings);
    }

    /**
     * Check the dotted-decimal shape of an OID.
     * @param oid The candidate OID
     * @return A human-readable reason when malformed, otherwise null
     */
    public static String checkFormat(String oid) {
        if (StringUtils.isBlank(oid)) {
            return "OID is empty";
        }
        String trimmed = oid.trim();
        if (OID_PATTERN.matcher(trimmed).matches()) {
            return null;
        }
        if (trimmed.contains(" ")) {
            return "OID contains spaces";
        }
        if (trimmed.indexOf('O') >= 0 || trimmed.indexOf('o') >= 0) {
            return "OID contains letter O instead of zero";
        }
        if (trimmed.startsWith(".") || trimmed.endsWith(".")) {
            return "OID cannot start or end with a dot";
        }
        if (trimmed.contains("..")) {
            return "OID contains consecutive dots";
        }
        if (!Character.isDigit(trimmed.charAt(0))) {
            return "OID must start with a digit (0, 1, or 2)";
        }
        if (trimmed.charAt(0) > '2' && trimmed.matches("\\d+(\\.\\d+)*")) {
            return "OID first arc must be 0, 1, or 2";
        }
        return "Invalid OID format";
    }

    /**
     * Organization that issued the OID's root arc, longest known prefix first.
     */
    public static Optional<String> rootOrganization(String oid) {
        if (oid == null) {
            return Optional.empty();
        }
        return KNOWN_ROOTS.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .filter(root -> oid.equals(root) || oid.startsWith(root + "."))
                .findFirst()
                .map(KNOWN_ROOTS::get);
    }

    public Optional<CatalogMatch> lookup(String oid) {
        return Optional.ofNullable(oid == null ? null : catalog.get(oid.trim()));
    }

    public int size() {
        return catalog.size();
    }

    /**
     * Catalog entries whose OID has the same number of arcs and differs in at most
     * {@code maxDifferences} of them. Catches single-digit typos.
     */
    public List<CatalogMatch> findSimilarOids(String oid, int maxDifferences) {
        String[] parts = oid.split("\\.");
        List<CatalogMatch> similar = new ArrayList<>();
        for (CatalogMatch entry : catalog.values()) {
            String candidate = entry.getOid();
            if (candidate.equals(oid) || Math.abs(candidate.length() - oid.length()) > maxDifferences) {
                continue;
            }
            String[] candidateParts = candidate.split("\\.");
            if (candidateParts.length != parts.length) {
                continue;
            }
            int differences = 0;
            for (int i = 0; i < parts.length; i++) {
                if (!parts[i].equals(candidateParts[i])) {
                    differences++;
                }
            }
            if (differences <= maxDifferences) {
                similar.add(entry);
            }
        }
        return similar;
    }

    public List<CatalogMatch> suggestValueSets(String nameQuery) {
        return suggestValueSets(nameQuery, DEFAULT_SUGGESTION_LIMIT);
    }

    /**
     * Catalog entries ranked by name similarity to the query, best first.
     * @param nameQuery Free-text value-set name
     * @param limit Maximum number of suggestions
     * @return Entries scoring above the suggestion threshold
     */
    public List<CatalogMatch> suggestValueSets(String nameQuery, int limit) {
        if (StringUtils.isBlank(nameQuery)) {
            return List.of();
        }
        Map<CatalogMatch, Double> scores = new LinkedHashMap<>();
        for (CatalogMatch entry : catalog.values()) {
            double best = similarity(nameQuery, entry.getName());
            for (String alternate : entry.getAlternateNames()) {
                best = Math.max(best, similarity(nameQuery, alternate));
            }
            if (best > SUGGESTION_THRESHOLD) {
                scores.put(entry, best);
            }
        }
        return scores.entrySet().stream()
                .sorted(Map.Entry.<CatalogMatch, Double>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Fuzzy comparison of two value-set names after normalizing case and punctuation.
     */
    public static boolean namesMatch(String first, String second) {
        String a = normalizeName(first);
        String b = normalizeName(second);
        if (a.equals(b)) {
            return true;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.contains(b) || b.contains(a)) {
            double ratio = (double) Math.min(a.length(), b.length()) / Math.max(a.length(), b.length());
            return ratio > CONTAINMENT_MATCH_THRESHOLD;
        }
        return similarity(a, b) > SIMILARITY_MATCH_THRESHOLD;
    }

    /**
     * 1 minus the Levenshtein distance relative to the longer string, case-insensitive.
     */
    @SuppressWarnings("deprecation")
    static double similarity(String first, String second) {
        String a = first.toLowerCase(Locale.ROOT);
        String b = second.toLowerCase(Locale.ROOT);
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) {
            return 1.0;
        }
        int distance = StringUtils.getLevenshteinDistance(a, b);
        return (longer - distance) / (double) longer;
    }

    private static boolean matchesAnyName(String name, CatalogMatch match) {
        if (namesMatch(name, match.getName())) {
            return true;
        }
        return match.getAlternateNames().stream().anyMatch(alternate -> namesMatch(name, alternate));
    }

    private static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    static List<CatalogMatch> loadCatalog(String resource) {
        try (InputStream in = CatalogOidValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("OID catalog resource not found: " + resource);
            }
            JsonNode root = new ObjectMapper().readTree(in);
            List<CatalogMatch> entries = new ArrayList<>();
            for (JsonNode node : root.path("entries")) {
                List<String> alternates = new ArrayList<>();
                node.path("alternateNames").forEach(alt -> alternates.add(alt.asText()));
                entries.add(new CatalogMatch(
                        node.path("oid").asText(),
                        node.path("name").asText(),
                        alternates,
                        node.hasNonNull("steward") ? node.get("steward").asText() : null,
                        node.hasNonNull("purpose") ? node.get("purpose").asText() : null));
            }
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read OID catalog " + resource, e);
        }
    }

    private static Map<String, String> knownRoots() {
        Map<String, String> roots = new LinkedHashMap<>();
        roots.put("2.16.840.1.113883.3.464", "NCQA (HEDIS/eCQM)");
        roots.put("2.16.840.1.113883.3.526", "AMA-PCPI");
        roots.put("2.16.840.1.113883.3.117", "The Joint Commission");
        roots.put("2.16.840.1.113883.3.600", "CMS");
        roots.put("2.16.840.1.113883.6.96", "SNOMED CT");
        roots.put("2.16.840.1.113883.6.90", "ICD-10-CM");
        roots.put("2.16.840.1.113883.6.88", "RxNorm");
        roots.put("2.16.840.1.113883.6.1", "LOINC");
        roots.put("2.16.840.1.113883.6.12", "CPT");
        roots.put("2.16.840.1.113883.6.285", "HCPCS");
        roots.put("2.16.840.1.113883.12", "HL7 Code Systems");
        return roots;
    }
}
