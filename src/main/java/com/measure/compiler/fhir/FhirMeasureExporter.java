package com.measure.compiler.fhir;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.parser.IParser;
import com.measure.compiler.generator.GenerationResult;
import com.measure.compiler.model.CodeReference;
import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.MeasurementPeriod;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import org.apache.commons.lang3.StringUtils;
import org.hl7.fhir.r4.model.Attachment;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Enumerations;
import org.hl7.fhir.r4.model.Expression;
import org.hl7.fhir.r4.model.Library;
import org.hl7.fhir.r4.model.Measure;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.ValueSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Packages a measure and its generated CQL as a FHIR R4 collection Bundle: one Measure, one Library
 * carrying the CQL, and one ValueSet per value set.
 */
public class FhirMeasureExporter {
    private static final Logger logger = LoggerFactory.getLogger(FhirMeasureExporter.class);

    private static final String DEFAULT_CANONICAL_BASE = "http://measure-compiler.local/fhir";
    private static final String MEASURE_POPULATION_SYSTEM = "http://terminology.hl7.org/CodeSystem/measure-population";
    private static final String MEASURE_SCORING_SYSTEM = "http://terminology.hl7.org/CodeSystem/measure-scoring";
    private static final String LIBRARY_TYPE_SYSTEM = "http://terminology.hl7.org/CodeSystem/library-type";
    private static final String CQL_IDENTIFIER_LANGUAGE = "text/cql-identifier";
    private static final String CQL_CONTENT_TYPE = "text/cql";
    private static final Pattern LIBRARY_HEADER = Pattern.compile("(?m)^library\\s+(\\S+)\\s+version\\s+'([^']*)'");
    private static final Set<PopulationType> ALWAYS_DEFINED =
            EnumSet.of(PopulationType.INITIAL_POPULATION, PopulationType.DENOMINATOR, PopulationType.NUMERATOR);

    private final FhirContext fhirContext;
    private final String canonicalBase;

    public FhirMeasureExporter() {
        this(FhirContext.forR4(), DEFAULT_CANONICAL_BASE);
    }

    /**
     * @param fhirContext An R4 context; contexts are expensive, so share one where possible
     * @param canonicalBase Base for the canonical urls of the exported Measure and Library
     */
    public FhirMeasureExporter(FhirContext fhirContext, String canonicalBase) {
        this.fhirContext = fhirContext;
        this.canonicalBase = StringUtils.removeEnd(canonicalBase, "/");
    }

    /**
     * Build the bundle.
     * @param measure The measure
     * @param cql A successful CQL generation result for the same measure
     * @return A collection bundle
     * @throws IllegalArgumentException when the CQL generation failed
     */
    public Bundle toBundle(UniversalMeasureSpec measure, GenerationResult cql) {
        if (cql == null || !cql.isSuccess()) {
            throw new IllegalArgumentException("A successful CQL generation result is required");
        }
        MeasureMetadata metadata = measure.getMetadata();
        String libraryName = libraryName(cql.getCode(), metadata);
        String version = StringUtils.defaultIfBlank(metadata.getVersion(), "1.0.0");

        Library library = buildLibrary(libraryName, version, cql.getCode());
        Measure fhirMeasure = buildMeasure(measure, library.getUrl(), version);

        Bundle bundle = new Bundle();
        bundle.setType(Bundle.BundleType.COLLECTION);
        bundle.addEntry().setFullUrl(fhirMeasure.getUrl()).setResource(fhirMeasure);
        bundle.addEntry().setFullUrl(library.getUrl()).setResource(library);
        for (ValueSet valueSet : buildValueSets(measure.getValueSets())) {
            bundle.addEntry().setFullUrl(valueSet.getUrl()).setResource(valueSet);
        }

        logger.info("Exported measure {} as bundle with {} entries", metadata.getMeasureId(), bundle.getEntry().size());
        return bundle;
    }

    public String toJson(Bundle bundle) {
        IParser parser = fhirContext.newJsonParser().setPrettyPrint(true);
        return parser.encodeResourceToString(bundle);
    }

    private Measure buildMeasure(UniversalMeasureSpec spec, String libraryUrl, String version) {
        MeasureMetadata metadata = spec.getMetadata();
        String id = resourceId(metadata.getMeasureId());

        Measure measure = new Measure();
        measure.setId(id);
        measure.setUrl(canonicalBase + "/Measure/" + id);
        measure.setName(metadata.getMeasureId());
        measure.setTitle(metadata.getTitle());
        measure.setVersion(version);
        measure.setStatus(Enumerations.PublicationStatus.DRAFT);
        measure.setPublisher(metadata.getSteward());
        measure.setDescription(metadata.getDescription());
        measure.addLibrary(libraryUrl);

        String scoring = StringUtils.defaultIfBlank(metadata.getScoring(), "proportion").toLowerCase(Locale.ROOT);
        measure.setScoring(new CodeableConcept(new Coding(MEASURE_SCORING_SYSTEM, scoring, null)));

        MeasurementPeriod period = metadata.getMeasurementPeriod() != null
                ? metadata.getMeasurementPeriod()
                : new MeasurementPeriod(null, null);
        measure.setEffectivePeriod(new Period()
                .setStart(toDate(period.startOrDefault()))
                .setEnd(toDate(period.endOrDefault())));

        Map<PopulationType, PopulationDefinition> byType = new LinkedHashMap<>();
        for (PopulationDefinition population : spec.getPopulations()) {
            byType.putIfAbsent(population.getPopulationType(), population);
        }
        Measure.MeasureGroupComponent group = measure.addGroup();
        for (PopulationType type : PopulationType.values()) {
            PopulationDefinition population = byType.get(type);
            if (population == null && !ALWAYS_DEFINED.contains(type)) {
                continue;
            }
            Measure.MeasureGroupPopulationComponent component = group.addPopulation();
            component.setCode(new CodeableConcept(
                    new Coding(MEASURE_POPULATION_SYSTEM, type.getFhirCode(), type.getDisplayName())));
            component.setCriteria(new Expression()
                    .setLanguage(CQL_IDENTIFIER_LANGUAGE)
                    .setExpression(type.getDisplayName()));
            if (population != null && StringUtils.isNotBlank(population.getNarrative())) {
                component.setDescription(population.getNarrative());
            }
        }
        return measure;
    }

    private Library buildLibrary(String name, String version, String cql) {
        Library library = new Library();
        library.setId(resourceId(name));
        library.setUrl(canonicalBase + "/Library/" + name);
        library.setName(name);
        library.setVersion(version);
        library.setStatus(Enumerations.PublicationStatus.DRAFT);
        library.setType(new CodeableConcept(new Coding(LIBRARY_TYPE_SYSTEM, "logic-library", "Logic Library")));
        library.addContent(new Attachment()
                .setContentType(CQL_CONTENT_TYPE)
                .setData(cql.getBytes(StandardCharsets.UTF_8)));
        return library;
    }

    private List<ValueSet> buildValueSets(List<ValueSetReference> references) {
        List<ValueSet> valueSets = new ArrayList<>();
        int index = 0;
        for (ValueSetReference reference : references) {
            index++;
            ValueSet valueSet = new ValueSet();
            String id = reference.getOid() != null ? reference.getOid() : resourceId("vs-" + index + "-" + reference.getName());
            valueSet.setId(id);
            String url = reference.resolvedUrl();
            valueSet.setUrl(url != null ? url : canonicalBase + "/ValueSet/" + id);
            valueSet.setName(reference.getName());
            valueSet.setTitle(reference.getName());
            valueSet.setStatus(Enumerations.PublicationStatus.DRAFT);
            if (reference.getOid() != null) {
                valueSet.addIdentifier().setSystem("urn:ietf:rfc:3986").setValue("urn:oid:" + reference.getOid());
            }

            Map<String, ValueSet.ConceptSetComponent> includes = new LinkedHashMap<>();
            for (CodeReference code : reference.getCodes()) {
                String system = code.getSystem() != null ? code.getSystem() : "";
                ValueSet.ConceptSetComponent include = includes.computeIfAbsent(system, s -> {
                    ValueSet.ConceptSetComponent component = valueSet.getCompose().addInclude();
                    if (!s.isEmpty()) {
                        component.setSystem(s);
                    }
                    return component;
                });
                include.addConcept().setCode(code.getCode()).setDisplay(code.getDisplay());
            }
            valueSets.add(valueSet);
        }
        return valueSets;
    }

    private static String libraryName(String cql, MeasureMetadata metadata) {
        Matcher matcher = LIBRARY_HEADER.matcher(cql);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return resourceId(StringUtils.defaultIfBlank(metadata.getMeasureId(), "Measure"));
    }

    /**
     * FHIR ids allow letters, digits, '-' and '.', up to 64 characters.
     */
    static String resourceId(String value) {
        String id = value.replaceAll("[^A-Za-z0-9\\-.]", "-").replaceAll("-{2,}", "-");
        id = StringUtils.strip(id, "-");
        if (id.isEmpty()) {
            id = "measure";
        }
        return id.length() > 64 ? id.substring(0, 64) : id;
    }

    private static Date toDate(LocalDate date) {
        return Date.from(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
}
