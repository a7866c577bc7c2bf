package com.measure.compiler.generator;

import com.measure.compiler.model.DataElement;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Medication adherence predicate: the running sum of days supply dispensed from the index
 * prescription start date must reach {@code requiredDaysSupply} within {@code windowDays}.
 */
public final class CumulativeDaysSupplyRule {
    private static final Pattern ADHERENCE = Pattern.compile(
            "at least (\\d+) days of (?:continuous )?(?:treatment|medication|therapy)\\b.*?within (\\d+) days");

    private final String elementId;
    private final String label;
    private final int requiredDaysSupply;
    private final int windowDays;

    public CumulativeDaysSupplyRule(String elementId, String label, int requiredDaysSupply, int windowDays) {
        if (requiredDaysSupply <= 0 || windowDays <= 0) {
            throw new IllegalArgumentException("Days supply and window must be positive");
        }
        if (requiredDaysSupply > windowDays) {
            throw new IllegalArgumentException(
                    "Required days supply " + requiredDaysSupply + " exceeds window of " + windowDays + " days");
        }
        this.elementId = Objects.requireNonNull(elementId, "elementId");
        this.label = label;
        this.requiredDaysSupply = requiredDaysSupply;
        this.windowDays = windowDays;
    }

    /**
     * Detect wording such as "at least 84 days of treatment ... within 114 days" in the element description.
     * @param element Medication element
     * @return The detected rule, empty when the wording is absent
     */
    public static Optional<CumulativeDaysSupplyRule> detect(DataElement element) {
        String description = element.getDescription();
        if (description == null) {
            return Optional.empty();
        }
        Matcher matcher = ADHERENCE.matcher(description.toLowerCase(Locale.ROOT));
        if (!matcher.find()) {
            return Optional.empty();
        }
        int required = Integer.parseInt(matcher.group(1));
        int window = Integer.parseInt(matcher.group(2));
        if (required > window) {
            return Optional.empty();
        }
        return Optional.of(new CumulativeDaysSupplyRule(element.getId(), description, required, window));
    }

    public String getElementId() {
        return elementId;
    }

    public String getLabel() {
        return label;
    }

    public int getRequiredDaysSupply() {
        return requiredDaysSupply;
    }

    public int getWindowDays() {
        return windowDays;
    }
}
