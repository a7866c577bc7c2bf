package com.measure.compiler.generator;

import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.TimingDirection;
import com.measure.compiler.model.TimingRequirement;
import com.measure.compiler.model.TimingUnit;
import com.measure.compiler.model.TimingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces an element's timing requirements to one {@link NormalizedTiming}.
 * Precedence: index-event wording, then the lookback table, then a structured window,
 * then a quantity in the requirement's description, then the measurement period.
 */
public class TimingNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(TimingNormalizer.class);

    private static final Pattern INDEX_EVENT = Pattern.compile(
            "\\b(ipsd|index\\s*(prescription|event|date))\\b", Pattern.CASE_INSENSITIVE);
    // more than six digits is not a timing window; such text falls through to the measurement period
    private static final Pattern QUANTITY = Pattern.compile("(?<!\\d)(\\d{1,6})\\s*(day|month|year)s?");
    private static final Pattern BEFORE_WORDS = Pattern.compile("\\b(prior|before|preceding)\\b");
    private static final Pattern AFTER_WORDS = Pattern.compile("\\b(after|following)\\b");
    private static final Pattern DAYS = Pattern.compile("(?<!\\d)(\\d{1,6})\\s*days?");
    private static final Pattern OVERSIZED = Pattern.compile("\\d{7,}");

    private final LookbackStrategy lookbackStrategy;

    public TimingNormalizer() {
        this(KeywordLookbackTable.standard());
    }

    public TimingNormalizer(LookbackStrategy lookbackStrategy) {
        this.lookbackStrategy = lookbackStrategy;
    }

    public NormalizedTiming normalize(DataElement element) {
        for (TimingRequirement requirement : element.getTimingRequirements()) {
            if (isIndexRelative(requirement)) {
                return indexTiming(requirement);
            }
        }

        if (element.getClinicalType() != ClinicalType.DEMOGRAPHIC) {
            String searchText = lower(element.getDescription()) + " "
                    + (element.getValueSet() != null && element.getValueSet().getName() != null
                    ? element.getValueSet().getName() : "");
            Optional<LookbackPeriod> lookback = lookbackStrategy.find(searchText);
            if (lookback.isPresent()) {
                return NormalizedTiming.lookback(lookback.get());
            }
        }

        for (TimingRequirement requirement : element.getTimingRequirements()) {
            TimingWindow window = requirement.getWindow();
            if (window != null) {
                return window.getDirection() == TimingDirection.BEFORE
                        ? NormalizedTiming.beforePeriodEnd(window.getValue(), window.getUnit(), "timing window")
                        : NormalizedTiming.afterPeriodStart(window.getValue(), window.getUnit(), "timing window");
            }
        }

        for (TimingRequirement requirement : element.getTimingRequirements()) {
            String description = lower(requirement.getDescription());
            Matcher matcher = QUANTITY.matcher(description);
            if (matcher.find()) {
                int amount = Integer.parseInt(matcher.group(1));
                TimingUnit unit = TimingUnit.fromValue(matcher.group(2));
                return AFTER_WORDS.matcher(description).find()
                        ? NormalizedTiming.afterPeriodStart(amount, unit, "timing description")
                        : NormalizedTiming.beforePeriodEnd(amount, unit, "timing description");
            }
        }

        logOversized(element);
        return NormalizedTiming.duringMeasurementPeriod();
    }

    private static void logOversized(DataElement element) {
        for (TimingRequirement requirement : element.getTimingRequirements()) {
            if (OVERSIZED.matcher(lower(requirement.getDescription())).find()) {
                logger.debug("Ignoring out-of-range quantity in timing of {}: {}", element.getId(), requirement.getDescription());
            }
        }
    }

    /**
     * True when the element is timed against the index prescription start date.
     */
    public boolean isIndexRelative(DataElement element) {
        return element.getTimingRequirements().stream().anyMatch(this::isIndexRelative);
    }

    private boolean isIndexRelative(TimingRequirement requirement) {
        return INDEX_EVENT.matcher(lower(requirement.getDescription())).find()
                || INDEX_EVENT.matcher(lower(requirement.getAnchor())).find();
    }

    private NormalizedTiming indexTiming(TimingRequirement requirement) {
        TimingWindow window = requirement.getWindow();
        if (window != null) {
            return window.getDirection() == TimingDirection.BEFORE
                    ? NormalizedTiming.indexEvent(window.toDays(), null)
                    : NormalizedTiming.indexEvent(null, window.toDays());
        }
        String description = lower(requirement.getDescription());
        Matcher days = DAYS.matcher(description);
        if (!days.find()) {
            if (OVERSIZED.matcher(description).find()) {
                logger.debug("Ignoring out-of-range day count in index timing: {}", requirement.getDescription());
            }
            return NormalizedTiming.indexEvent(null, null);
        }
        int amount = Integer.parseInt(days.group(1));
        boolean before = BEFORE_WORDS.matcher(description).find();
        boolean after = AFTER_WORDS.matcher(description).find();
        if (before == after) {
            // "within 60 days of IPSD": both sides
            return NormalizedTiming.indexEvent(amount, amount);
        }
        return before ? NormalizedTiming.indexEvent(amount, null) : NormalizedTiming.indexEvent(null, amount);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
