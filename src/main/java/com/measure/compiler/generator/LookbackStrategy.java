package com.measure.compiler.generator;

import java.util.Optional;

/**
 * Chooses a lookback period for a data element from its descriptive text.
 */
@FunctionalInterface
public interface LookbackStrategy {

    /**
     * @param text Element description and value set name
     * @return The lookback period, or empty to keep the element's own timing
     */
    Optional<LookbackPeriod> find(String text);
}
