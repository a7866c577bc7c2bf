package com.measure.compiler.generator;

import com.measure.compiler.model.TimingUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered keyword table; the first keyword found in the text wins, so more specific
 * keywords must precede the general ones they contain.
 */
public final class KeywordLookbackTable implements LookbackStrategy {
    private final List<Entry> entries;

    private KeywordLookbackTable(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Standard screening lookbacks for colorectal, cervical and breast cancer screening.
     */
    public static KeywordLookbackTable standard() {
        return builder()
                .add("colonoscopy", 10, TimingUnit.YEARS)
                .add("flexible sigmoidoscopy", 5, TimingUnit.YEARS)
                .add("sigmoidoscopy", 5, TimingUnit.YEARS)
                .add("ct colonography", 5, TimingUnit.YEARS)
                .add("fit-dna", 3, TimingUnit.YEARS)
                .add("fit dna", 3, TimingUnit.YEARS)
                .add("cologuard", 3, TimingUnit.YEARS)
                .add("fobt", 1, TimingUnit.YEARS)
                .add("fecal occult", 1, TimingUnit.YEARS)
                .add("fecal immunochemical", 1, TimingUnit.YEARS)
                .add("fit", 1, TimingUnit.YEARS)
                .add("pap", 3, TimingUnit.YEARS)
                .add("cervical cytology", 3, TimingUnit.YEARS)
                .add("hpv", 5, TimingUnit.YEARS)
                .add("mammography", 2, TimingUnit.YEARS)
                .add("mammogram", 2, TimingUnit.YEARS)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<LookbackPeriod> find(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        for (Entry entry : entries) {
            if (entry.pattern.matcher(haystack).find()) {
                return Optional.of(new LookbackPeriod(entry.amount, entry.unit, entry.keyword));
            }
        }
        return Optional.empty();
    }

    public List<String> keywords() {
        return entries.stream().map(e -> e.keyword).toList();
    }

    private static final class Entry {
        private final String keyword;
        private final Pattern pattern;
        private final int amount;
        private final TimingUnit unit;

        Entry(String keyword, int amount, TimingUnit unit) {
            this.keyword = keyword;
            // whole words only: "fit" must not match "benefit"
            this.pattern = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])");
            this.amount = amount;
            this.unit = unit;
        }
    }

    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String keyword, int amount, TimingUnit unit) {
            entries.add(new Entry(keyword.toLowerCase(Locale.ROOT), amount, unit));
            return this;
        }

        public KeywordLookbackTable build() {
            return new KeywordLookbackTable(entries);
        }
    }
}
