package io.barhistory.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What a driver is able to deliver.
 */
public record SupportedParameters(Set<Period> periods, Set<Field> fields) {
    public SupportedParameters {
        periods = periods.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(periods));
        fields = Field.copyOf(fields);
    }

    public static SupportedParameters of(Period period, Set<Field> fields) {
        return new SupportedParameters(EnumSet.of(period), fields);
    }

    public boolean supports(Period period) { return periods.contains(period); }
}
