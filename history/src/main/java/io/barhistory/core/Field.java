package io.barhistory.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Price bar columns a driver may provide. The timestamp column is always present and is not listed here.
 */
public enum Field {
    OPEN,
    HIGH,
    LOW,
    CLOSE,
    VOLUME,
    OPEN_INTEREST;

    public static Set<Field> all() { return EnumSet.allOf(Field.class); }

    public static Set<Field> of(Field first, Field... rest) { return EnumSet.of(first, rest); }

    /** Immutable EnumSet-backed copy; an empty input yields an empty set. */
    public static Set<Field> copyOf(Set<Field> fields) {
        if (fields.isEmpty()) return Collections.emptySet();
        return Collections.unmodifiableSet(EnumSet.copyOf(fields));
    }
}
