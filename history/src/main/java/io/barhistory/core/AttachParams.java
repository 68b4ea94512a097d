package io.barhistory.core;

import java.util.Objects;
import java.util.Set;

/**
 * Parameters of one attached data source.
 *
 * @param fields   requested fields, or {@code null} for every field the driver has
 * @param start    first timestamp wanted (epoch seconds, inclusive), {@code null} when open
 * @param end      last timestamp wanted (epoch seconds, inclusive), {@code null} when open
 * @param required when true a failure of this source fails the whole build
 */
public record AttachParams(Driver driver, String category, String symbol, Period period,
                           Long start, Long end, Set<Field> fields, boolean required) {

    public boolean allFieldsRequested() { return fields == null; }

    /** Start after end: nothing can match, the source is never pulled. */
    public boolean isEmptyRange() { return start != null && end != null && start > end; }

    public String describe() {
        return (category == null ? "" : category + "/") + (symbol == null ? "?" : symbol) + "@" + period;
    }

    public static Builder builder(Driver driver) { return new Builder(driver); }

    public static final class Builder {
        private final Driver driver;
        private String category;
        private String symbol;
        private Period period = Period.DAILY;
        private Long start;
        private Long end;
        private Set<Field> fields;
        private boolean required;

        private Builder(Driver driver) { this.driver = driver; }

        public Builder category(String c) { this.category = c; return this; }
        public Builder symbol(String s) { this.symbol = s; return this; }
        public Builder period(Period p) { this.period = p; return this; }
        public Builder start(Long s) { this.start = s; return this; }
        public Builder end(Long e) { this.end = e; return this; }
        public Builder range(Long s, Long e) { this.start = s; this.end = e; return this; }
        public Builder fields(Set<Field> f) { this.fields = Objects.requireNonNull(f); return this; }
        public Builder allFields() { this.fields = null; return this; }
        public Builder required(boolean r) { this.required = r; return this; }

        public AttachParams build() {
            return new AttachParams(driver, category, symbol, period, start, end,
                    fields == null ? null : Field.copyOf(fields), required);
        }
    }
}
