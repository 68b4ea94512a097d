package io.barhistory.core;

import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one {@link Driver#pull} call: a bar expressed in {@code period} with {@code fields} populated,
 * the end of the data, or a driver failure.
 */
public record PullResult(Status status, Period period, Set<Field> fields, Bar bar, String message) {

    public enum Status { BAR, FINISHED, ERROR }

    private static final PullResult FINISHED = new PullResult(Status.FINISHED, null, Set.of(), null, null);

    public static PullResult bar(Period period, Set<Field> fields, Bar bar) {
        return new PullResult(Status.BAR, Objects.requireNonNull(period), Field.copyOf(fields), Objects.requireNonNull(bar), null);
    }

    public static PullResult finished() { return FINISHED; }

    public static PullResult error(String message) {
        return new PullResult(Status.ERROR, null, Set.of(), null, message);
    }
}
