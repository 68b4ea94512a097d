package io.barhistory.core;

import io.barhistory.session.DriverSession;

import java.util.Set;

/**
 * Pull interface of a data source. One implementation per backing store.
 * <p>
 * {@link #pull} is invoked repeatedly from the session's pull loop, possibly on a dedicated thread, until it
 * returns {@link PullResult.Status#FINISHED} or {@link PullResult.Status#ERROR}, or until the session is cancelled.
 * State kept per session must be keyed by the session object since one driver may serve several sessions.
 */
public interface Driver {

    SupportedParameters describeSupportedParameters();

    /**
     * Produce the next bar within {@code [start, end]} (epoch seconds, inclusive, {@code null} when open).
     * Thrown exceptions are treated as transient and go through the session's retry policy.
     */
    PullResult pull(DriverSession session, Long start, Long end, Set<Field> fields) throws Exception;

    /**
     * Best-effort request to stop producing bars for {@code session}. Also invoked once the session failed, so
     * per-session resources can be closed; must tolerate repeated calls.
     */
    default void cancel(DriverSession session) {}
}
