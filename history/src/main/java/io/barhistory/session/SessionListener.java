package io.barhistory.session;

import io.barhistory.core.RetCode;

/**
 * Non-owning link from a session back to the build that attached it.
 */
@FunctionalInterface
public interface SessionListener {
    void onSessionError(DriverSession session, RetCode retCode, String message);
}
