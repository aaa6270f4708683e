package com.netbet.bybit.stream;

import com.netbet.bybit.router.SubscriptionRejection;

/**
 * Caller-facing notification channel of a {@link ConnectionSession}.
 * State changes are delivered under the session lock: keep implementations short and do not call
 * {@link ConnectionSession#close()} from them.
 */
public interface SessionListener {

    default void onStateChanged(SessionState previous, SessionState current) {
    }

    default void onSubscriptionRejected(SubscriptionRejection rejection) {
    }

    /** Background reconnect gave up; the session is DISCONNECTED until connect() is called again. */
    default void onConnectionFailed(ConnectionException error) {
    }
}
