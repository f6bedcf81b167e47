package org.gc.freegames.domain;

public enum SubscriptionResult {
    SUBSCRIBED,
    ALREADY_SUBSCRIBED,
    UNSUBSCRIBED,
    NOT_SUBSCRIBED,
    /** The document changed in memory but could not be written back. */
    WRITE_FAILED
}
