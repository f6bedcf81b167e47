package org.gc.freegames.domain;

/**
 * Result of one scheduled delivery attempt.
 */
public enum DeliveryOutcome {
    DELIVERED,
    /** Content fingerprint equals the last evaluated one. */
    SKIPPED_UNCHANGED,
    /** Subscriber no longer registered; the job should be dropped. */
    ORPHANED,
    TRANSPORT_FAILED
}
