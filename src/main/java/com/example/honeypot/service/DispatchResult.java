package com.example.honeypot.service;

public enum DispatchResult {
    /** Preconditions not met; nothing attempted. */
    SKIPPED,
    /** Eligible, but no time is left in this turn; left unclaimed so a later turn can send it. */
    DEFERRED,
    /** Another request owns the report for this session. */
    ALREADY_CLAIMED,
    DELIVERED,
    /** Claimed but not delivered; recorded, never retried. */
    FAILED
}
