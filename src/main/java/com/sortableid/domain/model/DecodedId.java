package com.sortableid.domain.model;

import java.time.Instant;

/**
 * Fields recovered from an ID. Only the timestamp is interpreted; chrono and suffix stay opaque.
 */
public record DecodedId(
    Instant instant,
    long bucket,
    String timestampPart,
    String chronoPart,
    String suffixPart
) {
}
