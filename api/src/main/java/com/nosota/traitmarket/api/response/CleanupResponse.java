package com.nosota.traitmarket.api.response;

/**
 * @param expiredCount  Number of reservations moved to EXPIRED
 */
public record CleanupResponse(int expiredCount) {
}
