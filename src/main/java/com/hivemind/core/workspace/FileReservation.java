package com.hivemind.core.workspace;

import java.time.Duration;
import java.time.Instant;

/**
 * Advisory exclusive claim on a path.
 */
public record FileReservation(String path, String holder, Instant createdAt, Duration ttl) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
