package com.bulletin.lifecycle.status;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Payload of one record in a status chain.
 *
 * @param statusType     the lifecycle status
 * @param reason         why the status was set; expected for rejections and suspensions
 * @param suspendedUntil end of a temporary suspension, null otherwise
 * @param subject        entity the chain belongs to, set on the root record only so
 *                       that every entity gets a distinct chain identity
 */
public record Status(StatusType statusType, String reason, Instant suspendedUntil,
                     @JsonInclude(JsonInclude.Include.NON_NULL) String subject) {

    public Status {
        Objects.requireNonNull(statusType, "statusType is required");
    }

    public static Status pending() {
        return new Status(StatusType.PENDING, null, null, null);
    }

    /**
     * Initial status of an entity's chain.
     *
     * @param subject identifies the entity, e.g. {@code users/<hash>}
     */
    public static Status pendingFor(String subject) {
        return new Status(StatusType.PENDING, null, null, Objects.requireNonNull(subject, "subject is required"));
    }

    public static Status accepted() {
        return new Status(StatusType.ACCEPTED, null, null, null);
    }

    public static Status rejected(String reason) {
        return new Status(StatusType.REJECTED, reason, null, null);
    }

    public static Status suspendedTemporarily(String reason, Instant suspendedUntil) {
        return new Status(StatusType.SUSPENDED_TEMPORARILY, reason, suspendedUntil, null);
    }

    public static Status suspendedIndefinitely(String reason) {
        return new Status(StatusType.SUSPENDED_INDEFINITELY, reason, null, null);
    }

    public StatusCategory category() {
        return statusType.category();
    }
}
