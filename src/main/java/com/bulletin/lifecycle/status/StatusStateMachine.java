package com.bulletin.lifecycle.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Rules for moving between lifecycle statuses.
 *
 * <p>Any status may follow any other. What is checked is the shape of the
 * requested status:</p>
 * <ul>
 *   <li>{@code rejected} and both suspended statuses need a non-blank reason</li>
 *   <li>{@code suspended temporarily} needs a {@code suspendedUntil} in the future</li>
 *   <li>no other status may carry a {@code suspendedUntil}</li>
 * </ul>
 *
 * <p>Suspension expiry is a pure predicate; nothing here changes a chain.</p>
 */
public class StatusStateMachine {
    private static final Logger log = LoggerFactory.getLogger(StatusStateMachine.class);

    private final Clock clock;

    public StatusStateMachine() {
        this(Clock.systemUTC());
    }

    public StatusStateMachine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validates a requested status against the current one.
     *
     * @param current   the current status type, or null when the entity has no status yet
     * @param requested the requested status
     * @return the status to record
     * @throws InvalidTransitionException if the requested status is malformed
     */
    public Status transition(StatusType current, Status requested) {
        StatusType requestedType = requested.statusType();
        if (requestedType.requiresReason() && (requested.reason() == null || requested.reason().isBlank())) {
            throw new InvalidTransitionException("A reason is required to move to '" + requestedType.wireName() + "'");
        }
        if (requestedType == StatusType.SUSPENDED_TEMPORARILY) {
            if (requested.suspendedUntil() == null) {
                throw new InvalidTransitionException("suspendedUntil is required for a temporary suspension");
            }
            Instant now = clock.instant();
            if (!requested.suspendedUntil().isAfter(now)) {
                throw new InvalidTransitionException("suspendedUntil must be in the future: "
                        + requested.suspendedUntil() + " is not after " + now);
            }
        } else if (requested.suspendedUntil() != null) {
            throw new InvalidTransitionException("suspendedUntil is only allowed for a temporary suspension, not '"
                    + requestedType.wireName() + "'");
        }
        if (current != null && requested.subject() != null) {
            throw new InvalidTransitionException("subject is only recorded on the first status of a chain");
        }
        log.debug("status.transition from={} to={}", current != null ? current.wireName() : "none",
                requestedType.wireName());
        return requested;
    }

    /**
     * Convenience overload taking the status fields separately.
     */
    public Status transition(StatusType current, StatusType requestedType, String reason, Instant suspendedUntil) {
        return transition(current, new Status(requestedType, reason, suspendedUntil, null));
    }

    /**
     * Builds a temporary suspension lasting the given number of days from now.
     *
     * @throws InvalidTransitionException if {@code days} is not positive or exceeds {@code maxDays}
     */
    public Status suspensionForDays(String reason, Integer days, int maxDays) {
        if (days == null) {
            throw new InvalidTransitionException("Duration in days not provided");
        }
        if (days <= 0) {
            throw new InvalidTransitionException("Duration in days must be positive: " + days);
        }
        if (days > maxDays) {
            throw new InvalidTransitionException("Duration in days must not exceed " + maxDays + ": " + days);
        }
        return Status.suspendedTemporarily(reason, clock.instant().plus(Duration.ofDays(days)));
    }

    /**
     * Returns true iff the status is a temporary suspension whose end has been reached.
     */
    public boolean isExpired(Status status, Instant now) {
        return status.statusType() == StatusType.SUSPENDED_TEMPORARILY
                && status.suspendedUntil() != null
                && !now.isBefore(status.suspendedUntil());
    }

    /**
     * Expiry check against the current time.
     */
    public boolean isExpired(Status status) {
        return isExpired(status, clock.instant());
    }
}
