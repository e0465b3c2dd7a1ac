package com.bulletin.lifecycle.status;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a user or organization.
 * Serialized with the same wire names the bulletin board has always used.
 */
public enum StatusType {
    PENDING("pending", StatusCategory.PENDING, false),
    ACCEPTED("accepted", StatusCategory.ACCEPTED, false),
    REJECTED("rejected", StatusCategory.REJECTED, true),
    SUSPENDED_TEMPORARILY("suspended temporarily", StatusCategory.SUSPENDED, true),
    SUSPENDED_INDEFINITELY("suspended indefinitely", StatusCategory.SUSPENDED, true);

    private final String wireName;
    private final StatusCategory category;
    private final boolean reasonRequired;

    StatusType(String wireName, StatusCategory category, boolean reasonRequired) {
        this.wireName = wireName;
        this.category = category;
        this.reasonRequired = reasonRequired;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public StatusCategory category() {
        return category;
    }

    public boolean requiresReason() {
        return reasonRequired;
    }

    @JsonCreator
    public static StatusType fromWireName(String wireName) {
        for (StatusType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown status type: " + wireName);
    }
}
