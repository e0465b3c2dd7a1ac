package com.bulletin.lifecycle.status;

/**
 * Derived index buckets used for bulk status queries.
 */
public enum StatusCategory {
    PENDING("pending"),
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    SUSPENDED("suspended");

    private final String pathName;

    StatusCategory(String pathName) {
        this.pathName = pathName;
    }

    public String pathName() {
        return pathName;
    }
}
