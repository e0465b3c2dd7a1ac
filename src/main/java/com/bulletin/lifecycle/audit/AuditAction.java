package com.bulletin.lifecycle.audit;

/**
 * Types of auditable actions in the lifecycle subsystem.
 */
public enum AuditAction {
    STATUS_CREATED,
    STATUS_UPDATED,
    STATUS_UNSUSPENDED,
    RECORD_INTEGRATED,
    ADMINISTRATOR_REGISTERED,
    ADMINISTRATOR_REMOVED,
    INDEX_REBUILT
}
