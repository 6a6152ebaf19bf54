package com.elime.service.correction;

public enum SessionStatus {
    ACTIVE,
    COMMITTED,
    /** The operator asked to quit; nothing from this session may be stored. */
    CANCELLED
}
