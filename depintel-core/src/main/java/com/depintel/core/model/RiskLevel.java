package com.depintel.core.model;

import java.util.Locale;

/**
 * Per-dependency risk or issue severity reported inside analysis documents.
 *
 * <p>{@link #UNKNOWN} marks dependencies whose inputs were missing.
 */
public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
