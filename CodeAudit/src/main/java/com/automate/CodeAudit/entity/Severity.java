package com.automate.CodeAudit.entity;

import java.util.List;

/**
 * Severity tiers shared by rules, vulnerabilities and vulnerable dependencies.
 * Declaration order is the ordering: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Tiers from the most to the least severe. */
    public static final List<Severity> DESCENDING = List.of(CRITICAL, HIGH, MEDIUM, LOW);
}
