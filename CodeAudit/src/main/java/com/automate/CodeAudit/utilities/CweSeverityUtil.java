package com.automate.CodeAudit.utilities;

import com.automate.CodeAudit.entity.Severity;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.automate.CodeAudit.entity.Severity.CRITICAL;
import static com.automate.CodeAudit.entity.Severity.HIGH;
import static com.automate.CodeAudit.entity.Severity.MEDIUM;

/**
 * Derives a severity tier from a CWE reference.
 *
 * <p>CWEs of the Top 40 (CWE Top 25 and the following 15 "on the cusp"
 * entries) get the tier matching the average CVSS score of the CVEs mapped
 * to them: 9.0 and above is CRITICAL, 7.0 to 8.9 HIGH, below that MEDIUM.
 * Any other CWE is MEDIUM. No CWE at all is LOW.
 */
public final class CweSeverityUtil {

    private CweSeverityUtil() {}

    private static final Pattern CWE_ID = Pattern.compile("(CWE-\\d+)", Pattern.CASE_INSENSITIVE);

    // ===== Top 40 CWE -> severity =====
    private static final Map<String, Severity> TOP40_CWE_SEVERITIES = Map.ofEntries(
            Map.entry("CWE-787", HIGH),     // Out-of-bounds Write
            Map.entry("CWE-79", MEDIUM),    // Cross-site Scripting
            Map.entry("CWE-125", HIGH),     // Out-of-bounds Read
            Map.entry("CWE-20", HIGH),      // Improper Input Validation
            Map.entry("CWE-78", CRITICAL),  // OS Command Injection
            Map.entry("CWE-89", CRITICAL),  // SQL Injection
            Map.entry("CWE-416", HIGH),     // Use After Free
            Map.entry("CWE-22", HIGH),      // Path Traversal
            Map.entry("CWE-352", HIGH),     // Cross-Site Request Forgery
            Map.entry("CWE-434", CRITICAL), // Unrestricted Upload of Dangerous File Type
            Map.entry("CWE-306", CRITICAL), // Missing Authentication for Critical Function
            Map.entry("CWE-190", HIGH),     // Integer Overflow or Wraparound
            Map.entry("CWE-502", CRITICAL), // Deserialization of Untrusted Data
            Map.entry("CWE-287", CRITICAL), // Improper Authentication
            Map.entry("CWE-476", MEDIUM),   // NULL Pointer Dereference
            Map.entry("CWE-798", CRITICAL), // Hard-coded Credentials
            Map.entry("CWE-119", HIGH),     // Improper Restriction of Operations within Memory Buffer
            Map.entry("CWE-862", HIGH),     // Missing Authorization
            Map.entry("CWE-276", MEDIUM),   // Incorrect Default Permissions
            Map.entry("CWE-200", MEDIUM),   // Exposure of Sensitive Information
            Map.entry("CWE-522", HIGH),     // Insufficiently Protected Credentials
            Map.entry("CWE-732", HIGH),     // Incorrect Permission Assignment for Critical Resource
            Map.entry("CWE-611", HIGH),     // XML External Entity Reference
            Map.entry("CWE-918", HIGH),     // Server-Side Request Forgery
            Map.entry("CWE-77", CRITICAL),  // Command Injection
            Map.entry("CWE-295", HIGH),     // Improper Certificate Validation
            Map.entry("CWE-400", HIGH),     // Uncontrolled Resource Consumption
            Map.entry("CWE-94", CRITICAL),  // Code Injection
            Map.entry("CWE-269", HIGH),     // Improper Privilege Management
            Map.entry("CWE-917", CRITICAL), // Expression Language Injection
            Map.entry("CWE-59", MEDIUM),    // Link Following
            Map.entry("CWE-401", MEDIUM),   // Missing Release of Memory after Effective Lifetime
            Map.entry("CWE-362", MEDIUM),   // Race Condition
            Map.entry("CWE-427", HIGH),     // Uncontrolled Search Path Element
            Map.entry("CWE-319", MEDIUM),   // Cleartext Transmission of Sensitive Information
            Map.entry("CWE-843", HIGH),     // Type Confusion
            Map.entry("CWE-601", MEDIUM),   // Open Redirect
            Map.entry("CWE-863", HIGH),     // Incorrect Authorization
            Map.entry("CWE-532", MEDIUM),   // Sensitive Information in Log File
            Map.entry("CWE-770", MEDIUM)    // Allocation of Resources Without Limits
    );

    /**
     * @param cwe free text such as "CWE-200: Exposure of Sensitive Information
     *            to an Unauthorized Actor", may be null
     */
    public static Severity classify(String cwe) {
        String cweId = extractCweId(cwe);
        if (cweId == null) return Severity.LOW;
        return TOP40_CWE_SEVERITIES.getOrDefault(cweId, MEDIUM);
    }

    /** First "CWE-&lt;digits&gt;" in the text, upper-cased, or null. */
    public static String extractCweId(String text) {
        if (text == null || text.isBlank()) return null;
        Matcher m = CWE_ID.matcher(text);
        return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : null;
    }
}
