package eu.virtualparadox.incidentkb.ingest.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed classification of knowledge-base source documents.
 * <p>The {@link #id()} is the value persisted in the index and matched by metadata filters.</p>
 */
public enum EDocumentType {
    RISK_METHODOLOGY("risk_methodology"),
    SECURITY_PRINCIPLES("security_principles"),
    IT_RISK_MANAGEMENT("it_risk_management"),
    REGULATORY_FRAMEWORK("regulatory_framework"),
    COMPLIANCE("compliance"),
    GENERAL("general");

    private final String id;

    EDocumentType(final String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Human readable label, e.g. {@code "Risk Methodology"}.
     */
    public String label() {
        final String[] words = id.split("_");
        final StringBuilder sb = new StringBuilder();
        for (final String w : words) {
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1));
        }
        return sb.toString();
    }

    /**
     * Resolves a persisted id (or enum name), falling back to {@link #GENERAL}.
     */
    public static EDocumentType fromId(final String value) {
        if (value == null) {
            return GENERAL;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(GENERAL);
    }
}
