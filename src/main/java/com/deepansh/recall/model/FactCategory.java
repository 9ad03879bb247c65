package com.deepansh.recall.model;

import com.deepansh.recall.exception.ValidationException;

import java.util.Locale;

/**
 * Closed set of fact categories. Parsed once at the boundary; everything
 * downstream works with the enum.
 */
public enum FactCategory {

    IDENTITY,
    PREFERENCE,
    CONSTRAINT,
    INSTRUCTION;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FactCategory parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Fact category must not be blank");
        }
        try {
            return valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown fact category: '" + raw + "'");
        }
    }

    public static boolean isKnown(String raw) {
        if (raw == null || raw.isBlank()) return false;
        for (FactCategory c : values()) {
            if (c.name().equalsIgnoreCase(raw.strip())) return true;
        }
        return false;
    }
}
