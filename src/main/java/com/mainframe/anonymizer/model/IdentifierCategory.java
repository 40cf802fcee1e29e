package com.mainframe.anonymizer.model;

import java.util.Locale;

/**
 * Categories of user-defined COBOL names. Each category carries the prefix used by
 * the naming strategies and whether names of that category may be renamed at all.
 */
public enum IdentifierCategory {
    PROGRAM_NAME("PG", true),
    INCLUDED_FRAGMENT_NAME("CP", true),
    SECTION_NAME("SC", true),
    PARAGRAPH_NAME("PA", true),
    DATA_NAME("D", true),
    CONDITION_NAME("C", true),
    FILE_RECORD_NAME("FL", true),
    INDEX_NAME("IX", true),
    CROSS_PROGRAM_NAME("EX", true),
    SYSTEM_RESERVED("", false);

    private final String prefix;
    private final boolean renameable;

    IdentifierCategory(String prefix, boolean renameable) {
        this.prefix = prefix;
        this.renameable = renameable;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isRenameable() {
        return renameable;
    }

    /**
     * Parses a persisted category tag. Accepts the enum name in any case, with hyphens
     * or underscores.
     */
    public static IdentifierCategory fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Category tag is required");
        }
        return valueOf(tag.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
