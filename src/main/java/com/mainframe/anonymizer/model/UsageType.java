package com.mainframe.anonymizer.model;

import java.util.Locale;
import java.util.Set;

/**
 * COBOL USAGE clause types.
 */
public enum UsageType {
    /**
     * Default display format (character or zoned decimal).
     */
    DISPLAY,

    /**
     * Binary format (COMP, COMP-4 or BINARY).
     */
    BINARY,

    /**
     * Packed decimal format (COMP-3).
     */
    PACKED_DECIMAL,

    /**
     * Native binary (COMP-5).
     */
    COMP_5,

    /**
     * Floating point single precision (COMP-1).
     */
    COMP_1,

    /**
     * Floating point double precision (COMP-2).
     */
    COMP_2,

    POINTER,

    INDEX;

    private static final Set<String> USAGE_WORDS = Set.of(
            "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5",
            "COMPUTATIONAL", "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3",
            "COMPUTATIONAL-4", "COMPUTATIONAL-5",
            "BINARY", "PACKED-DECIMAL", "DISPLAY", "POINTER", "INDEX");

    public static UsageType fromCobol(String usage) {
        if (usage == null) {
            return DISPLAY;
        }
        String normalized = usage.toUpperCase(Locale.ROOT).trim();
        return switch (normalized) {
            case "COMP", "COMP-4", "BINARY", "COMPUTATIONAL", "COMPUTATIONAL-4" -> BINARY;
            case "COMP-3", "COMPUTATIONAL-3", "PACKED-DECIMAL" -> PACKED_DECIMAL;
            case "COMP-5", "COMPUTATIONAL-5" -> COMP_5;
            case "COMP-1", "COMPUTATIONAL-1" -> COMP_1;
            case "COMP-2", "COMPUTATIONAL-2" -> COMP_2;
            case "POINTER" -> POINTER;
            case "INDEX" -> INDEX;
            default -> DISPLAY;
        };
    }

    /**
     * True when the word is one of the USAGE keywords, in any case.
     */
    public static boolean isUsageWord(String word) {
        return word != null && USAGE_WORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * Storage size of usages that need no PICTURE, 0 for the others.
     */
    public int getFixedByteLength() {
        return switch (this) {
            case COMP_1, POINTER, INDEX -> 4;
            case COMP_2 -> 8;
            default -> 0;
        };
    }
}
