package com.mainframe.anonymizer.naming;

import java.util.regex.Pattern;

import com.mainframe.anonymizer.model.IdentifierCategory;

import lombok.experimental.UtilityClass;

/**
 * COBOL user-defined word rules for generated names.
 */
@UtilityClass
public class IdentifierRules {

    public static final int MAX_LENGTH = 30;
    public static final int MIN_TARGET_LENGTH = 4;

    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z]([A-Za-z0-9-]*[A-Za-z0-9])?$");

    /**
     * Starts with a letter, letters, digits and single hyphens only, no hyphen at
     * either end, at most 30 characters.
     */
    public static boolean isValid(String name) {
        return name != null
                && name.length() <= MAX_LENGTH
                && VALID_NAME.matcher(name).matches()
                && !name.contains("--");
    }

    /**
     * Length a replacement should have: the original's length capped at 30, but long
     * enough for the category prefix and one digit.
     */
    public static int targetLength(String original, IdentifierCategory category) {
        int length = Math.min(original.length(), MAX_LENGTH);
        length = Math.max(length, MIN_TARGET_LENGTH);
        return Math.max(length, category.getPrefix().length() + 1);
    }
}
