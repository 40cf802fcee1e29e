package com.mainframe.anonymizer.model;

import lombok.Builder;
import lombok.Data;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents a parsed COBOL PIC (PICTURE) clause.
 */
@Data
@Builder
public class PictureClause {
    private String rawPicture;
    private boolean signed;
    private boolean numeric;
    private boolean alphanumeric;
    private int integerDigits;
    private int decimalDigits;
    private int totalLength;
    private boolean hasDecimalPoint;
    private boolean hasImpliedDecimal;
    private String expandedPicture;

    // Patterns for parsing PIC clauses
    private static final Pattern REPEAT_PATTERN = Pattern.compile("(\\w)\\((\\d+)\\)");
    private static final Pattern SIGNED_PATTERN = Pattern.compile("^S");
    private static final Pattern NUMERIC_PATTERN = Pattern.compile("^S?[9PV]");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("V");
    private static final Pattern EXPLICIT_DECIMAL = Pattern.compile("\\.");

    /** Characters allowed in a picture character-string. */
    private static final Pattern PICTURE_STRING = Pattern.compile(
            "[SVXAZBPE90/,.+\\-*$CRDB()0-9]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern PICTURE_SYMBOL = Pattern.compile("[9XAZSVPBE0/*$+\\-]", Pattern.CASE_INSENSITIVE);

    /**
     * True when {@code text} is a well-formed picture character-string:
     * legal symbols only, balanced repeat counts, at least one picture symbol.
     */
    public static boolean isPictureString(String text) {
        if (text == null || text.isEmpty() || !PICTURE_STRING.matcher(text).matches()) {
            return false;
        }
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth > 0 && !Character.isDigit(c)) {
                return false;
            }
            if (depth < 0 || depth > 1) {
                return false;
            }
        }
        return depth == 0 && PICTURE_SYMBOL.matcher(text.replaceAll("\\(\\d+\\)", "")).find();
    }

    /**
     * Parse a raw COBOL PIC clause string.
     */
    public static PictureClause parse(String pic) {
        if (pic == null || pic.isBlank()) {
            return null;
        }

        String normalized = pic.toUpperCase(Locale.ROOT).replaceAll("\\s+", "")
                .replaceFirst("^PICTURE", "").replaceFirst("^PIC", "").replaceFirst("^IS", "");
        String expanded = expandPicture(normalized);

        boolean signed = SIGNED_PATTERN.matcher(normalized).find();
        boolean numeric = NUMERIC_PATTERN.matcher(normalized).find() && !expanded.contains("X")
                && !expanded.contains("A");
        boolean alphanumeric = !numeric && (expanded.contains("X") || expanded.contains("A"));
        boolean hasImplied = DECIMAL_PATTERN.matcher(normalized).find();
        boolean hasExplicit = EXPLICIT_DECIMAL.matcher(normalized).find();

        int intDigits = 0;
        int decDigits = 0;
        int totalLen;

        if (numeric) {
            // Count digits before and after V (or .)
            String withoutSign = expanded.replaceFirst("^S", "");
            int decimalPos = withoutSign.indexOf('V');
            if (decimalPos < 0) {
                decimalPos = withoutSign.indexOf('.');
            }

            if (decimalPos >= 0) {
                intDigits = countDigits(withoutSign.substring(0, decimalPos));
                decDigits = countDigits(withoutSign.substring(decimalPos + 1));
            } else {
                intDigits = countDigits(withoutSign);
            }
            totalLen = intDigits + decDigits;
        } else {
            // Alphanumeric or edited - every position occupies a byte
            totalLen = expanded.replace("V", "").replace("S", "").length();
        }

        return PictureClause.builder()
                .rawPicture(pic)
                .signed(signed)
                .numeric(numeric)
                .alphanumeric(alphanumeric)
                .integerDigits(intDigits)
                .decimalDigits(decDigits)
                .totalLength(totalLen)
                .hasDecimalPoint(hasExplicit)
                .hasImpliedDecimal(hasImplied)
                .expandedPicture(expanded)
                .build();
    }

    /**
     * Expand repeat notation like X(10) to XXXXXXXXXX.
     */
    static String expandPicture(String pic) {
        Matcher matcher = REPEAT_PATTERN.matcher(pic);
        StringBuilder sb = new StringBuilder();

        while (matcher.find()) {
            String ch = matcher.group(1);
            int count = Integer.parseInt(matcher.group(2));
            matcher.appendReplacement(sb, ch.repeat(count));
        }
        matcher.appendTail(sb);

        return sb.toString();
    }

    private static int countDigits(String s) {
        return (int) s.chars().filter(c -> c == '9' || c == 'Z' || c == '*').count();
    }

    /**
     * Calculate byte length for this picture and usage type.
     */
    public int getByteLength(UsageType usage) {
        UsageType effective = usage == null ? UsageType.DISPLAY : usage;
        if (!numeric) {
            return totalLength;
        }

        return switch (effective) {
            case DISPLAY -> totalLength + (hasDecimalPoint ? 1 : 0);
            case BINARY, COMP_5 -> getBinaryByteLength();
            case PACKED_DECIMAL -> (totalLength / 2) + 1;
            case COMP_1, COMP_2, POINTER, INDEX -> effective.getFixedByteLength();
        };
    }

    public int getBinaryByteLength() {
        int digits = integerDigits + decimalDigits;
        if (digits <= 4) return 2;
        if (digits <= 9) return 4;
        return 8;
    }
}
