package com.mainframe.anonymizer.parser;

import lombok.Builder;
import lombok.Getter;

/**
 * One physical line of fixed-format COBOL, split into its column zones.
 *
 * <pre>
 * cols 1-6   sequence area
 * col  7     indicator area
 * cols 8-72  code area (Area A = 8-11, Area B = 12-72)
 * cols 73+   identification area
 * </pre>
 *
 * Zones are exact substrings of the raw text; nothing is padded or trimmed.
 */
@Getter
@Builder
public class SourceLine {

    public static final int INDICATOR_INDEX = 6;
    public static final int CODE_START = 7;
    public static final int CODE_END = 72;
    public static final int CODE_WIDTH = CODE_END - CODE_START;
    public static final int AREA_A_WIDTH = 4;

    private final int lineNumber;
    private final String raw;
    private final String sequence;
    private final String indicator;
    private final String codeZone;
    private final String trailingZone;
    private final String lineEnding;

    public char getIndicatorChar() {
        return indicator.isEmpty() ? ' ' : indicator.charAt(0);
    }

    public boolean isComment() {
        char c = getIndicatorChar();
        return c == '*' || c == '/';
    }

    public boolean isContinuation() {
        return getIndicatorChar() == '-';
    }

    public boolean isDebug() {
        char c = getIndicatorChar();
        return c == 'D' || c == 'd';
    }

    public boolean isBlank() {
        return codeZone.isBlank();
    }

    /**
     * Absolute 1-based column of an offset within the code zone.
     */
    public static int absoluteColumn(int codeOffset) {
        return CODE_START + codeOffset + 1;
    }

    /**
     * Rebuilds the physical line around a new code zone. When an identification area
     * follows, a shorter code zone is padded back to its original width so that the
     * identification area stays in column 73.
     */
    public String reassemble(String newCodeZone) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        sb.append(sequence).append(indicator).append(newCodeZone);
        if (!trailingZone.isEmpty()) {
            for (int i = newCodeZone.length(); i < codeZone.length(); i++) {
                sb.append(' ');
            }
            sb.append(trailingZone);
        }
        return sb.toString();
    }
}
