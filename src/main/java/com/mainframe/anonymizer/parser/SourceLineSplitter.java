package com.mainframe.anonymizer.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Splits raw text lines into fixed column zones.
 */
@UtilityClass
public class SourceLineSplitter {

    /**
     * Splits one line (without its line terminator).
     */
    public static SourceLine split(String raw, int lineNumber) {
        return split(raw, lineNumber, "");
    }

    public static SourceLine split(String raw, int lineNumber, String lineEnding) {
        String text = raw == null ? "" : raw;
        int len = text.length();

        return SourceLine.builder()
                .lineNumber(lineNumber)
                .raw(text)
                .lineEnding(lineEnding)
                .sequence(text.substring(0, Math.min(SourceLine.INDICATOR_INDEX, len)))
                .indicator(len > SourceLine.INDICATOR_INDEX
                        ? text.substring(SourceLine.INDICATOR_INDEX, SourceLine.CODE_START) : "")
                .codeZone(len > SourceLine.CODE_START
                        ? text.substring(SourceLine.CODE_START, Math.min(SourceLine.CODE_END, len)) : "")
                .trailingZone(len > SourceLine.CODE_END ? text.substring(SourceLine.CODE_END) : "")
                .build();
    }

    /**
     * Splits a whole file, keeping each line's terminator ({@code \r\n}, {@code \n} or none
     * for an unterminated last line) so the file can be rebuilt byte for byte.
     */
    public static List<SourceLine> splitAll(String content) {
        List<SourceLine> lines = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return lines;
        }

        int lineNumber = 1;
        int start = 0;
        while (start < content.length()) {
            int nl = content.indexOf('\n', start);
            if (nl < 0) {
                lines.add(split(content.substring(start), lineNumber, ""));
                break;
            }
            int end = nl;
            String ending = "\n";
            if (end > start && content.charAt(end - 1) == '\r') {
                end--;
                ending = "\r\n";
            }
            lines.add(split(content.substring(start, end), lineNumber++, ending));
            start = nl + 1;
        }
        return lines;
    }
}
