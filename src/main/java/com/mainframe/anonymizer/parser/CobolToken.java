package com.mainframe.anonymizer.parser;

import com.mainframe.anonymizer.model.PictureClause;
import com.mainframe.anonymizer.model.UsageType;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A token of one line's code zone. {@code start} is the offset of the token within
 * the code zone, so {@code SourceLine.absoluteColumn(start)} is its column.
 */
@Data
@AllArgsConstructor
public class CobolToken {
    private TokenKind kind;
    private String text;
    private int lineNumber;
    private int start;
    private PictureClause picture;
    private UsageType usage;

    public CobolToken(TokenKind kind, String text, int lineNumber, int start) {
        this(kind, text, lineNumber, start, null, null);
    }

    public enum TokenKind {
        KEYWORD,
        IDENTIFIER,
        LAYOUT_DESCRIPTOR,
        STRING_LITERAL,
        NUMERIC_LITERAL,
        LEVEL_NUMBER,
        OPERATOR,
        PUNCTUATION,
        WHITESPACE,
        COMMENT,
        UNKNOWN
    }

    public int getEnd() {
        return start + text.length();
    }

    public boolean isSignificant() {
        return kind != TokenKind.WHITESPACE && kind != TokenKind.COMMENT;
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isPeriod() {
        return kind == TokenKind.PUNCTUATION && ".".equals(text);
    }
}
