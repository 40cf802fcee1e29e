package com.mainframe.anonymizer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.model.PictureClause;
import com.mainframe.anonymizer.model.UsageType;
import com.mainframe.anonymizer.parser.CobolToken.TokenKind;

/**
 * Tokenizer for the code zone of fixed-format COBOL lines.
 *
 * Concatenating the text of the returned tokens reproduces the code zone exactly.
 * PIC/PICTURE clauses, together with an attached USAGE, come out as one
 * {@link TokenKind#LAYOUT_DESCRIPTOR} token so they are never rewritten.
 */
public class LayoutAwareTokenizer {
    private static final Logger log = LoggerFactory.getLogger(LayoutAwareTokenizer.class);

    private static final Set<Character> KNOWN_INDICATORS = Set.of(' ', '*', '/', '-', 'D', 'd', '$');

    /** Usage words that form a layout descriptor without a preceding USAGE or PIC. */
    private static final Set<String> STANDALONE_USAGE = Set.of(
            "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5",
            "COMPUTATIONAL", "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3",
            "COMPUTATIONAL-4", "COMPUTATIONAL-5", "BINARY", "PACKED-DECIMAL");

    private static final String LITERAL_PREFIXES = "XxNnZzGgBb";

    private final String fileName;
    private final List<String> warnings = new ArrayList<>();

    public LayoutAwareTokenizer(String fileName) {
        this.fileName = fileName;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Tokenizes a whole file. Comment lines produce an empty token list.
     */
    public List<List<CobolToken>> tokenizeAll(List<SourceLine> lines) {
        List<List<CobolToken>> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            boolean nextIsContinuation = i + 1 < lines.size() && lines.get(i + 1).isContinuation();
            result.add(tokenize(lines.get(i), nextIsContinuation));
        }
        return result;
    }

    /**
     * Tokenizes one line's code zone.
     *
     * @param nextIsContinuation whether the following line continues this one; an open
     *                           literal at the end of the zone is only reported when it is not
     */
    public List<CobolToken> tokenize(SourceLine line, boolean nextIsContinuation) {
        if (line.isComment()) {
            return List.of();
        }
        if (!KNOWN_INDICATORS.contains(line.getIndicatorChar())) {
            addWarning(line.getLineNumber(), "Unrecognized indicator '" + line.getIndicatorChar()
                    + "', line treated as code");
        }
        return new LineScanner(line.getCodeZone(), line.getLineNumber(), nextIsContinuation).scan();
    }

    private void addWarning(int lineNumber, String message) {
        String warning = fileName + ":" + lineNumber + ": " + message;
        warnings.add(warning);
        log.warn(warning);
    }

    private final class LineScanner {
        private final String zone;
        private final int lineNumber;
        private final boolean nextIsContinuation;
        private final List<CobolToken> tokens = new ArrayList<>();
        private int pos = 0;

        LineScanner(String zone, int lineNumber, boolean nextIsContinuation) {
            this.zone = zone;
            this.lineNumber = lineNumber;
            this.nextIsContinuation = nextIsContinuation;
        }

        List<CobolToken> scan() {
            while (pos < zone.length()) {
                char c = zone.charAt(pos);
                int start = pos;

                if (Character.isWhitespace(c)) {
                    while (pos < zone.length() && Character.isWhitespace(zone.charAt(pos))) {
                        pos++;
                    }
                    add(TokenKind.WHITESPACE, start);
                } else if (c == '\'' || c == '"') {
                    readLiteral(start, c);
                } else if (LITERAL_PREFIXES.indexOf(c) >= 0 && pos + 1 < zone.length()
                        && (zone.charAt(pos + 1) == '\'' || zone.charAt(pos + 1) == '"')) {
                    pos++;
                    readLiteral(start, zone.charAt(pos));
                } else if (c == '*' && pos + 1 < zone.length() && zone.charAt(pos + 1) == '>') {
                    pos = zone.length();
                    add(TokenKind.COMMENT, start);
                } else if (isWordStart(c)) {
                    readWord(start);
                } else {
                    readSymbol(start, c);
                }
            }
            return tokens;
        }

        private void readLiteral(int start, char quote) {
            pos++;
            boolean closed = false;
            while (pos < zone.length()) {
                char c = zone.charAt(pos++);
                if (c == quote) {
                    if (pos < zone.length() && zone.charAt(pos) == quote) {
                        pos++;
                    } else {
                        closed = true;
                        break;
                    }
                }
            }
            if (!closed && !nextIsContinuation) {
                addWarning(lineNumber, "Unterminated literal starting at column " + SourceLine.absoluteColumn(start));
            }
            add(TokenKind.STRING_LITERAL, start);
        }

        private void readWord(int start) {
            while (pos < zone.length() && isWordChar(zone.charAt(pos))) {
                pos++;
            }
            String word = zone.substring(start, pos);
            String upper = word.toUpperCase(Locale.ROOT);

            if (!containsLetter(word)) {
                readNumber(start);
                return;
            }
            if (upper.equals("PIC") || upper.equals("PICTURE")) {
                readPicture(start);
                return;
            }
            if (upper.equals("USAGE")) {
                readUsageClause(start);
                return;
            }
            if (STANDALONE_USAGE.contains(upper)) {
                tokens.add(new CobolToken(TokenKind.LAYOUT_DESCRIPTOR, word, lineNumber, start,
                        null, UsageType.fromCobol(upper)));
                return;
            }
            add(ReservedWords.isReserved(upper) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, start);
        }

        private void readNumber(int start) {
            // decimal part, but not a sentence-ending period
            if (pos + 1 < zone.length() && (zone.charAt(pos) == '.' || zone.charAt(pos) == ',')
                    && Character.isDigit(zone.charAt(pos + 1))) {
                pos++;
                while (pos < zone.length() && Character.isDigit(zone.charAt(pos))) {
                    pos++;
                }
            }
            String text = zone.substring(start, pos);
            // a candidate only: the classifier demotes it when the previous sentence is still open
            boolean firstSignificant = tokens.stream().noneMatch(CobolToken::isSignificant);
            add(firstSignificant && isLevelNumber(text) ? TokenKind.LEVEL_NUMBER : TokenKind.NUMERIC_LITERAL, start);
        }

        /**
         * PIC [IS] picture-string [[USAGE [IS]] usage].
         */
        private void readPicture(int start) {
            int keywordEnd = pos;
            int cursor = skipSpaces(keywordEnd);
            int afterIs = skipOptionalWord(cursor, "IS");
            cursor = afterIs;

            int picStart = cursor;
            int picEnd = picStart;
            while (picEnd < zone.length() && !Character.isWhitespace(zone.charAt(picEnd))) {
                picEnd++;
            }
            // a trailing period or comma ends the sentence, it is not part of the picture
            while (picEnd > picStart + 1 && isClauseTerminator(zone.charAt(picEnd - 1))) {
                picEnd--;
            }
            String picture = zone.substring(picStart, picEnd);

            if (picStart == picEnd || !PictureClause.isPictureString(picture)) {
                addWarning(lineNumber, "Unknown layout descriptor '" + zone.substring(start, keywordEnd)
                        + (picture.isEmpty() ? "" : " " + picture) + "'");
                pos = keywordEnd;
                add(TokenKind.KEYWORD, start);
                return;
            }

            UsageType usage = null;
            int end = picEnd;
            if (picEnd == zone.length() || Character.isWhitespace(zone.charAt(picEnd))) {
                int usageEnd = matchUsage(skipSpaces(picEnd));
                if (usageEnd > 0) {
                    usage = UsageType.fromCobol(lastWord(zone.substring(picEnd, usageEnd)));
                    end = usageEnd;
                }
            }

            pos = end;
            tokens.add(new CobolToken(TokenKind.LAYOUT_DESCRIPTOR, zone.substring(start, end), lineNumber, start,
                    PictureClause.parse(picture), usage));
        }

        private void readUsageClause(int start) {
            int usageEnd = matchUsage(start);
            if (usageEnd < 0) {
                add(TokenKind.KEYWORD, start);
                return;
            }
            pos = usageEnd;
            String text = zone.substring(start, usageEnd);
            tokens.add(new CobolToken(TokenKind.LAYOUT_DESCRIPTOR, text, lineNumber, start,
                    null, UsageType.fromCobol(lastWord(text))));
        }

        /**
         * Matches {@code [USAGE [IS]] usage-word} at {@code from}; returns the end offset or -1.
         */
        private int matchUsage(int from) {
            int cursor = from;
            int afterUsage = skipOptionalWord(cursor, "USAGE");
            if (afterUsage != cursor) {
                cursor = skipOptionalWord(afterUsage, "IS");
            }
            int wordEnd = cursor;
            while (wordEnd < zone.length() && isWordChar(zone.charAt(wordEnd))) {
                wordEnd++;
            }
            if (wordEnd == cursor || !UsageType.isUsageWord(zone.substring(cursor, wordEnd))) {
                return -1;
            }
            return wordEnd;
        }

        /**
         * If the word at {@code from} equals {@code word}, returns the offset after it and any
         * following spaces; otherwise {@code from}.
         */
        private int skipOptionalWord(int from, String word) {
            int end = from + word.length();
            if (end <= zone.length() && zone.substring(from, end).equalsIgnoreCase(word)
                    && (end == zone.length() || Character.isWhitespace(zone.charAt(end)))) {
                return skipSpaces(end);
            }
            return from;
        }

        private int skipSpaces(int from) {
            int cursor = from;
            while (cursor < zone.length() && Character.isWhitespace(zone.charAt(cursor))) {
                cursor++;
            }
            return cursor;
        }

        private void readSymbol(int start, char c) {
            char next = pos + 1 < zone.length() ? zone.charAt(pos + 1) : 0;
            if ((c == '*' && next == '*') || (c == '>' && next == '=') || (c == '<' && next == '=')
                    || (c == '=' && next == '=')) {
                pos += 2;
                add(TokenKind.OPERATOR, start);
            } else if ("+-*/=<>&".indexOf(c) >= 0) {
                pos++;
                add(TokenKind.OPERATOR, start);
            } else if (".,();:".indexOf(c) >= 0) {
                pos++;
                add(TokenKind.PUNCTUATION, start);
            } else {
                pos++;
                log.debug("{}:{}: unrecognized character '{}' passed through", fileName, lineNumber, c);
                add(TokenKind.UNKNOWN, start);
            }
        }

        private void add(TokenKind kind, int start) {
            tokens.add(new CobolToken(kind, zone.substring(start, pos), lineNumber, start));
        }
    }

    static boolean isLevelNumber(String text) {
        if (text.isEmpty() || text.length() > 2 || !text.chars().allMatch(Character::isDigit)) {
            return false;
        }
        int level = Integer.parseInt(text);
        return (level >= 1 && level <= 49) || level == 66 || level == 77 || level == 88;
    }

    private static boolean isWordChar(char c) {
        return isWordStart(c) || c == '-';
    }

    private static boolean isWordStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }

    private static boolean containsLetter(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (Character.isLetter(word.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isClauseTerminator(char c) {
        return c == '.' || c == ',' || c == ';';
    }

    private static String lastWord(String text) {
        String[] parts = text.trim().split("\\s+");
        return parts[parts.length - 1];
    }
}
