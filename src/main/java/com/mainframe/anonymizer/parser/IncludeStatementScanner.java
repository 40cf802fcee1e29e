package com.mainframe.anonymizer.parser;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds COPY / INCLUDE statements in a file, including statements that span
 * several lines, REPLACING clauses in both the pseudo-text and the plain form, and
 * {@code EXEC SQL INCLUDE name END-EXEC}.
 */
public class IncludeStatementScanner {
    private static final Logger log = LoggerFactory.getLogger(IncludeStatementScanner.class);

    private static final Pattern INCLUDE_PATTERN = Pattern.compile(
            "(?<![A-Za-z0-9-])(COPY|INCLUDE)\\s+([A-Za-z0-9][A-Za-z0-9-]*|'[^']+'|\"[^\"]+\")"
                    + "(?:\\s+(?:OF|IN)\\s+([A-Za-z0-9][A-Za-z0-9-]*))?"
                    + "(?:\\s+(?:SUPPRESS))?"
                    + "(?:\\s+REPLACING\\s+(.+?))?"
                    + "(?:\\s+END-EXEC(?![A-Za-z0-9-])\\.?|\\s*\\.(?=\\s|$))",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern REPLACING_PAIR = Pattern.compile(
            "(?:==(.*?)==|([^\\s=,;][^\\s,;]*))\\s+BY\\s+(?:==(.*?)==|([^\\s,;]+))",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /**
     * Scans all code lines of a file. Comment lines and floating {@code *>} comments are
     * skipped; continuation lines are joined to the line they continue. COPY inside a
     * literal is text, not a statement.
     */
    public List<IncludeStatement> scan(String fileName, List<SourceLine> lines) {
        StringBuilder joined = new StringBuilder();
        BitSet literals = new BitSet();
        List<int[]> segments = new ArrayList<>();
        char quote = 0;

        for (SourceLine line : lines) {
            if (line.isComment()) {
                continue;
            }
            String code = line.getCodeZone();
            if (line.isContinuation() && joined.length() > 0) {
                if (joined.charAt(joined.length() - 1) == '\n') {
                    joined.setLength(joined.length() - 1);
                }
                code = code.stripLeading();
                // a continued literal resumes after the quote that opens the continuation line
                if (quote != 0 && !code.isEmpty() && code.charAt(0) == quote) {
                    code = code.substring(1);
                }
            } else {
                quote = 0;
            }
            segments.add(new int[] {joined.length(), line.getLineNumber()});
            quote = appendCode(joined, literals, code, quote);
            joined.append('\n');
        }

        List<IncludeStatement> statements = new ArrayList<>();
        Matcher m = INCLUDE_PATTERN.matcher(joined);
        int from = 0;
        while (from < joined.length() && m.find(from)) {
            if (literals.get(m.start())) {
                from = m.start() + 1;
                continue;
            }
            String name = stripQuotes(m.group(2));
            IncludeStatement statement = IncludeStatement.builder()
                    .fragmentName(name.toUpperCase(Locale.ROOT))
                    .library(m.group(3) != null ? m.group(3).toUpperCase(Locale.ROOT) : null)
                    .replacing(parseReplacing(m.group(4)))
                    .consumerFile(fileName)
                    .line(lineAt(segments, m.start()))
                    .rawText(m.group().replaceAll("\\s+", " ").trim())
                    .build();
            log.debug("{}:{}: {} {}", fileName, statement.getLine(), m.group(1).toUpperCase(Locale.ROOT), name);
            statements.add(statement);
            from = m.end();
        }
        return statements;
    }

    /**
     * Appends one line's code, marking the offsets of literal text and blanking a
     * floating comment.
     *
     * @param quote the quote of a literal still open from the previous line, or 0
     * @return the quote of a literal still open at the end of the line, or 0
     */
    private static char appendCode(StringBuilder joined, BitSet literals, String code, char quote) {
        char open = quote;
        int i = 0;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (open != 0) {
                literals.set(joined.length());
                joined.append(c);
                if (c == open) {
                    if (i + 1 < code.length() && code.charAt(i + 1) == open) {
                        literals.set(joined.length());
                        joined.append(c);
                        i++;
                    } else {
                        open = 0;
                    }
                }
            } else if (c == '\'' || c == '"') {
                open = c;
                literals.set(joined.length());
                joined.append(c);
            } else if (c == '*' && i + 1 < code.length() && code.charAt(i + 1) == '>') {
                joined.append(" ".repeat(code.length() - i));
                break;
            } else {
                joined.append(c);
            }
            i++;
        }
        return open;
    }

    static List<ReplacingPair> parseReplacing(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<ReplacingPair> pairs = new ArrayList<>();
        Matcher m = REPLACING_PAIR.matcher(text);
        while (m.find()) {
            boolean pseudoText = m.group(1) != null;
            String pattern = pseudoText ? m.group(1).trim() : m.group(2);
            String replacement = m.group(3) != null ? m.group(3).trim() : m.group(4);
            pairs.add(new ReplacingPair(pattern, replacement, pseudoText));
        }
        return pairs;
    }

    private static int lineAt(List<int[]> segments, int offset) {
        int line = segments.isEmpty() ? 1 : segments.get(0)[1];
        for (int[] segment : segments) {
            if (segment[0] > offset) {
                break;
            }
            line = segment[1];
        }
        return line;
    }

    private static String stripQuotes(String name) {
        if (name.length() >= 2 && (name.charAt(0) == '\'' || name.charAt(0) == '"')) {
            return name.substring(1, name.length() - 1).trim();
        }
        return name;
    }
}
