package com.mainframe.anonymizer.transform;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.exception.ColumnOverflowException;
import com.mainframe.anonymizer.mapping.MappingEntry;
import com.mainframe.anonymizer.mapping.MappingTable;
import com.mainframe.anonymizer.naming.LiteralObfuscator;
import com.mainframe.anonymizer.overlay.OverlayTracker;
import com.mainframe.anonymizer.parser.CobolToken;
import com.mainframe.anonymizer.parser.CobolToken.TokenKind;
import com.mainframe.anonymizer.parser.SourceLine;

/**
 * Rewrites the lines of one file, replacing identifiers with their mapped names.
 *
 * Keywords, layout descriptors, literals and comments are copied as they are, so
 * everything outside a renamed identifier keeps its bytes and columns. One instance
 * handles one file from top to bottom; COPY statements may span lines.
 *
 * With a {@link LiteralObfuscator}, closed literals are masked as well, except COPY
 * operands, literals on continuation lines and literals naming a known identifier.
 */
public class LineTransformer {
    private static final Logger log = LoggerFactory.getLogger(LineTransformer.class);

    private final String fileName;
    private final MappingTable table;
    private final OverlayTracker overlays;
    private final LiteralObfuscator literals;

    private boolean continuationLine;
    private boolean inIncludeStatement;
    private boolean fragmentNext;
    private boolean libraryNext;
    private boolean overlayTargetNext;

    public LineTransformer(String fileName, MappingTable table, OverlayTracker overlays) {
        this(fileName, table, overlays, null);
    }

    public LineTransformer(String fileName, MappingTable table, OverlayTracker overlays,
            LiteralObfuscator literals) {
        this.fileName = fileName;
        this.table = table;
        this.overlays = overlays;
        this.literals = literals;
    }

    /**
     * Returns the rewritten physical line, without its line terminator.
     *
     * @throws ColumnOverflowException when the new code area no longer fits in columns 8-72
     */
    public String transform(SourceLine line, List<CobolToken> tokens) {
        if (line.isComment() || tokens.isEmpty()) {
            return line.getRaw();
        }
        continuationLine = line.isContinuation();

        StringBuilder code = new StringBuilder(line.getCodeZone().length() + 8);
        boolean changed = false;
        CobolToken overflowing = null;
        int overflowingStart = 0;
        CobolToken lastRenamed = null;
        int lastRenamedStart = 0;

        for (CobolToken token : tokens) {
            String text = rewrite(token);
            int newStart = code.length();
            code.append(text);

            if (!text.equals(token.getText())) {
                changed = true;
                lastRenamed = token;
                lastRenamedStart = newStart;
                if (overflowing == null && code.length() > SourceLine.CODE_WIDTH) {
                    overflowing = token;
                    overflowingStart = newStart;
                }
            }
        }

        if (!changed) {
            return line.getRaw();
        }

        String newCode = fitCodeArea(code.toString());
        if (newCode.length() > SourceLine.CODE_WIDTH) {
            CobolToken culprit = overflowing != null ? overflowing : lastRenamed;
            int column = SourceLine.absoluteColumn(overflowing != null ? overflowingStart : lastRenamedStart);
            throw new ColumnOverflowException(fileName, line.getLineNumber(), column, culprit.getText(),
                    newCode.length(), SourceLine.CODE_WIDTH);
        }
        return line.reassemble(newCode);
    }

    private String rewrite(CobolToken token) {
        TokenKind kind = token.getKind();
        if (kind == TokenKind.WHITESPACE || kind == TokenKind.COMMENT) {
            return token.getText();
        }

        if (token.isPeriod()) {
            inIncludeStatement = false;
            fragmentNext = false;
            libraryNext = false;
            overlayTargetNext = false;
            return token.getText();
        }

        if (token.isKeyword("COPY") || isIncludeWord(token)) {
            inIncludeStatement = true;
            fragmentNext = true;
            return token.getText();
        }
        if (inIncludeStatement && (token.isKeyword("OF") || token.isKeyword("IN"))) {
            libraryNext = true;
            return token.getText();
        }
        if (token.isKeyword("REDEFINES")) {
            overlayTargetNext = true;
            return token.getText();
        }

        if (kind == TokenKind.STRING_LITERAL) {
            if (fragmentNext) {
                fragmentNext = false;
                return rewriteQuotedFragment(token.getText());
            }
            return maskLiteral(token.getText());
        }

        if (!token.isIdentifier()) {
            fragmentNext = false;
            overlayTargetNext = false;
            return token.getText();
        }

        fragmentNext = false;
        if (libraryNext) {
            libraryNext = false;
            return token.getText();
        }
        if (overlayTargetNext) {
            overlayTargetNext = false;
            return overlays.resolvedTargetName(token.getText(), table);
        }
        return replacementOf(token.getText());
    }

    private boolean isIncludeWord(CobolToken token) {
        return token.isIdentifier() && token.getText().equalsIgnoreCase("INCLUDE");
    }

    private String replacementOf(String identifier) {
        if (table.isNeverRename(identifier)) {
            return identifier;
        }
        return table.lookup(identifier).map(MappingEntry::getReplacement).orElse(identifier);
    }

    private String maskLiteral(String literal) {
        if (literals == null || continuationLine || inIncludeStatement) {
            return literal;
        }
        String content = literal.length() >= 2 ? literal.substring(1, literal.length() - 1) : literal;
        if (table.isNeverRename(content) || table.lookup(content).isPresent()) {
            return literal;
        }
        return literals.obfuscate(literal);
    }

    /**
     * {@code COPY 'NAME'}: renames the quoted copybook name and keeps the quotes.
     */
    private String rewriteQuotedFragment(String literal) {
        if (literal.length() < 2) {
            return literal;
        }
        char quote = literal.charAt(literal.length() - 1);
        int open = literal.indexOf(quote);
        if (open < 0 || open == literal.length() - 1) {
            return literal;
        }
        String name = literal.substring(open + 1, literal.length() - 1);
        String replacement = replacementOf(name);
        if (replacement.equals(name)) {
            return literal;
        }
        log.debug("{}: quoted copybook name {} -> {}", fileName, name, replacement);
        return literal.substring(0, open + 1) + replacement + quote;
    }

    /**
     * Trailing blanks absorb a longer code area.
     */
    private static String fitCodeArea(String code) {
        if (code.length() <= SourceLine.CODE_WIDTH) {
            return code;
        }
        int end = code.length();
        while (end > SourceLine.CODE_WIDTH && code.charAt(end - 1) == ' ') {
            end--;
        }
        return code.substring(0, end);
    }
}
