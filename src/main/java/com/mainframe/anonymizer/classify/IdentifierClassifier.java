package com.mainframe.anonymizer.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.classify.ScopeContext.Expectation;
import com.mainframe.anonymizer.model.IdentifierCategory;
import com.mainframe.anonymizer.model.SourceLocation;
import com.mainframe.anonymizer.model.SourceRegion;
import com.mainframe.anonymizer.overlay.OverlayRelationship;
import com.mainframe.anonymizer.parser.CobolToken;
import com.mainframe.anonymizer.parser.CobolToken.TokenKind;
import com.mainframe.anonymizer.parser.LayoutAwareTokenizer;
import com.mainframe.anonymizer.parser.ReservedWords;
import com.mainframe.anonymizer.parser.SourceLine;

/**
 * Finds the declarations of user-defined names in a file and assigns each a category.
 *
 * Only declarations are reported: PROGRAM-ID operands, COPY operands, FD/SD/SELECT file
 * names, section and paragraph headers, level-number entries and INDEXED BY names.
 * Other occurrences are references and are substituted later from the mapping table.
 * The result depends only on the file's text.
 */
public class IdentifierClassifier {
    private static final Logger log = LoggerFactory.getLogger(IdentifierClassifier.class);

    private static final Set<String> FILE_KEYWORDS = Set.of("FD", "SD", "SELECT");

    public FileClassification classify(String fileName, List<SourceLine> lines) {
        LayoutAwareTokenizer tokenizer = new LayoutAwareTokenizer(fileName);
        List<List<CobolToken>> tokens = tokenizer.tokenizeAll(lines);

        ScopeContext context = new ScopeContext();
        List<ClassifiedIdentifier> identifiers = new ArrayList<>();
        List<OverlayRelationship> overlays = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            List<CobolToken> significant = tokens.get(i).stream().filter(CobolToken::isSignificant).toList();
            if (!significant.isEmpty()) {
                new LineClassifier(fileName, significant, context, identifiers, overlays).classify();
            }
        }
        context.getStorage().closeAll();

        log.debug("{}: {} declarations, {} overlays", fileName, identifiers.size(), overlays.size());

        return FileClassification.builder()
                .fileName(fileName)
                .lines(lines)
                .tokens(tokens)
                .identifiers(identifiers)
                .overlays(overlays)
                .positions(context.getStorage().getPositions())
                .warnings(tokenizer.getWarnings())
                .build();
    }

    private static final class LineClassifier {
        private final String fileName;
        private final List<CobolToken> sig;
        private final ScopeContext ctx;
        private final List<ClassifiedIdentifier> identifiers;
        private final List<OverlayRelationship> overlays;

        LineClassifier(String fileName, List<CobolToken> sig, ScopeContext ctx,
                       List<ClassifiedIdentifier> identifiers, List<OverlayRelationship> overlays) {
            this.fileName = fileName;
            this.sig = sig;
            this.ctx = ctx;
            this.identifiers = identifiers;
            this.overlays = overlays;
        }

        void classify() {
            if (handleDivisionHeader() || handleLayoutSectionHeader()) {
                return;
            }

            int index = 0;
            CobolToken first = sig.get(0);
            if (first.getKind() == TokenKind.LEVEL_NUMBER && !ctx.isStatementStart()) {
                // the previous sentence is still open, e.g. an OCCURS count on its own line
                first.setKind(TokenKind.NUMERIC_LITERAL);
            }
            if (ctx.getRegion() != SourceRegion.EXECUTABLE && ctx.getRegion() != SourceRegion.HEADER
                    && first.getKind() == TokenKind.LEVEL_NUMBER) {
                index = handleLevelEntry();
            } else if (ctx.isExpecting(Expectation.NONE) && handleProcedureHeader()) {
                return;
            }

            for (int i = index; i < sig.size(); i++) {
                i = handleToken(i);
            }
        }

        /**
         * IDENTIFICATION / ENVIRONMENT / DATA / PROCEDURE DIVISION.
         */
        private boolean handleDivisionHeader() {
            if (sig.size() < 2 || !sig.get(1).isKeyword("DIVISION")) {
                return false;
            }
            String division = sig.get(0).getText().toUpperCase(Locale.ROOT);
            switch (division) {
                case "IDENTIFICATION", "ID", "ENVIRONMENT" -> ctx.enterRegion(SourceRegion.HEADER);
                case "DATA" -> ctx.enterRegion(SourceRegion.LAYOUT);
                case "PROCEDURE" -> ctx.enterRegion(SourceRegion.EXECUTABLE);
                default -> {
                    return false;
                }
            }
            ctx.setStatementStart(true);
            return true;
        }

        /**
         * FILE / WORKING-STORAGE / LOCAL-STORAGE / LINKAGE SECTION close all open records.
         */
        private boolean handleLayoutSectionHeader() {
            if (ctx.getRegion() == SourceRegion.EXECUTABLE || sig.size() < 2
                    || sig.get(0).getKind() != TokenKind.KEYWORD || !sig.get(1).isKeyword("SECTION")) {
                return false;
            }
            ctx.getStorage().closeAll();
            ctx.setExternalRecord(false);
            ctx.setCurrentDeclaration(null);
            ctx.setStatementStart(true);
            return true;
        }

        /**
         * {@code name SECTION.} or a paragraph name alone in Area A.
         */
        private boolean handleProcedureHeader() {
            if (ctx.getRegion() != SourceRegion.EXECUTABLE && ctx.getRegion() != SourceRegion.NONE) {
                return false;
            }
            CobolToken first = sig.get(0);
            if (!first.isIdentifier() || ReservedWords.isSystemIdentifier(first.getText())) {
                return false;
            }
            if (ctx.getRegion() == SourceRegion.EXECUTABLE && sig.size() >= 2 && sig.get(1).isKeyword("SECTION")) {
                declare(first, IdentifierCategory.SECTION_NAME, 0);
                ctx.setStatementStart(true);
                return true;
            }
            boolean inAreaA = first.getStart() < SourceLine.AREA_A_WIDTH;
            boolean alone = sig.size() == 1 || (sig.size() == 2 && sig.get(1).isPeriod());
            if (inAreaA && alone) {
                declare(first, IdentifierCategory.PARAGRAPH_NAME, 0);
                ctx.setStatementStart(true);
                return true;
            }
            return false;
        }

        /**
         * A level-number line: opens the storage entry and classifies its name.
         *
         * @return index of the first token after the entry name
         */
        private int handleLevelEntry() {
            CobolToken levelToken = sig.get(0);
            int level = Integer.parseInt(levelToken.getText());
            CobolToken nameToken = sig.size() > 1 ? sig.get(1) : null;
            String name = nameToken != null && nameToken.isIdentifier() ? nameToken.getText() : null;
            int next = nameToken != null && (nameToken.isIdentifier() || nameToken.isKeyword("FILLER")) ? 2 : 1;

            ctx.setExpectation(Expectation.NONE);
            ctx.setStatementStart(false);
            ctx.setLastLevel(level);

            if (level == 88) {
                if (name != null) {
                    declare(nameToken, IdentifierCategory.CONDITION_NAME, level);
                }
                return next;
            }

            if (level == 1 || level == 77) {
                ctx.setExternalRecord(false);
            }
            ctx.setCurrentDeclaration(null);

            if (level != 66) {
                ctx.getStorage().open(level, name);
            }
            if (name != null && ReservedWords.isSystemIdentifier(name)) {
                declare(nameToken, IdentifierCategory.SYSTEM_RESERVED, level);
            } else if (name != null) {
                IdentifierCategory category = ctx.isExternalRecord()
                        ? IdentifierCategory.CROSS_PROGRAM_NAME : IdentifierCategory.DATA_NAME;
                ctx.setCurrentDeclaration(declare(nameToken, category, level));
            }
            return next;
        }

        /**
         * Classifies the token at {@code i}; returns the index of the last token consumed.
         */
        private int handleToken(int i) {
            CobolToken token = sig.get(i);

            if (token.isPeriod()) {
                ctx.endSentence();
                return i;
            }

            if (token.getKind() == TokenKind.LAYOUT_DESCRIPTOR) {
                ctx.getStorage().describe(token.getPicture(), token.getUsage());
                ctx.setStatementStart(false);
                return i;
            }

            if (ctx.isExpecting(Expectation.OCCURS_COUNT) && handleOccursCount(token)) {
                return i;
            }

            if (token.isIdentifier() && !ctx.isExpecting(Expectation.NONE)) {
                return handleExpectedIdentifier(i);
            }

            int consumed = i;
            String word = token.getText().toUpperCase(Locale.ROOT);
            if (token.getKind() == TokenKind.KEYWORD) {
                consumed = handleKeyword(word, i);
            } else if (token.isIdentifier()) {
                if (word.equals("INCLUDE") && ctx.isStatementStart()) {
                    ctx.setInIncludeStatement(true);
                    ctx.expect(Expectation.FRAGMENT_NAME);
                } else if (ReservedWords.isSystemIdentifier(word)) {
                    declare(token, IdentifierCategory.SYSTEM_RESERVED, 0);
                }
            } else if (!ctx.isExpecting(Expectation.INDEX_NAMES)) {
                // a literal or number in place of the expected name
                ctx.expect(Expectation.NONE);
            }
            ctx.setStatementStart(false);
            return consumed;
        }

        private int handleKeyword(String word, int i) {
            if (ctx.isExpecting(Expectation.INDEX_NAMES) || ctx.isExpecting(Expectation.PROGRAM_NAME)) {
                ctx.expect(Expectation.NONE);
            }
            switch (word) {
                case "PROGRAM-ID" -> ctx.expect(Expectation.PROGRAM_NAME);
                case "COPY" -> {
                    ctx.setInIncludeStatement(true);
                    ctx.expect(Expectation.FRAGMENT_NAME);
                }
                case "OF", "IN" -> {
                    if (ctx.isInIncludeStatement()) {
                        ctx.expect(Expectation.LIBRARY_NAME);
                    }
                }
                case "REDEFINES" -> ctx.expect(Expectation.OVERLAY_TARGET);
                case "INDEXED" -> {
                    if (i + 1 < sig.size() && sig.get(i + 1).isKeyword("BY")) {
                        ctx.expect(Expectation.INDEX_NAMES);
                        return i + 1;
                    }
                }
                case "OCCURS" -> ctx.expect(Expectation.OCCURS_COUNT);
                case "EXTERNAL" -> markExternal();
                default -> {
                    if (FILE_KEYWORDS.contains(word) && ctx.getRegion() != SourceRegion.EXECUTABLE) {
                        ctx.expect(Expectation.FILE_NAME);
                    } else if (word.equals("OPTIONAL") && ctx.isExpecting(Expectation.FILE_NAME)) {
                        return i;
                    } else if (ctx.isExpecting(Expectation.FILE_NAME)) {
                        ctx.expect(Expectation.NONE);
                    }
                }
            }
            return i;
        }

        private int handleExpectedIdentifier(int i) {
            CobolToken token = sig.get(i);
            Expectation expectation = ctx.getExpectation();
            if (expectation != Expectation.INDEX_NAMES) {
                ctx.expect(Expectation.NONE);
            }
            ctx.setStatementStart(false);

            if (ReservedWords.isSystemIdentifier(token.getText())) {
                declare(token, IdentifierCategory.SYSTEM_RESERVED, 0);
                return i;
            }

            switch (expectation) {
                case PROGRAM_NAME -> declare(token, IdentifierCategory.PROGRAM_NAME, 0);
                case FRAGMENT_NAME -> declare(token, IdentifierCategory.INCLUDED_FRAGMENT_NAME, 0);
                case FILE_NAME -> declare(token, IdentifierCategory.FILE_RECORD_NAME, 0);
                case INDEX_NAMES -> declare(token, IdentifierCategory.INDEX_NAME, 0);
                case OVERLAY_TARGET -> recordOverlay(token);
                default -> {
                    // library names of COPY ... OF are left alone
                }
            }
            return i;
        }

        /**
         * {@code OCCURS n [TO m] [TIMES]}: the counts may follow on later lines.
         *
         * @return whether the token belongs to the OCCURS clause
         */
        private boolean handleOccursCount(CobolToken token) {
            if (token.getKind() == TokenKind.NUMERIC_LITERAL) {
                ctx.getStorage().occurs(parseCount(token.getText()));
                ctx.setStatementStart(false);
                return true;
            }
            if (token.isKeyword("TO")) {
                return true;
            }
            ctx.expect(Expectation.NONE);
            return false;
        }

        private void recordOverlay(CobolToken target) {
            ClassifiedIdentifier overlay = ctx.getCurrentDeclaration();
            int declaredPosition = ctx.getStorage().redefine(target.getText());
            if (overlay == null) {
                // FILLER REDEFINES only shifts storage
                return;
            }
            OverlayRelationship relationship = OverlayRelationship.builder()
                    .overlayName(overlay.getName())
                    .targetName(target.getText())
                    .nestingDepth(ctx.nestingDepth())
                    .levelNumber(ctx.getLastLevel())
                    .declaredPosition(declaredPosition)
                    .location(location(target))
                    .build();
            overlays.add(relationship);
        }

        private void markExternal() {
            ClassifiedIdentifier declaration = ctx.getCurrentDeclaration();
            if (declaration == null) {
                return;
            }
            declaration.setExternallyVisible(true);
            int level = declaration.getLevelNumber();
            if (declaration.getCategory() == IdentifierCategory.DATA_NAME && (level == 1 || level == 77)) {
                declaration.setCategory(IdentifierCategory.CROSS_PROGRAM_NAME);
                ctx.setExternalRecord(true);
            }
        }

        private ClassifiedIdentifier declare(CobolToken token, IdentifierCategory category, int level) {
            boolean external = category == IdentifierCategory.CROSS_PROGRAM_NAME;
            ClassifiedIdentifier identifier = new ClassifiedIdentifier(token.getText(), category,
                    location(token), level, external);
            identifiers.add(identifier);
            return identifier;
        }

        private SourceLocation location(CobolToken token) {
            return new SourceLocation(fileName, token.getLineNumber(), SourceLine.absoluteColumn(token.getStart()));
        }

        private static int parseCount(String text) {
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                return 0;
            }
        }
    }
}
