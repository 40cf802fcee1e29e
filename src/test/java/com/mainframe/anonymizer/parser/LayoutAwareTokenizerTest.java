package com.mainframe.anonymizer.parser;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.mainframe.anonymizer.model.UsageType;
import com.mainframe.anonymizer.parser.CobolToken.TokenKind;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LayoutAwareTokenizer.
 */
class LayoutAwareTokenizerTest {

    private final LayoutAwareTokenizer tokenizer = new LayoutAwareTokenizer("TEST.cbl");

    @Test
    void testTokensReproduceCodeZone() {
        SourceLine line = line("05  WS-AMOUNT   PIC S9(7)V99 COMP-3.   ");

        List<CobolToken> tokens = tokenizer.tokenize(line, false);

        String joined = tokens.stream().map(CobolToken::getText).collect(Collectors.joining());
        assertThat(joined).isEqualTo(line.getCodeZone());
    }

    @Test
    void testLevelEntryWithPictureAndUsage() {
        List<CobolToken> tokens = significant(line("05  WS-AMOUNT   PIC S9(7)V99 COMP-3."));

        assertThat(tokens).extracting(CobolToken::getKind).containsExactly(
                TokenKind.LEVEL_NUMBER, TokenKind.IDENTIFIER, TokenKind.LAYOUT_DESCRIPTOR, TokenKind.PUNCTUATION);
        CobolToken descriptor = tokens.get(2);
        assertThat(descriptor.getText()).isEqualTo("PIC S9(7)V99 COMP-3");
        assertThat(descriptor.getPicture().getIntegerDigits()).isEqualTo(7);
        assertThat(descriptor.getUsage()).isEqualTo(UsageType.PACKED_DECIMAL);
    }

    @Test
    void testPictureWithoutUsageStopsBeforePeriod() {
        List<CobolToken> tokens = significant(line("05  CUST-NAME PIC X(30)."));

        assertThat(tokens.get(2).getText()).isEqualTo("PIC X(30)");
        assertThat(tokens.get(3).isPeriod()).isTrue();
    }

    @Test
    void testStandaloneUsageIsLayoutDescriptor() {
        List<CobolToken> tokens = significant(line("05  WS-PTR COMP-5."));

        assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.LAYOUT_DESCRIPTOR);
        assertThat(tokens.get(2).getUsage()).isEqualTo(UsageType.COMP_5);
    }

    @Test
    void testLiteralContentIsNotTokenized() {
        List<CobolToken> tokens = significant(line("    MOVE 'COPY CUSTREC.' TO WS-TEXT."));

        assertThat(tokens).extracting(CobolToken::getKind).containsExactly(
                TokenKind.KEYWORD, TokenKind.STRING_LITERAL, TokenKind.KEYWORD, TokenKind.IDENTIFIER,
                TokenKind.PUNCTUATION);
        assertThat(tokens.get(1).getText()).isEqualTo("'COPY CUSTREC.'");
    }

    @Test
    void testHexLiteral() {
        List<CobolToken> tokens = significant(line("    MOVE X'0D25' TO WS-CRLF."));

        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(tokens.get(1).getText()).isEqualTo("X'0D25'");
    }

    @Test
    void testNumberIsLevelOnlyAtLineStart() {
        List<CobolToken> tokens = significant(line("    MOVE 5 TO WS-COUNT."));

        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.NUMERIC_LITERAL);
    }

    @Test
    void testInlineComment() {
        List<CobolToken> tokens = tokenizer.tokenize(line("    MOVE A TO B. *> WS-SECRET"), false);

        assertThat(tokens.get(tokens.size() - 1).getKind()).isEqualTo(TokenKind.COMMENT);
        assertThat(tokens).filteredOn(CobolToken::isIdentifier).extracting(CobolToken::getText)
                .containsExactly("A", "B");
    }

    @Test
    void testCommentLineHasNoTokens() {
        SourceLine comment = SourceLineSplitter.split("      * 01 WS-HIDDEN PIC X.", 1);

        assertThat(tokenizer.tokenize(comment, false)).isEmpty();
    }

    @Test
    void testOperatorsAndPunctuation() {
        List<CobolToken> tokens = significant(line("    COMPUTE WS-A = WS-B ** 2 + (WS-C / 3)."));

        assertThat(tokens).filteredOn(t -> t.getKind() == TokenKind.OPERATOR).extracting(CobolToken::getText)
                .containsExactly("=", "**", "+", "/");
        assertThat(tokens).filteredOn(t -> t.getKind() == TokenKind.PUNCTUATION).extracting(CobolToken::getText)
                .containsExactly("(", ")", ".");
    }

    @Test
    void testTokenStartIsOffsetInCodeZone() {
        List<CobolToken> tokens = significant(line("05  WS-FLAG PIC X."));

        assertThat(tokens.get(1).getStart()).isEqualTo(4);
        assertThat(SourceLine.absoluteColumn(tokens.get(1).getStart())).isEqualTo(12);
    }

    @Test
    void testIncompletePictureIsReported() {
        LayoutAwareTokenizer local = new LayoutAwareTokenizer("BAD.cpy");

        List<CobolToken> tokens = local.tokenize(line("05  WS-FLAG PIC"), false);

        assertThat(local.getWarnings()).hasSize(1);
        assertThat(local.getWarnings().get(0)).contains("BAD.cpy:1").contains("Unknown layout descriptor");
        assertThat(tokens).filteredOn(t -> t.getKind() == TokenKind.LAYOUT_DESCRIPTOR).isEmpty();
    }

    @Test
    void testUnknownIndicatorIsReported() {
        LayoutAwareTokenizer local = new LayoutAwareTokenizer("ODD.cbl");

        local.tokenize(SourceLineSplitter.split("000100X    MOVE A TO B.", 1), false);

        assertThat(local.getWarnings()).hasSize(1);
        assertThat(local.getWarnings().get(0)).contains("indicator");
    }

    @Test
    void testUnterminatedLiteralOnlyReportedWithoutContinuation() {
        LayoutAwareTokenizer local = new LayoutAwareTokenizer("LIT.cbl");
        SourceLine open = line("    MOVE 'ABC");

        local.tokenize(open, true);
        assertThat(local.getWarnings()).isEmpty();

        local.tokenize(open, false);
        assertThat(local.getWarnings()).hasSize(1);
    }

    @Test
    void testIsLevelNumber() {
        assertThat(LayoutAwareTokenizer.isLevelNumber("01")).isTrue();
        assertThat(LayoutAwareTokenizer.isLevelNumber("49")).isTrue();
        assertThat(LayoutAwareTokenizer.isLevelNumber("66")).isTrue();
        assertThat(LayoutAwareTokenizer.isLevelNumber("88")).isTrue();
        assertThat(LayoutAwareTokenizer.isLevelNumber("50")).isFalse();
        assertThat(LayoutAwareTokenizer.isLevelNumber("100")).isFalse();
    }

    private List<CobolToken> significant(SourceLine line) {
        return tokenizer.tokenize(line, false).stream().filter(CobolToken::isSignificant).toList();
    }

    private static SourceLine line(String code) {
        return SourceLineSplitter.split("       " + code, 1);
    }
}
