package com.mainframe.anonymizer.naming;

import java.util.List;
import java.util.Random;

/**
 * Replaces the text of alphanumeric literals with vocabulary words of the same length.
 *
 * The words come from a vocabulary other than the one used for identifiers, so a
 * masked literal never reads like a renamed data item. The replacement is seeded by
 * the MD5 of the literal text: the same text always gets the same words.
 * Leading and trailing blanks are kept so fixed-width values stay aligned.
 */
public class LiteralObfuscator {

    private final Vocabulary vocabulary;

    public LiteralObfuscator(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Picks the vocabulary after the one of the identifier scheme; NUMERIC takes the first.
     */
    public static LiteralObfuscator forIdentifierScheme(NamingScheme scheme) {
        Vocabulary[] all = Vocabulary.values();
        Vocabulary own = scheme.getVocabulary();
        int next = own == null ? 0 : (own.ordinal() + 1) % all.length;
        return new LiteralObfuscator(all[next]);
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    /**
     * Masks a quoted literal token such as {@code 'HELLO WORLD'}. Prefixed literals
     * ({@code X'..'}, {@code N'..'}), literals left open for a continuation line and
     * blank literals are returned unchanged.
     */
    public String obfuscate(String literal) {
        if (literal.length() < 3) {
            return literal;
        }
        char quote = literal.charAt(0);
        if ((quote != '\'' && quote != '"') || !isClosed(literal, quote)) {
            return literal;
        }
        String content = literal.substring(1, literal.length() - 1);
        int start = 0;
        while (start < content.length() && content.charAt(start) == ' ') {
            start++;
        }
        int end = content.length();
        while (end > start && content.charAt(end - 1) == ' ') {
            end--;
        }
        if (start == end) {
            return literal;
        }
        String core = content.substring(start, end);
        return quote + content.substring(0, start) + replacementText(core) + content.substring(end) + quote;
    }

    /**
     * Words alternating adjective and noun, cut to the length of {@code text}.
     * A single character becomes a letter. The result never ends in a blank.
     */
    String replacementText(String text) {
        Random random = new Random(VocabularyNamingStrategy.hash(text));
        int length = text.length();
        if (length == 1) {
            return String.valueOf((char) ('A' + random.nextInt(26)));
        }

        StringBuilder words = new StringBuilder(length + 16);
        boolean adjective = true;
        while (words.length() < length) {
            if (words.length() > 0) {
                words.append(' ');
            }
            List<String> pool = adjective ? vocabulary.getAdjectives() : vocabulary.getNouns();
            words.append(pool.get(random.nextInt(pool.size())));
            adjective = !adjective;
        }
        words.setLength(length);
        for (int i = length - 1; i >= 0 && words.charAt(i) == ' '; i--) {
            words.setCharAt(i, '-');
        }
        return words.toString();
    }

    private static boolean isClosed(String literal, char quote) {
        int i = 1;
        while (i < literal.length()) {
            if (literal.charAt(i) == quote) {
                if (i + 1 < literal.length() && literal.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i == literal.length() - 1;
            }
            i++;
        }
        return false;
    }
}
