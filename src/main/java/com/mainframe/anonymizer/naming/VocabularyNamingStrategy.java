package com.mainframe.anonymizer.naming;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

import com.mainframe.anonymizer.model.IdentifierCategory;

/**
 * {@code ADJECTIVE-NOUN-counter} names. The word pair is chosen by the MD5 of the
 * upper-cased original name, so a name keeps its words across runs and machines;
 * changing the hash would make earlier mapping files unreproducible.
 *
 * Names longer than the target length get shorter words, never a shorter counter.
 * When even one-letter words do not fit, the counter strategy is used.
 */
public class VocabularyNamingStrategy implements NamingStrategy {

    private final Vocabulary vocabulary;
    private final NamingStrategy fallback = new CounterNamingStrategy();

    public VocabularyNamingStrategy(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public String generate(String original, IdentifierCategory category, int counter, int targetLength) {
        long hash = hash(original);
        int adjectiveCount = vocabulary.getAdjectives().size();
        int nounCount = vocabulary.getNouns().size();
        String adjective = vocabulary.getAdjectives().get((int) Long.remainderUnsigned(hash, adjectiveCount));
        String noun = vocabulary.getNouns().get(
                (int) Long.remainderUnsigned(Long.divideUnsigned(hash, adjectiveCount), nounCount));

        String suffix = String.valueOf(counter);
        String name = adjective + "-" + noun + "-" + suffix;
        if (name.length() <= targetLength) {
            return name;
        }

        int available = targetLength - suffix.length() - 2;
        if (available < 2) {
            return fallback.generate(original, category, counter, targetLength);
        }
        int adjectiveLength = Math.max(1, available / 2);
        int nounLength = Math.max(1, available - adjectiveLength);
        name = truncate(adjective, adjectiveLength) + "-" + truncate(noun, nounLength) + "-" + suffix;
        if (name.length() > targetLength) {
            return fallback.generate(original, category, counter, targetLength);
        }
        return name;
    }

    /**
     * First eight bytes of MD5(upper-cased name), big-endian, read as an unsigned value.
     */
    static long hash(String original) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(original.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String truncate(String word, int length) {
        return word.length() <= length ? word : word.substring(0, length);
    }
}
