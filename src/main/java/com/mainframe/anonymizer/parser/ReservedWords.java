package com.mainframe.anonymizer.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * COBOL reserved words and system interface names (CICS, DB2), loaded from
 * {@code /cobol/reserved-words.txt} and {@code /cobol/system-identifiers.txt}.
 */
@UtilityClass
public class ReservedWords {

    private static final Set<String> RESERVED = load("/cobol/reserved-words.txt");
    private static final Set<String> SYSTEM = load("/cobol/system-identifiers.txt");

    public static boolean isReserved(String word) {
        return word != null && RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * CICS/DB2 interface names and anything with a CICS EIB or DFH prefix.
     */
    public static boolean isSystemIdentifier(String word) {
        if (word == null) {
            return false;
        }
        String upper = word.toUpperCase(Locale.ROOT);
        return SYSTEM.contains(upper) || upper.startsWith("EIB") || upper.startsWith("DFH");
    }

    public static Set<String> all() {
        return RESERVED;
    }

    private static Set<String> load(String resource) {
        Set<String> words = new HashSet<>();
        try (InputStream in = ReservedWords.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + resource);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim();
                if (!word.isEmpty() && !word.startsWith("#")) {
                    words.add(word.toUpperCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
        return Collections.unmodifiableSet(words);
    }
}
