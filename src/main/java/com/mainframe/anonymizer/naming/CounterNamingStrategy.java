package com.mainframe.anonymizer.naming;

import com.mainframe.anonymizer.model.IdentifierCategory;

/**
 * Category prefix followed by the counter, zero-padded to the target length.
 * {@code CUSTOMER-NAME} as data name number 7 becomes {@code D000000000007}.
 */
public class CounterNamingStrategy implements NamingStrategy {

    @Override
    public String generate(String original, IdentifierCategory category, int counter, int targetLength) {
        String prefix = category.getPrefix();
        String digits = String.valueOf(counter);
        int width = targetLength - prefix.length();
        if (digits.length() >= width) {
            return prefix + digits;
        }
        return prefix + "0".repeat(width - digits.length()) + digits;
    }
}
