package com.mainframe.anonymizer.naming;

import com.mainframe.anonymizer.model.IdentifierCategory;

/**
 * Produces a candidate replacement name. Implementations are pure: the same arguments
 * always give the same candidate. The mapping table validates candidates and retries
 * with the next counter value.
 */
public interface NamingStrategy {

    String generate(String original, IdentifierCategory category, int counter, int targetLength);
}
