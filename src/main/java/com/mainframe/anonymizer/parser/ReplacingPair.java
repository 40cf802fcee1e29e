package com.mainframe.anonymizer.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One {@code pattern BY replacement} operand of a COPY ... REPLACING statement.
 */
@Data
@AllArgsConstructor
public class ReplacingPair {
    private String pattern;
    private String replacement;
    private boolean pseudoText;
}
