package com.mainframe.anonymizer.parser;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * A COPY (or INCLUDE) statement found in a consumer file.
 */
@Data
@Builder
public class IncludeStatement {
    private String fragmentName;
    private String library;
    private List<ReplacingPair> replacing;
    private String consumerFile;
    private int line;
    private String rawText;
}
