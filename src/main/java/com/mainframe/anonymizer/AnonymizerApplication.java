package com.mainframe.anonymizer;

import com.mainframe.anonymizer.cli.AnonymizeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the COBOL source anonymizer.
 * Rewrites a batch of COBOL programs and copybooks with consistent, meaningless names
 * while keeping the fixed column layout intact.
 */
public class AnonymizerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnonymizeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
