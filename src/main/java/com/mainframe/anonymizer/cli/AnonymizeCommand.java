package com.mainframe.anonymizer.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.cli.exception.OptionsValidationException;
import com.mainframe.anonymizer.cli.model.AnonymizeOptions;
import com.mainframe.anonymizer.cli.model.ValidatedAnonymizeOptions;
import com.mainframe.anonymizer.cli.output.AnonymizeResultsPrinter;
import com.mainframe.anonymizer.cli.validation.AnonymizeOptionsValidator;
import com.mainframe.anonymizer.engine.AnonymizationEngine;
import com.mainframe.anonymizer.engine.AnonymizationResult;
import com.mainframe.anonymizer.engine.AnonymizerConfig;
import com.mainframe.anonymizer.validation.ValidationReport;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that anonymizes a directory of COBOL sources.
 */
@Command(
        name = "anonymize",
        mixinStandardHelpOptions = true,
        version = "cobol-anonymizer 1.0.0",
        description = "Replaces user-defined COBOL names with consistent generated names, keeping the column layout intact."
)
public class AnonymizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnonymizeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @Mixin
    private AnonymizeOptions options = new AnonymizeOptions();

    private final AnonymizeOptionsValidator validator = new AnonymizeOptionsValidator();
    private final AnonymizeResultsPrinter printer = new AnonymizeResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedAnonymizeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Invalid options:");
            e.getErrors().forEach(error -> log.error("  {}", error));
            return EXIT_USAGE;
        }

        printer.printBanner(options, validated);

        AnonymizerConfig config = AnonymizerConfig.builder()
                .inputDir(validated.getNormalizedInputDir())
                .outputDir(validated.getNormalizedOutputDir())
                .copybookDirs(validated.getCopybookDirs())
                .extensions(validated.getExtensions())
                .charset(validated.getCharset())
                .namingScheme(options.getNamingScheme())
                .mappingFile(options.getMappingFile())
                .mappingOutput(options.getMappingOutput())
                .reportFile(options.getReportFile())
                .anonymizeLiterals(options.isAnonymizeLiterals())
                .validateOnly(options.isValidateOnly())
                .dryRun(options.isDryRun())
                .overwrite(options.isOverwrite())
                .verbose(options.isVerbose())
                .build();

        if (config.isValidateOnly()) {
            return validate(config);
        }

        try {
            AnonymizationResult result = new AnonymizationEngine(config).run();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILURE;
            }
            printer.printSuccess(options, result);
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("Anonymization failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    private int validate(AnonymizerConfig config) {
        try {
            ValidationReport report = new AnonymizationEngine(config).validate();
            printer.printValidation(report);
            return report.isValid() ? EXIT_OK : EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Validation failed with I/O error", e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Validation failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger("com.mainframe.anonymizer");
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
