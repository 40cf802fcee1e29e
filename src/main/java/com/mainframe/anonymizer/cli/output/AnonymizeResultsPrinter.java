package com.mainframe.anonymizer.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.cli.model.AnonymizeOptions;
import com.mainframe.anonymizer.cli.model.ValidatedAnonymizeOptions;
import com.mainframe.anonymizer.engine.AnonymizationResult;
import com.mainframe.anonymizer.overlay.OverlayResolution;
import com.mainframe.anonymizer.validation.ValidationIssue;
import com.mainframe.anonymizer.validation.ValidationReport;
import com.mainframe.anonymizer.validation.ValidationSeverity;

/**
 * Responsible only for printing CLI output for the "anonymize" command.
 * No validation, no execution.
 */
public class AnonymizeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnonymizeResultsPrinter.class);

    public void printBanner(AnonymizeOptions o, ValidatedAnonymizeOptions v) {
        log.info("=================================================");
        log.info("COBOL Source Anonymizer");
        log.info("=================================================");
        log.info("Input Directory: {}", v.getNormalizedInputDir());
        log.info("Output Directory: {}", v.getNormalizedOutputDir() != null ? v.getNormalizedOutputDir() : "None");
        log.info("Copybook Directories: {}", v.getCopybookDirs().isEmpty() ? "None" : v.getCopybookDirs());
        log.info("Extensions: {}", String.join(", ", v.getExtensions()));
        log.info("Encoding: {}", v.getCharset().name());
        log.info("Naming Scheme: {}", o.getNamingScheme());
        log.info("Load Mappings: {}", o.getMappingFile() != null ? o.getMappingFile().toAbsolutePath() : "None");
        log.info("Save Mappings: {}", o.getMappingOutput() != null ? o.getMappingOutput().toAbsolutePath() : "None");
        log.info("Report: {}", o.getReportFile() != null ? o.getReportFile().toAbsolutePath() : "None");
        if (o.isAnonymizeLiterals()) {
            log.info("Literals: anonymized");
        }
        if (o.isValidateOnly()) {
            log.info("Validate Only: no sources will be rewritten");
        } else if (o.isDryRun()) {
            log.info("Dry Run: no sources will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(AnonymizeOptions o, AnonymizationResult result) {
        log.info("");
        log.info("=================================================");
        log.info(o.isDryRun() ? "DRY RUN SUCCESSFUL" : "ANONYMIZATION SUCCESSFUL");
        log.info("=================================================");
        printSummary(result);
        log.info("=================================================");
    }

    public void printFailure(AnonymizationResult result) {
        log.error("Anonymization failed: {}", result.getErrorMessage());
        List<String> failedFiles = result.getFailedFiles();
        if (failedFiles != null && !failedFiles.isEmpty()) {
            log.error("Failed files:");
            failedFiles.forEach(f -> log.error("  {}", f));
        }
        if (result.getProcessingOrder() != null && !result.getProcessingOrder().isEmpty()) {
            printSummary(result);
        }
    }

    public void printValidation(ValidationReport report) {
        log.info("");
        log.info("=================================================");
        log.info(report.isValid() ? "VALIDATION PASSED" : "VALIDATION FAILED");
        log.info("=================================================");
        log.info("Validated {} files, {} lines", report.getFilesValidated(), report.getLinesValidated());
        log.info("Errors: {}", report.errors().size());
        log.info("Warnings: {}", report.warnings().size());
        for (ValidationIssue issue : report.getIssues()) {
            if (issue.getSeverity() == ValidationSeverity.ERROR) {
                log.error("  {}", issue);
            } else {
                log.info("  {}", issue);
            }
        }
        log.info("=================================================");
    }

    private void printSummary(AnonymizationResult result) {
        if (result.getOutputPath() != null) {
            log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        }
        log.info("Files Processed: {}", result.getFilesProcessed());
        log.info("Files Written: {}", result.getFilesWritten());
        log.info("Identifiers Mapped: {}", result.getIdentifiersMapped());
        log.info("Lines Changed: {}", result.getLinesChanged());

        List<OverlayResolution> overlays = result.getOverlays();
        if (overlays != null && !overlays.isEmpty()) {
            long degraded = overlays.stream().filter(OverlayResolution::isDegraded).count();
            log.info("REDEFINES Resolved: {} ({} degraded)", overlays.size(), degraded);
        }

        if (result.getDiagnostics() != null && !result.getDiagnostics().getInfos().isEmpty()) {
            log.info("");
            result.getDiagnostics().getInfos().forEach(i -> log.info("Note: {}", i));
        }

        if (result.getDiagnostics() != null && result.getDiagnostics().hasWarnings()) {
            log.info("");
            log.info("Warnings: {}", result.getDiagnostics().getWarnings().size());
            result.getDiagnostics().getWarnings().forEach(w -> log.info("  {}", w));
        }
    }
}
