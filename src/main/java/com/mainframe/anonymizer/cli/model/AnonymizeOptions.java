package com.mainframe.anonymizer.cli.model;

import java.nio.file.Path;

import com.mainframe.anonymizer.naming.NamingScheme;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "anonymize" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnonymizeOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Directory containing the COBOL programs and copybooks")
	private Path inputDir;

	@Option(names = { "--output", "-o" }, description = "Output directory for the rewritten sources (required unless --dry-run or --validate-only)")
	private Path outputDir;

	@Option(names = { "--copybook-dirs",
			"-c" }, description = "Additional directories for resolving COPY statements (comma-separated)")
	private String copybookDirs;

	@Option(names = {
			"--extensions" }, defaultValue = ".cob,.cbl,.cpy,.copy", description = "Source file extensions (comma-separated, default: ${DEFAULT-VALUE})")
	private String extensions;

	@Option(names = {
			"--encoding" }, defaultValue = "ISO-8859-1", description = "Character encoding of the sources (default: ${DEFAULT-VALUE})")
	private String encoding;

	@Option(names = { "--naming-scheme",
			"-s" }, defaultValue = "CORPORATE", description = "Naming scheme: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private NamingScheme namingScheme;

	@Option(names = { "--load-mappings" }, description = "Mapping state of an earlier run to extend")
	private Path mappingFile;

	@Option(names = { "--save-mappings" }, description = "Where to save the mapping state (JSON)")
	private Path mappingOutput;

	@Option(names = { "--report" }, description = "Where to write the mapping report")
	private Path reportFile;

	@Option(names = { "--anonymize-literals" }, description = "Also replace the text of alphanumeric literals")
	private boolean anonymizeLiterals;

	@Option(names = { "--validate-only" }, description = "Check columns, COPY references and name lengths; rewrite nothing")
	private boolean validateOnly;

	@Option(names = { "--dry-run" }, description = "Classify and map only; write no sources")
	private boolean dryRun;

	@Option(names = { "--overwrite", "-f" }, description = "Overwrite existing files in the output directory")
	private boolean overwrite;

	@Option(names = { "--verbose", "-v" }, description = "Log at DEBUG level")
	private boolean verbose;

}
