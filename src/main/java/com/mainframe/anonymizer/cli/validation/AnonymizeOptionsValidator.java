package com.mainframe.anonymizer.cli.validation;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import com.mainframe.anonymizer.cli.exception.OptionsValidationException;
import com.mainframe.anonymizer.cli.model.AnonymizeOptions;
import com.mainframe.anonymizer.cli.model.ValidatedAnonymizeOptions;

public class AnonymizeOptionsValidator {

	public ValidatedAnonymizeOptions validate(AnonymizeOptions o) {
		List<String> errors = new ArrayList<>();

		Path inputDir = null;
		if (o.getInputDir() == null) {
			errors.add("Input directory is required (--input / -i).");
		} else if (!existsDirectory(o.getInputDir())) {
			errors.add("Input directory does not exist or is not a directory: " + o.getInputDir());
		} else {
			inputDir = o.getInputDir().toAbsolutePath().normalize();
		}

		Path outputDir = null;
		if (o.getOutputDir() == null) {
			if (!o.isDryRun() && !o.isValidateOnly()) {
				errors.add("Output directory is required (--output / -o) unless --dry-run or --validate-only is given.");
			}
		} else if (!o.isValidateOnly()) {
			outputDir = o.getOutputDir().toAbsolutePath().normalize();
			if (inputDir != null && outputDir.equals(inputDir)) {
				errors.add("Output directory must differ from the input directory: " + outputDir);
			} else if (Files.isRegularFile(outputDir)) {
				errors.add("Output path is a file, not a directory: " + outputDir);
			} else if (!o.isOverwrite() && !o.isDryRun() && isNonEmptyDirectory(outputDir, errors)) {
				errors.add("Output directory is not empty: " + outputDir + ". Use --overwrite to replace files.");
			}
		}

		if (o.getMappingFile() != null && !Files.isRegularFile(o.getMappingFile())) {
			errors.add("Mapping file does not exist: " + o.getMappingFile());
		}

		Charset charset = parseCharset(o.getEncoding(), errors);
		List<String> extensions = parseExtensions(o.getExtensions(), errors);
		List<Path> copybookDirs = parseCopybookDirs(o.getCopybookDirs(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedAnonymizeOptions(inputDir, outputDir, copybookDirs, extensions, charset);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isNonEmptyDirectory(Path dir, List<String> errors) {
		if (!Files.isDirectory(dir)) {
			return false;
		}
		try (Stream<Path> entries = Files.list(dir)) {
			return entries.findAny().isPresent();
		} catch (IOException e) {
			errors.add("Cannot read output directory " + dir + ": " + e.getMessage());
			return false;
		}
	}

	private static Charset parseCharset(String name, List<String> errors) {
		if (name == null || name.isBlank()) {
			errors.add("Encoding must not be blank (--encoding).");
			return null;
		}
		try {
			if (Charset.isSupported(name.trim())) {
				return Charset.forName(name.trim());
			}
		} catch (IllegalCharsetNameException e) {
			errors.add("Illegal encoding name: " + name);
			return null;
		}
		errors.add("Unsupported encoding: " + name);
		return null;
	}

	private static List<String> parseExtensions(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			errors.add("At least one source file extension is required (--extensions).");
			return List.of();
		}
		List<String> result = Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty())
				.map(s -> s.startsWith(".") ? s : "." + s).map(s -> s.toLowerCase(Locale.ROOT)).distinct().toList();
		if (result.isEmpty()) {
			errors.add("At least one source file extension is required (--extensions).");
		}
		return result;
	}

	private static List<Path> parseCopybookDirs(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}

		List<Path> result = Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).map(Path::of)
				.toList();

		for (Path p : result) {
			if (!existsDirectory(p)) {
				errors.add("Copybook dir does not exist or is not a directory: " + p);
			}
		}

		return result;
	}
}
