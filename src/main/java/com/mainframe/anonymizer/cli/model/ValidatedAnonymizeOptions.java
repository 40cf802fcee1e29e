package com.mainframe.anonymizer.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnonymizeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnonymizeOptions {
    Path normalizedInputDir;
    Path normalizedOutputDir;
    List<Path> copybookDirs;
    List<String> extensions;
    Charset charset;
}
