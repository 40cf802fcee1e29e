package com.mainframe.anonymizer.engine;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.mainframe.anonymizer.naming.NamingScheme;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration of one anonymization run.
 */
@Data
@Builder
public class AnonymizerConfig {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".cob", ".cbl", ".cpy", ".copy");

    private Path inputDir;
    private Path outputDir;
    /** Directories searched for copybooks that are not in the input directory. */
    @Builder.Default
    private List<Path> copybookDirs = List.of();
    @Builder.Default
    private List<String> extensions = DEFAULT_EXTENSIONS;
    @Builder.Default
    private Charset charset = StandardCharsets.ISO_8859_1;
    @Builder.Default
    private NamingScheme namingScheme = NamingScheme.CORPORATE;
    /** Mapping state of an earlier run to extend; optional. */
    private Path mappingFile;
    /** Where to save the mapping state; optional. */
    private Path mappingOutput;
    /** Where to write the mapping report; optional. */
    private Path reportFile;
    /** Masks the text of alphanumeric literals as well. */
    private boolean anonymizeLiterals;
    /** Only checks the sources; nothing is rewritten or written. */
    private boolean validateOnly;
    private boolean dryRun;
    private boolean overwrite;
    private boolean verbose;
}
