package com.mainframe.anonymizer.cli.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.anonymizer.cli.exception.OptionsValidationException;
import com.mainframe.anonymizer.cli.model.AnonymizeOptions;
import com.mainframe.anonymizer.cli.model.ValidatedAnonymizeOptions;
import com.mainframe.anonymizer.naming.NamingScheme;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for command line option validation.
 */
class AnonymizeOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private final AnonymizeOptionsValidator validator = new AnonymizeOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("in"));
    }

    @Test
    void testDefaults() {
        AnonymizeOptions options = parse("-i", inputDir.toString(), "-o", tempDir.resolve("out").toString());

        ValidatedAnonymizeOptions validated = validator.validate(options);

        assertThat(validated.getNormalizedInputDir()).isEqualTo(inputDir.toAbsolutePath().normalize());
        assertThat(validated.getExtensions()).containsExactly(".cob", ".cbl", ".cpy", ".copy");
        assertThat(validated.getCharset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(validated.getCopybookDirs()).isEmpty();
        assertThat(options.getNamingScheme()).isEqualTo(NamingScheme.CORPORATE);
    }

    @Test
    void testExtensionsAreNormalized() {
        AnonymizeOptions options = parse("-i", inputDir.toString(), "--dry-run",
                "--extensions", "CBL, .Cpy,cbl,,", "--encoding", "utf8", "-s", "food");

        ValidatedAnonymizeOptions validated = validator.validate(options);

        assertThat(validated.getExtensions()).containsExactly(".cbl", ".cpy");
        assertThat(validated.getCharset().name()).isEqualTo("UTF-8");
        assertThat(validated.getNormalizedOutputDir()).isNull();
        assertThat(options.getNamingScheme()).isEqualTo(NamingScheme.FOOD);
    }

    @Test
    void testOutputRequiredUnlessDryRun() {
        assertThat(errorsOf(parse("-i", inputDir.toString())))
                .anyMatch(e -> e.startsWith("Output directory is required"));
    }

    @Test
    void testValidateOnlyIgnoresOutput() {
        AnonymizeOptions options = parse("-i", inputDir.toString(), "--validate-only",
                "-o", inputDir.toString());

        ValidatedAnonymizeOptions validated = validator.validate(options);

        assertThat(options.isValidateOnly()).isTrue();
        assertThat(validated.getNormalizedOutputDir()).isNull();
        assertThat(validator.validate(parse("-i", inputDir.toString(), "--validate-only"))).isNotNull();
    }

    @Test
    void testOutputMustDifferFromInput() {
        assertThat(errorsOf(parse("-i", inputDir.toString(), "-o", inputDir.resolve(".").toString())))
                .anyMatch(e -> e.startsWith("Output directory must differ"));
    }

    @Test
    void testNonEmptyOutputNeedsOverwrite() throws IOException {
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("OLD.cbl"), "old");

        assertThat(errorsOf(parse("-i", inputDir.toString(), "-o", out.toString())))
                .anyMatch(e -> e.startsWith("Output directory is not empty"));
        assertThatCode(() -> validator.validate(parse("-i", inputDir.toString(), "-o", out.toString(), "-f")))
                .doesNotThrowAnyException();
    }

    @Test
    void testOutputIsAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("out.txt"), "x");

        assertThat(errorsOf(parse("-i", inputDir.toString(), "-o", file.toString())))
                .anyMatch(e -> e.startsWith("Output path is a file"));
    }

    @Test
    void testCollectsAllErrors() {
        AnonymizeOptions options = parse("-i", tempDir.resolve("missing").toString(),
                "-o", tempDir.resolve("out").toString(),
                "--encoding", "NO-SUCH-CHARSET",
                "--extensions", " , ",
                "-c", tempDir.resolve("nolib").toString(),
                "--load-mappings", tempDir.resolve("none.json").toString());

        assertThat(errorsOf(options))
                .hasSize(5)
                .anyMatch(e -> e.startsWith("Input directory does not exist"))
                .anyMatch(e -> e.startsWith("Unsupported encoding"))
                .anyMatch(e -> e.startsWith("At least one source file extension"))
                .anyMatch(e -> e.startsWith("Copybook dir does not exist"))
                .anyMatch(e -> e.startsWith("Mapping file does not exist"));
    }

    @Test
    void testIllegalEncodingName() {
        assertThat(errorsOf(parse("-i", inputDir.toString(), "--dry-run", "--encoding", "bad name!")))
                .containsExactly("Illegal encoding name: bad name!");
    }

    @Test
    void testCopybookDirsAreSplit() throws IOException {
        Path lib1 = Files.createDirectories(tempDir.resolve("lib1"));
        Path lib2 = Files.createDirectories(tempDir.resolve("lib2"));

        ValidatedAnonymizeOptions validated = validator.validate(parse("-i", inputDir.toString(), "--dry-run",
                "-c", lib1 + " , " + lib2));

        assertThat(validated.getCopybookDirs()).containsExactly(lib1, lib2);
    }

    private static AnonymizeOptions parse(String... args) {
        AnonymizeOptions options = new AnonymizeOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return options;
    }

    private List<String> errorsOf(AnonymizeOptions options) {
        try {
            validator.validate(options);
        } catch (OptionsValidationException e) {
            return e.getErrors();
        }
        return fail("Expected validation errors");
    }
}
