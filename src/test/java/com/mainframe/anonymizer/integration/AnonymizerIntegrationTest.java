package com.mainframe.anonymizer.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.anonymizer.engine.AnonymizationEngine;
import com.mainframe.anonymizer.engine.AnonymizationResult;
import com.mainframe.anonymizer.engine.AnonymizerConfig;
import com.mainframe.anonymizer.mapping.MappingEntry;
import com.mainframe.anonymizer.mapping.MappingState;
import com.mainframe.anonymizer.mapping.MappingStateCodec;
import com.mainframe.anonymizer.mapping.MappingTable;
import com.mainframe.anonymizer.naming.IdentifierRules;
import com.mainframe.anonymizer.naming.NamingScheme;
import com.mainframe.anonymizer.overlay.OverlayResolution;
import com.mainframe.anonymizer.transform.TransformedFile;
import com.mainframe.anonymizer.validation.ValidationIssue;
import com.mainframe.anonymizer.validation.ValidationReport;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for a complete anonymization run.
 */
class AnonymizerIntegrationTest {

    @TempDir
    Path tempDir;

    private Path inputDir;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("in"));

        Files.writeString(inputDir.resolve("CUSTREC.cpy"), """
                       01  CUST-REC.
                           05  CUST-ID       PIC 9(6).
                           05  CUST-NAME     PIC X(20).
                           05  CUST-ALT REDEFINES CUST-NAME PIC X(20).
                           05  CUST-BAL      PIC S9(7)V99 COMP-3.
                """);

        Files.writeString(inputDir.resolve("PROG1.cbl"), """
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. PROG1.
                       DATA DIVISION.
                       WORKING-STORAGE SECTION.
                       COPY CUSTREC.
                       01  SHARED-REC EXTERNAL.
                           05  SHARED-FLAG   PIC X.
                       01  WS-COUNT          PIC 9(4) COMP.
                       PROCEDURE DIVISION.
                       MAIN-PARA.
                           MOVE CUST-NAME TO CUST-ALT
                           ADD 1 TO WS-COUNT
                           DISPLAY 'CUST-NAME' CUST-ID
                           STOP RUN.
                """);

        Files.writeString(inputDir.resolve("PROG2.cbl"), """
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. PROG2.
                       DATA DIVISION.
                       WORKING-STORAGE SECTION.
                       01  SHARED-REC EXTERNAL.
                           05  SHARED-FLAG   PIC X.
                       PROCEDURE DIVISION.
                           IF SHARED-FLAG = 'Y'
                               DISPLAY 'SET'
                           END-IF
                           GOBACK.
                """);
    }

    @Test
    void testAnonymizeBatch() throws IOException {
        Path outputDir = tempDir.resolve("out");
        AnonymizationEngine engine = new AnonymizationEngine(config(outputDir).build());

        AnonymizationResult result = engine.run();

        // Verify result
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProcessingOrder()).containsExactly("CUSTREC.cpy", "PROG1.cbl", "PROG2.cbl");
        assertThat(result.getFilesProcessed()).isEqualTo(3);
        assertThat(result.getFilesWritten()).isEqualTo(3);
        assertThat(result.getFailedFiles()).isEmpty();

        // Files are renamed after their copybook and program names
        assertThat(outputDir.resolve("CP00001.cpy")).exists();
        assertThat(outputDir.resolve("PG001.cbl")).exists();
        assertThat(outputDir.resolve("PG002.cbl")).exists();

        String copybook = Files.readString(outputDir.resolve("CP00001.cpy"));
        assertThat(copybook).contains("05  D00000003     PIC X(20).");
        assertThat(copybook).contains("05  D0000004 REDEFINES D00000003 PIC X(20).");
        assertThat(copybook).contains("PIC S9(7)V99 COMP-3.");

        String program = Files.readString(outputDir.resolve("PG001.cbl"));
        assertThat(program).contains("PROGRAM-ID. PG001.");
        assertThat(program).contains("COPY CP00001.");
        assertThat(program).contains("01  EX00000001 EXTERNAL.");
        assertThat(program).contains("MOVE D00000003 TO D0000004");
        assertThat(program).contains("DISPLAY 'CUST-NAME' D000002");
        assertThat(program).doesNotContain("SHARED-REC").doesNotContain("WS-COUNT").doesNotContain("MAIN-PARA");

        assertThat(Files.readString(outputDir.resolve("PG002.cbl")))
                .contains("IF EX000000002 = 'Y'");

        assertAllLinesFit(outputDir);
    }

    @Test
    void testExternalRecordIsSharedAcrossPrograms() {
        AnonymizationEngine engine = new AnonymizationEngine(config(null).dryRun(true).build());

        assertThat(engine.run().isSuccess()).isTrue();

        MappingTable table = engine.getMappingTable();
        MappingEntry shared = table.lookup("SHARED-REC").orElseThrow();
        assertThat(shared.isExternallyVisible()).isTrue();
        assertThat(shared.getOccurrenceCount()).isEqualTo(2);
        assertThat(shared.getFirstSeen().getFile()).isEqualTo("PROG1.cbl");
        assertThat(table.lookup("SHARED-FLAG").orElseThrow().getReplacement()).isEqualTo("EX000000002");
    }

    @Test
    void testOverlayResolvedAgainstTargetOffset() {
        AnonymizationResult result = new AnonymizationEngine(config(null).dryRun(true).build()).run();

        assertThat(result.getOverlays()).singleElement().satisfies(overlay -> {
            assertThat(overlay.getRelationship().getOverlayName()).isEqualTo("CUST-ALT");
            assertThat(overlay.getPosition()).isEqualTo(6);
            assertThat(overlay.getTargetReplacement()).isEqualTo("D00000003");
            assertThat(overlay.isDegraded()).isFalse();
        });
        assertThat(result.getOverlays()).noneMatch(OverlayResolution::isDegraded);
    }

    @Test
    void testRunsAreDeterministic() throws IOException {
        Path out1 = tempDir.resolve("out1");
        Path out2 = tempDir.resolve("out2");
        Path map1 = tempDir.resolve("map1.json");
        Path map2 = tempDir.resolve("map2.json");

        new AnonymizationEngine(config(out1).namingScheme(NamingScheme.CORPORATE).mappingOutput(map1).build()).run();
        new AnonymizationEngine(config(out2).namingScheme(NamingScheme.CORPORATE).mappingOutput(map2).build()).run();

        assertThat(Files.readAllBytes(map1)).isEqualTo(Files.readAllBytes(map2));
        try (Stream<Path> files = Files.list(out1)) {
            for (Path file : files.toList()) {
                assertThat(Files.readString(file)).isEqualTo(Files.readString(out2.resolve(file.getFileName())));
            }
        }
        assertAllLinesFit(out1);
    }

    @Test
    void testVocabularyNamesAreValid() {
        AnonymizationEngine engine = new AnonymizationEngine(config(null)
                .namingScheme(NamingScheme.FANTASY).dryRun(true).build());

        assertThat(engine.run().isSuccess()).isTrue();

        assertThat(engine.getMappingTable().entries())
                .extracting(MappingEntry::getReplacement)
                .allMatch(IdentifierRules::isValid)
                .doesNotHaveDuplicates();
    }

    @Test
    void testDryRunWritesOnlyMappingsAndReport() throws IOException {
        Path outputDir = tempDir.resolve("out");
        Path mappings = tempDir.resolve("state/mappings.json");
        Path report = tempDir.resolve("report.txt");

        AnonymizationResult result = new AnonymizationEngine(config(outputDir)
                .dryRun(true).mappingOutput(mappings).reportFile(report).build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesWritten()).isZero();
        assertThat(result.getTransformedFiles()).hasSize(3);
        assertThat(outputDir).doesNotExist();
        assertThat(mappings).exists();
        assertThat(Files.readString(report)).contains("CUST-NAME").contains("REDEFINES");
    }

    @Test
    void testLoadedMappingsAreExtended() throws IOException {
        Path mappings = tempDir.resolve("mappings.json");
        new AnonymizationEngine(config(null).dryRun(true).mappingOutput(mappings).build()).run();

        Files.writeString(inputDir.resolve("PROG3.cbl"), """
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. PROG3.
                       DATA DIVISION.
                       WORKING-STORAGE SECTION.
                       01  WS-EXTRA          PIC X.
                       PROCEDURE DIVISION.
                           MOVE 'X' TO WS-EXTRA
                           GOBACK.
                """);
        AnonymizationEngine engine = new AnonymizationEngine(config(null)
                .dryRun(true).mappingFile(mappings).build());

        assertThat(engine.run().isSuccess()).isTrue();

        MappingTable table = engine.getMappingTable();
        assertThat(table.lookup("CUST-NAME").orElseThrow().getReplacement()).isEqualTo("D00000003");
        assertThat(table.lookup("WS-EXTRA").orElseThrow().getReplacement()).isEqualTo("D0000007");
        assertThat(table.lookup("PROG3").orElseThrow().getReplacement()).isEqualTo("PG003");
        assertThat(engine.getDiagnostics().getInfos()).hasSize(1);
        assertThat(engine.getDiagnostics().getInfos().get(0)).startsWith("Continuing from").contains("mappings.json");
    }

    @Test
    void testCircularCopybooksFailWithoutOutput() throws IOException {
        Path cyclicDir = Files.createDirectories(tempDir.resolve("cyclic"));
        Files.writeString(cyclicDir.resolve("A.cpy"), "       COPY B.\n");
        Files.writeString(cyclicDir.resolve("B.cpy"), "       COPY A.\n");
        Path outputDir = tempDir.resolve("out");

        AnonymizationResult result = new AnonymizationEngine(AnonymizerConfig.builder()
                .inputDir(cyclicDir).outputDir(outputDir).build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("Circular").contains("A.cpy").contains("B.cpy");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testMissingCopybookFails() throws IOException {
        Files.writeString(inputDir.resolve("PROG4.cbl"), "       COPY NOWHERE.\n");

        AnonymizationResult result = new AnonymizationEngine(config(tempDir.resolve("out")).build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("NOWHERE").contains("PROG4.cbl:1");
    }

    @Test
    void testOverflowOnlyFailsTheAffectedFile() throws IOException {
        Path batch = Files.createDirectories(tempDir.resolve("overflow"));
        Files.writeString(batch.resolve("BAD.cbl"), String.join("\n",
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. BADPROG.",
                "       DATA DIVISION.",
                "       WORKING-STORAGE SECTION.",
                "       01  A PIC X.",
                "       PROCEDURE DIVISION.",
                "           DISPLAY '" + "x".repeat(48) + "' A.",
                ""));
        Files.writeString(batch.resolve("GOOD.cbl"), String.join("\n",
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. GOODPROG.",
                "       DATA DIVISION.",
                "       WORKING-STORAGE SECTION.",
                "       01  WS-OK PIC X.",
                ""));
        Path outputDir = tempDir.resolve("out");

        AnonymizationResult result = new AnonymizationEngine(AnonymizerConfig.builder()
                .inputDir(batch).outputDir(outputDir).namingScheme(NamingScheme.NUMERIC).build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailedFiles()).hasSize(1);
        assertThat(result.getFailedFiles().get(0)).startsWith("BAD.cbl");
        assertThat(result.getDiagnostics().getErrors()).anyMatch(e -> e.contains("BAD.cbl:7 at column 71"));
        assertThat(outputDir.resolve("GOOD.cbl")).exists();
        assertThat(outputDir.resolve("BAD.cbl")).doesNotExist();
    }

    @Test
    void testExistingOutputIsNotOverwritten() throws IOException {
        Path outputDir = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(outputDir.resolve("PG001.cbl"), "keep");

        AnonymizationResult result = new AnonymizationEngine(config(outputDir).build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(Files.readString(outputDir.resolve("PG001.cbl"))).isEqualTo("keep");
        assertThat(result.getFilesWritten()).isEqualTo(2);

        AnonymizationResult forced = new AnonymizationEngine(config(outputDir).overwrite(true).build()).run();
        assertThat(forced.isSuccess()).isTrue();
        assertThat(Files.readString(outputDir.resolve("PG001.cbl"))).contains("PROGRAM-ID. PG001.");
    }

    @Test
    void testLiteralsAreAnonymizedOnRequest() {
        AnonymizationResult result = new AnonymizationEngine(config(null)
                .dryRun(true).anonymizeLiterals(true).build()).run();

        assertThat(result.isSuccess()).isTrue();
        String prog1 = transformed(result, "PROG1.cbl").getContent();
        String prog2 = transformed(result, "PROG2.cbl").getContent();
        // a literal naming a known data item keeps its text
        assertThat(prog1).contains("DISPLAY 'CUST-NAME' D000002");
        assertThat(prog2).doesNotContain("'SET'").containsPattern("DISPLAY '[A-Z]{3}'");
    }

    @Test
    void testLiteralsAreKeptByDefault() {
        AnonymizationResult result = new AnonymizationEngine(config(null).dryRun(true).build()).run();

        assertThat(transformed(result, "PROG2.cbl").getContent()).contains("DISPLAY 'SET'");
    }

    @Test
    void testValidateOnlyChecksBatchAndMappings() throws IOException {
        Path mappings = tempDir.resolve("mappings.json");
        new AnonymizationEngine(config(null).dryRun(true).mappingOutput(mappings).build()).run();

        ValidationReport report = new AnonymizationEngine(config(null)
                .validateOnly(true).mappingFile(mappings).build()).validate();

        assertThat(report.isValid()).isTrue();
        assertThat(report.getFilesValidated()).isEqualTo(3);
        assertThat(report.getIssues()).isEmpty();
    }

    @Test
    void testValidateOnlyReportsBrokenMappingFile() throws IOException {
        Path mappings = tempDir.resolve("broken.json");
        new MappingStateCodec().write(mappings, MappingState.builder()
                .entries(List.of(
                        MappingState.Entry.builder().originalName("A-NAME").replacement("D0001")
                                .category("DATA_NAME").build(),
                        MappingState.Entry.builder().originalName("B-NAME").replacement("D0001")
                                .category("DATA_NAME").build()))
                .build());

        ValidationReport report = new AnonymizationEngine(config(null)
                .validateOnly(true).mappingFile(mappings).build()).validate();

        assertThat(report.isValid()).isFalse();
        assertThat(report.errors()).extracting(ValidationIssue::getMessage)
                .containsExactly("Replacement D0001 issued twice");
    }

    @Test
    void testEmptyInputFails() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        AnonymizationResult result = new AnonymizationEngine(AnonymizerConfig.builder()
                .inputDir(empty).dryRun(true).build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).startsWith("No COBOL sources found");
    }

    private static TransformedFile transformed(AnonymizationResult result, String originalName) {
        return result.getTransformedFiles().stream()
                .filter(file -> file.getOriginalFileName().equals(originalName))
                .findFirst()
                .orElseThrow();
    }

    private AnonymizerConfig.AnonymizerConfigBuilder config(Path outputDir) {
        return AnonymizerConfig.builder()
                .inputDir(inputDir)
                .outputDir(outputDir)
                .namingScheme(NamingScheme.NUMERIC);
    }

    private static void assertAllLinesFit(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.toList()) {
                List<String> lines = Files.readAllLines(file);
                assertThat(lines).as(file.toString()).allMatch(line -> line.length() <= 72);
            }
        }
    }
}
