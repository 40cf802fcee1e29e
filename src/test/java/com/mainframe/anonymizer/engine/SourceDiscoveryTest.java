package com.mainframe.anonymizer.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.anonymizer.dependency.SourceUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for finding the sources of a batch.
 */
class SourceDiscoveryTest {

    @TempDir
    Path tempDir;

    @Test
    void testFindsSourcesRecursivelyInSortedOrder() throws IOException {
        Files.createDirectories(tempDir.resolve("copy"));
        Files.writeString(tempDir.resolve("PROG.CBL"), "       STOP RUN.\n");
        Files.writeString(tempDir.resolve("copy/REC.cpy"), "       01 R PIC X.\n");
        Files.writeString(tempDir.resolve("README.md"), "not cobol");
        Files.writeString(tempDir.resolve("copy/notes.txt"), "not cobol");

        SourceDiscovery discovery = new SourceDiscovery(AnonymizerConfig.DEFAULT_EXTENSIONS, StandardCharsets.ISO_8859_1);
        List<SourceUnit> units = discovery.loadSources(tempDir);

        assertThat(units).extracting(SourceUnit::getFileName).containsExactly("PROG.CBL", "copy/REC.cpy");
        assertThat(units.get(1).getUnitName()).isEqualTo("REC");
        assertThat(units.get(1).getLines()).hasSize(1);
    }

    @Test
    void testKeepsNonAsciiBytesInSourceCharset() throws IOException {
        Files.write(tempDir.resolve("UMLAUT.cbl"), new byte[] {' ', ' ', ' ', ' ', ' ', ' ', '*', ' ', (byte) 0xC4, '\n'});

        List<SourceUnit> units = new SourceDiscovery(List.of(".cbl"), StandardCharsets.ISO_8859_1).loadSources(tempDir);

        assertThat(units).singleElement()
                .extracting(SourceUnit::getContent)
                .isEqualTo("      * Ä\n");
    }
}
