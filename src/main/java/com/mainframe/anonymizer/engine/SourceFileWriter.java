package com.mainframe.anonymizer.engine;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rewritten sources, creating parent directories as needed.
 */
public class SourceFileWriter {

    private SourceFileWriter() {
        // Utility class
    }

    /**
     * Writes content to a file in the given charset, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content, Charset charset) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, charset);
    }
}
