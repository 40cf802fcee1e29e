package com.mainframe.anonymizer.engine;

import java.nio.file.Path;
import java.util.List;

import com.mainframe.anonymizer.overlay.OverlayResolution;
import com.mainframe.anonymizer.transform.TransformedFile;

import lombok.Builder;
import lombok.Data;

/**
 * Result of an anonymization run.
 */
@Data
@Builder
public class AnonymizationResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int filesProcessed;
    private int filesWritten;
    private int identifiersMapped;
    private int linesChanged;

    private List<String> processingOrder;
    private List<TransformedFile> transformedFiles;
    /** Files that could not be rewritten, with the reason. */
    private List<String> failedFiles;
    private List<OverlayResolution> overlays;
    private BatchDiagnostics diagnostics;

    public static AnonymizationResult failure(String errorMessage) {
        return AnonymizationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .failedFiles(List.of())
                .transformedFiles(List.of())
                .processingOrder(List.of())
                .overlays(List.of())
                .build();
    }
}
