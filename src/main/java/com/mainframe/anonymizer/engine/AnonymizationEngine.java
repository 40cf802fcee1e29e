package com.mainframe.anonymizer.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.classify.ClassifiedIdentifier;
import com.mainframe.anonymizer.classify.FileClassification;
import com.mainframe.anonymizer.classify.IdentifierClassifier;
import com.mainframe.anonymizer.dependency.DependencyGraphResolver;
import com.mainframe.anonymizer.dependency.FragmentLocator;
import com.mainframe.anonymizer.dependency.ProcessingOrder;
import com.mainframe.anonymizer.dependency.SourceUnit;
import com.mainframe.anonymizer.exception.AnonymizerException;
import com.mainframe.anonymizer.exception.ColumnOverflowException;
import com.mainframe.anonymizer.exception.MappingStateException;
import com.mainframe.anonymizer.mapping.MappingEntry;
import com.mainframe.anonymizer.mapping.MappingReportRenderer;
import com.mainframe.anonymizer.mapping.MappingStateCodec;
import com.mainframe.anonymizer.mapping.MappingTable;
import com.mainframe.anonymizer.model.IdentifierCategory;
import com.mainframe.anonymizer.model.SourceLocation;
import com.mainframe.anonymizer.naming.LiteralObfuscator;
import com.mainframe.anonymizer.overlay.OverlayResolution;
import com.mainframe.anonymizer.overlay.OverlayTracker;
import com.mainframe.anonymizer.parser.IncludeStatement;
import com.mainframe.anonymizer.parser.ReservedWords;
import com.mainframe.anonymizer.transform.SourceTransformer;
import com.mainframe.anonymizer.transform.TransformedFile;
import com.mainframe.anonymizer.validation.SourceValidator;
import com.mainframe.anonymizer.validation.ValidationReport;
import com.mainframe.anonymizer.validation.ValidationSeverity;

/**
 * Runs a batch through ordering, classification and mapping, overlay resolution and
 * rewriting.
 *
 * The mapping table and overlay tracker are owned by the engine and shared by every
 * file of the batch. Files must be classified in processing order: a consumer is only
 * accepted once all of its copybooks have been classified.
 */
public class AnonymizationEngine {
    private static final Logger log = LoggerFactory.getLogger(AnonymizationEngine.class);

    private final AnonymizerConfig config;
    private final MappingTable table;
    private final OverlayTracker overlays;
    private final IdentifierClassifier classifier = new IdentifierClassifier();
    private final MappingStateCodec codec = new MappingStateCodec();
    private final BatchDiagnostics diagnostics = new BatchDiagnostics();
    private final LiteralObfuscator literals;

    private final Map<String, FileClassification> classifications = new LinkedHashMap<>();
    private ProcessingOrder order;
    private List<OverlayResolution> resolutions;

    public AnonymizationEngine(AnonymizerConfig config) {
        this(config, new MappingTable(config.getNamingScheme()), new OverlayTracker());
    }

    public AnonymizationEngine(AnonymizerConfig config, MappingTable table, OverlayTracker overlays) {
        this.config = config;
        this.table = table;
        this.overlays = overlays;
        this.literals = config.isAnonymizeLiterals()
                ? LiteralObfuscator.forIdentifierScheme(config.getNamingScheme())
                : null;
    }

    public MappingTable getMappingTable() {
        return table;
    }

    public BatchDiagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Orders the batch so that copybooks come before the files that include them.
     * Copybooks missing from the batch are looked up in the configured copybook directories.
     */
    public ProcessingOrder buildProcessingOrder(List<SourceUnit> units) {
        FragmentLocator locator = new FragmentLocator(config.getCopybookDirs(), config.getCharset());
        order = new DependencyGraphResolver(locator).buildProcessingOrder(units);
        for (IncludeStatement statement : order.getGraph().systemIncludes()) {
            diagnostics.getInfos().add(statement.getConsumerFile() + ":" + statement.getLine()
                    + ": system copybook " + statement.getFragmentName() + " left as is");
        }
        classifications.clear();
        resolutions = null;
        return order;
    }

    /**
     * Classifies one file and maps every name it declares.
     *
     * @param position the file's index in the processing order
     * @return the mapping entries of the names declared in this file
     */
    public List<MappingEntry> classifyAndMap(SourceUnit unit, int position) {
        requireCopybooksClassified(unit);
        log.info("[{}] Classifying {}", position + 1, unit.getFileName());

        FileClassification classification = classifier.classify(unit.getFileName(), unit.getLines());
        diagnostics.getWarnings().addAll(classification.getWarnings());

        Set<String> declared = new LinkedHashSet<>();
        if (order != null && order.isFragment(unit)) {
            mapName(unit.getUnitName(), IdentifierCategory.INCLUDED_FRAGMENT_NAME,
                    SourceLocation.of(unit.getFileName(), 1), declared);
        }
        for (ClassifiedIdentifier identifier : classification.getIdentifiers()) {
            mapName(identifier.getName(), identifier.getCategory(), identifier.getLocation(), declared);
        }

        classification.getOverlays().forEach(overlays::declare);
        overlays.recordPositions(classification.getPositions());

        classifications.put(unit.getFileName(), classification);
        resolutions = null;

        List<MappingEntry> entries = new ArrayList<>();
        for (String name : declared) {
            table.lookup(name).ifPresent(entries::add);
        }
        log.debug("{}: {} declarations, {} mapped names", unit.getFileName(),
                classification.getIdentifiers().size(), entries.size());
        return entries;
    }

    private void mapName(String name, IdentifierCategory category, SourceLocation location, Set<String> declared) {
        if (category == IdentifierCategory.SYSTEM_RESERVED || ReservedWords.isSystemIdentifier(name)) {
            table.markNeverRename(name);
            return;
        }
        table.resolve(name, category, location);
        declared.add(name);
    }

    private void requireCopybooksClassified(SourceUnit unit) {
        if (order == null) {
            return;
        }
        for (String fragment : order.getGraph().fragmentsOf(unit.getFileName())) {
            if (!classifications.containsKey(fragment)) {
                throw new AnonymizerException(unit.getFileName() + " cannot be classified before its copybook "
                        + fragment);
            }
        }
    }

    /**
     * Resolves all REDEFINES of the batch against the current mapping table.
     */
    public List<OverlayResolution> resolveOverlays() {
        resolutions = overlays.resolveAll(table, diagnostics.getWarnings());
        return resolutions;
    }

    /**
     * Rewrites a classified file.
     *
     * @throws ColumnOverflowException when a rewritten line no longer fits the code area
     */
    public TransformedFile transform(SourceUnit unit) {
        FileClassification classification = classifications.get(unit.getFileName());
        if (classification == null) {
            throw new AnonymizerException(unit.getFileName() + " has not been classified");
        }
        if (resolutions == null) {
            resolveOverlays();
        }
        return new SourceTransformer(table, overlays, literals).transform(unit, classification);
    }

    /**
     * Continues from a persisted mapping state: known names keep their replacements.
     */
    public void loadMappingState(byte[] state) {
        table.restore(codec.decode(state));
    }

    public byte[] exportMappingState() {
        return codec.encode(table.persist());
    }

    /**
     * Checks the input directory and, when a mapping file is configured, the mapping
     * state it holds. Nothing is written.
     */
    public ValidationReport validate() throws IOException {
        SourceDiscovery discovery = new SourceDiscovery(config.getExtensions(), config.getCharset());
        List<SourceUnit> units = discovery.loadSources(config.getInputDir());
        SourceValidator validator = new SourceValidator(
                new FragmentLocator(config.getCopybookDirs(), config.getCharset()));

        ValidationReport report = validator.validate(units);
        if (config.getMappingFile() != null) {
            try {
                table.restore(codec.read(config.getMappingFile()));
                report.merge(validator.validate(table));
            } catch (MappingStateException e) {
                report.add(ValidationSeverity.ERROR, config.getMappingFile().toString(), 0, e.getMessage());
            }
        }
        log.info("Validated {} files, {} lines: {} errors, {} warnings", report.getFilesValidated(),
                report.getLinesValidated(), report.errors().size(), report.warnings().size());
        return report;
    }

    public AnonymizationResult run() {
        try {
            log.info("Starting anonymization...");

            if (literals != null) {
                log.info("Literals are masked with {} words", literals.getVocabulary());
            }

            log.info("Step 1: Loading sources...");
            if (config.getMappingFile() != null) {
                table.restore(codec.read(config.getMappingFile()));
                diagnostics.getInfos().add("Continuing from " + config.getMappingFile() + " with "
                        + table.size() + " known names");
            }
            SourceDiscovery discovery = new SourceDiscovery(config.getExtensions(), config.getCharset());
            List<SourceUnit> units = discovery.loadSources(config.getInputDir());
            if (units.isEmpty()) {
                return AnonymizationResult.failure("No COBOL sources found in " + config.getInputDir());
            }

            log.info("Step 2: Resolving COPY dependencies...");
            ProcessingOrder processingOrder = buildProcessingOrder(units);

            log.info("Step 3: Classifying and mapping identifiers...");
            List<SourceUnit> ordered = processingOrder.getUnits();
            for (int i = 0; i < ordered.size(); i++) {
                classifyAndMap(ordered.get(i), i);
            }

            log.info("Step 4: Resolving REDEFINES...");
            List<OverlayResolution> overlayResolutions = resolveOverlays();

            log.info("Step 5: Rewriting sources...");
            List<TransformedFile> transformed = new ArrayList<>();
            List<String> failedFiles = new ArrayList<>();
            for (SourceUnit unit : ordered) {
                try {
                    transformed.add(transform(unit));
                } catch (ColumnOverflowException e) {
                    log.error(e.getMessage());
                    diagnostics.getErrors().add(e.getMessage());
                    failedFiles.add(unit.getFileName() + ": " + e.getMessage());
                }
            }

            int written = 0;
            if (config.isDryRun()) {
                log.info("Step 6: Dry run, no sources written");
            } else {
                log.info("Step 6: Writing sources...");
                written = writeSources(transformed, failedFiles);
            }

            log.info("Step 7: Writing mapping state and report...");
            writeMappingOutputs(overlayResolutions);

            return AnonymizationResult.builder()
                    .success(failedFiles.isEmpty())
                    .errorMessage(failedFiles.isEmpty() ? null : failedFiles.size() + " file(s) failed")
                    .outputPath(config.getOutputDir())
                    .filesProcessed(ordered.size())
                    .filesWritten(written)
                    .identifiersMapped(table.size())
                    .linesChanged(transformed.stream().mapToInt(TransformedFile::getChangedLines).sum())
                    .processingOrder(processingOrder.fileNames())
                    .transformedFiles(transformed)
                    .failedFiles(failedFiles)
                    .overlays(overlayResolutions)
                    .diagnostics(diagnostics)
                    .build();

        } catch (AnonymizerException e) {
            log.error("Anonymization failed: {}", e.getMessage());
            return AnonymizationResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Anonymization failed with I/O error", e);
            return AnonymizationResult.failure("I/O error: " + e.getMessage());
        }
    }

    private int writeSources(List<TransformedFile> transformed, List<String> failedFiles) throws IOException {
        int written = 0;
        for (TransformedFile file : transformed) {
            Path target = config.getOutputDir().resolve(file.getOutputFileName());
            if (Files.exists(target) && !config.isOverwrite()) {
                String message = "Output file already exists: " + target;
                log.error(message);
                diagnostics.getErrors().add(message);
                failedFiles.add(file.getOriginalFileName() + ": " + message);
                continue;
            }
            SourceFileWriter.safeWriteString(target, file.getContent(), config.getCharset());
            log.debug("Wrote {}", target);
            written++;
        }
        return written;
    }

    private void writeMappingOutputs(List<OverlayResolution> overlayResolutions) throws IOException {
        if (config.getMappingOutput() != null) {
            codec.write(config.getMappingOutput(), table.persist());
        }
        if (config.getReportFile() != null) {
            String report = new MappingReportRenderer().render(table, overlayResolutions);
            SourceFileWriter.safeWriteString(config.getReportFile(), report, StandardCharsets.UTF_8);
            log.info("Mapping report written to {}", config.getReportFile());
        }
    }
}
