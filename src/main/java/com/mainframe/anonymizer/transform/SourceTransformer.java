package com.mainframe.anonymizer.transform;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.classify.FileClassification;
import com.mainframe.anonymizer.dependency.SourceUnit;
import com.mainframe.anonymizer.mapping.MappingEntry;
import com.mainframe.anonymizer.mapping.MappingTable;
import com.mainframe.anonymizer.naming.LiteralObfuscator;
import com.mainframe.anonymizer.overlay.OverlayTracker;
import com.mainframe.anonymizer.parser.SourceLine;

/**
 * Rewrites a whole file line by line and derives its output name.
 */
public class SourceTransformer {
    private static final Logger log = LoggerFactory.getLogger(SourceTransformer.class);

    private final MappingTable table;
    private final OverlayTracker overlays;
    private final LiteralObfuscator literals;

    public SourceTransformer(MappingTable table, OverlayTracker overlays) {
        this(table, overlays, null);
    }

    /**
     * @param literals masks string literals too; null leaves them as they are
     */
    public SourceTransformer(MappingTable table, OverlayTracker overlays, LiteralObfuscator literals) {
        this.table = table;
        this.overlays = overlays;
        this.literals = literals;
    }

    public TransformedFile transform(SourceUnit unit, FileClassification classification) {
        LineTransformer transformer = new LineTransformer(unit.getFileName(), table, overlays, literals);
        List<SourceLine> lines = classification.getLines();

        List<String> output = new ArrayList<>(lines.size());
        StringBuilder content = new StringBuilder(unit.getContent().length() + 64);
        int changed = 0;

        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            String rewritten = transformer.transform(line, classification.getTokens().get(i));
            if (!rewritten.equals(line.getRaw())) {
                changed++;
            }
            output.add(rewritten);
            content.append(rewritten).append(line.getLineEnding());
        }

        String outputName = outputFileName(unit);
        log.debug("{} -> {}: {} of {} lines changed", unit.getFileName(), outputName, changed, lines.size());

        return TransformedFile.builder()
                .originalFileName(unit.getFileName())
                .outputFileName(outputName)
                .lines(output)
                .content(content.toString())
                .changedLines(changed)
                .build();
    }

    /**
     * Same directory and extension, with the stem replaced by the mapped name of the
     * copybook or program it holds. Files whose stem is not mapped keep their name.
     */
    String outputFileName(SourceUnit unit) {
        String fileName = unit.getFileName();
        int slash = fileName.lastIndexOf('/');
        String directory = slash >= 0 ? fileName.substring(0, slash + 1) : "";
        String extension = unit.getExtension();

        if (table.isNeverRename(unit.getUnitName())) {
            return fileName;
        }
        return table.lookup(unit.getUnitName())
                .map(MappingEntry::getReplacement)
                .map(replacement -> directory + replacement + extension)
                .orElse(fileName);
    }
}
