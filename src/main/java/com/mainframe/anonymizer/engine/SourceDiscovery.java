package com.mainframe.anonymizer.engine;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.mainframe.anonymizer.dependency.SourceUnit;

import lombok.AllArgsConstructor;

/**
 * Finds the COBOL sources of a batch under an input directory, in sorted path order.
 */
@AllArgsConstructor
public class SourceDiscovery {

    private final List<String> extensions;
    private final Charset charset;

    public List<Path> discoverSourceFiles(Path inputDir) throws IOException {
        try (Stream<Path> stream = Files.walk(inputDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isSourceFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public List<SourceUnit> loadSources(Path inputDir) throws IOException {
        List<SourceUnit> units = new ArrayList<>();
        for (Path file : discoverSourceFiles(inputDir)) {
            units.add(SourceUnit.read(inputDir, file, charset));
        }
        return units;
    }

    private boolean isSourceFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
    }
}
