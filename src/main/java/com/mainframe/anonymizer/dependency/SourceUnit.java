package com.mainframe.anonymizer.dependency;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import com.mainframe.anonymizer.parser.SourceLine;
import com.mainframe.anonymizer.parser.SourceLineSplitter;

import lombok.Getter;

/**
 * One source file of a batch: a program or a copybook.
 */
@Getter
public class SourceUnit {

    /** File name relative to the batch root, e.g. {@code copy/CUSTREC.cpy}. */
    private final String fileName;
    private final Path path;
    private final String content;
    private final List<SourceLine> lines;

    public SourceUnit(String fileName, Path path, String content) {
        this.fileName = fileName;
        this.path = path;
        this.content = content;
        this.lines = SourceLineSplitter.splitAll(content);
    }

    public static SourceUnit of(String fileName, String content) {
        return new SourceUnit(fileName, null, content);
    }

    public static SourceUnit read(Path root, Path file, Charset charset) throws IOException {
        String relative = root.relativize(file).toString().replace('\\', '/');
        return new SourceUnit(relative, file, Files.readString(file, charset));
    }

    /**
     * The name COPY statements use for this file: the upper-cased file name without
     * directory and extension.
     */
    public String getUnitName() {
        return stem(fileName);
    }

    public String getExtension() {
        String base = baseName(fileName);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(dot) : "";
    }

    static String stem(String name) {
        String base = baseName(name.trim());
        int dot = base.lastIndexOf('.');
        return (dot > 0 ? base.substring(0, dot) : base).toUpperCase(Locale.ROOT);
    }

    private static String baseName(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    @Override
    public String toString() {
        return fileName;
    }
}
