package com.mainframe.anonymizer.dependency;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.exception.AnonymizerException;

/**
 * Looks up copybooks that are not part of the batch in additional directories.
 */
public class FragmentLocator {
    private static final Logger log = LoggerFactory.getLogger(FragmentLocator.class);

    static final List<String> COPYBOOK_EXTENSIONS = List.of(
            "", ".cpy", ".CPY", ".cbl", ".CBL", ".cob", ".COB", ".copy", ".COPY", ".txt"
    );

    private final List<Path> searchDirs;
    private final Charset charset;

    public FragmentLocator(List<Path> searchDirs, Charset charset) {
        this.searchDirs = searchDirs != null ? searchDirs : List.of();
        this.charset = charset;
    }

    public static FragmentLocator none() {
        return new FragmentLocator(List.of(), Charset.defaultCharset());
    }

    public Optional<SourceUnit> find(String fragmentName) {
        if (fragmentName == null || fragmentName.isBlank()) {
            return Optional.empty();
        }
        for (Path dir : searchDirs) {
            Path found = searchDirectory(dir, fragmentName);
            if (found != null) {
                try {
                    log.info("Resolved COPY {} -> {}", fragmentName, found);
                    return Optional.of(SourceUnit.read(dir, found, charset));
                } catch (IOException e) {
                    log.error("Failed to read copybook {}", found, e);
                    throw new AnonymizerException("Failed to read copybook " + found, e);
                }
            }
        }
        return Optional.empty();
    }

    private Path searchDirectory(Path dir, String name) {
        if (dir == null || !Files.isDirectory(dir)) return null;

        for (String ext : COPYBOOK_EXTENSIONS) {
            Path candidate = dir.resolve(name + ext);
            if (Files.isRegularFile(candidate)) return candidate;

            candidate = dir.resolve(name.toLowerCase(Locale.ROOT) + ext);
            if (Files.isRegularFile(candidate)) return candidate;
        }
        return null;
    }
}
