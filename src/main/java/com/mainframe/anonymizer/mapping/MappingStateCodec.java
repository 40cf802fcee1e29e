package com.mainframe.anonymizer.mapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mainframe.anonymizer.exception.MappingStateException;

/**
 * JSON form of {@link MappingState}. Output is pretty-printed with sorted map keys so
 * that two runs over the same input produce identical files.
 */
public class MappingStateCodec {
    private static final Logger log = LoggerFactory.getLogger(MappingStateCodec.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public byte[] encode(MappingState state) {
        try {
            return mapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new MappingStateException("Failed to serialize mapping state", e);
        }
    }

    public MappingState decode(byte[] json) {
        if (json == null || json.length == 0) {
            throw new MappingStateException("Mapping state is empty");
        }
        try {
            return mapper.readValue(json, MappingState.class);
        } catch (JsonProcessingException e) {
            throw new MappingStateException("Malformed mapping state: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MappingStateException("Cannot read mapping state", e);
        }
    }

    public MappingState read(Path file) {
        try {
            log.info("Loading mappings from {}", file);
            return decode(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new MappingStateException("Cannot read mapping file " + file, e);
        }
    }

    public void write(Path file, MappingState state) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, encode(state));
            log.info("Saved {} mappings to {}", state.getEntries().size(), file);
        } catch (IOException e) {
            throw new MappingStateException("Cannot write mapping file " + file, e);
        }
    }
}
