package com.mainframe.anonymizer.mapping;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.exception.MappingException;
import com.mainframe.anonymizer.exception.MappingStateException;
import com.mainframe.anonymizer.model.IdentifierCategory;
import com.mainframe.anonymizer.model.SourceLocation;
import com.mainframe.anonymizer.naming.IdentifierRules;
import com.mainframe.anonymizer.naming.NamingScheme;
import com.mainframe.anonymizer.naming.NamingStrategy;
import com.mainframe.anonymizer.parser.ReservedWords;

/**
 * Batch-wide original-to-replacement dictionary.
 *
 * Keys are upper-cased. Every replacement is unique across the batch, a valid COBOL
 * word, not reserved and not a name that is kept as is. All writes go through one lock;
 * {@link #lookup(String)} reads without it.
 */
public class MappingTable {
    private static final Logger log = LoggerFactory.getLogger(MappingTable.class);

    public static final int MAX_ATTEMPTS = 1000;

    private final NamingScheme scheme;
    private final NamingStrategy strategy;

    private final Object lock = new Object();
    private final Map<String, MappingEntry> entries = new ConcurrentHashMap<>();
    private final List<MappingEntry> insertionOrder = new ArrayList<>();
    private final Map<IdentifierCategory, Integer> counters = new EnumMap<>(IdentifierCategory.class);
    private final Map<IdentifierCategory, Set<String>> issuedByCategory = new EnumMap<>(IdentifierCategory.class);
    private final Set<String> issued = new HashSet<>();
    private final Set<String> neverRename = ConcurrentHashMap.newKeySet();

    public MappingTable(NamingScheme scheme) {
        this.scheme = scheme;
        this.strategy = scheme.createStrategy();
    }

    public NamingScheme getScheme() {
        return scheme;
    }

    /**
     * Returns the replacement for {@code identifier}, issuing one on first sight.
     * Names that are never renamed come back unchanged without consuming a counter value.
     *
     * @throws MappingException when no acceptable name is found within {@value #MAX_ATTEMPTS} attempts
     */
    public String resolve(String identifier, IdentifierCategory category, SourceLocation location) {
        String key = normalize(identifier);

        if (!category.isRenameable()) {
            markNeverRename(identifier);
            return identifier;
        }
        if (neverRename.contains(key)) {
            return identifier;
        }

        synchronized (lock) {
            MappingEntry existing = entries.get(key);
            if (existing != null) {
                existing.incrementOccurrences();
                if (category == IdentifierCategory.CROSS_PROGRAM_NAME) {
                    existing.markExternallyVisible();
                }
                return existing.getReplacement();
            }

            int targetLength = IdentifierRules.targetLength(identifier, category);
            for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
                int counter = counters.merge(category, 1, Integer::sum);
                String candidate = strategy.generate(identifier, category, counter, targetLength)
                        .toUpperCase(Locale.ROOT);
                if (isAcceptable(candidate)) {
                    MappingEntry entry = MappingEntry.builder()
                            .originalName(identifier)
                            .originalKey(key)
                            .replacement(candidate)
                            .category(category)
                            .firstSeen(location)
                            .externallyVisible(category == IdentifierCategory.CROSS_PROGRAM_NAME)
                            .build();
                    store(entry);
                    log.debug("Mapped {} ({}) -> {}", identifier, category, candidate);
                    return candidate;
                }
                log.debug("Rejected candidate {} for {}", candidate, identifier);
            }
        }
        throw new MappingException(identifier, location,
                "no valid unique name after " + MAX_ATTEMPTS + " attempts");
    }

    /**
     * Marks a name as kept verbatim. Later {@link #resolve} calls return it unchanged.
     */
    public void markNeverRename(String identifier) {
        String key = normalize(identifier);
        synchronized (lock) {
            if (neverRename.add(key)) {
                log.debug("Never renaming {}", key);
            }
        }
    }

    public boolean isNeverRename(String identifier) {
        return neverRename.contains(normalize(identifier));
    }

    public Optional<MappingEntry> lookup(String identifier) {
        return Optional.ofNullable(entries.get(normalize(identifier)));
    }

    /**
     * Entries in the order they were issued.
     */
    public List<MappingEntry> entries() {
        synchronized (lock) {
            return List.copyOf(insertionOrder);
        }
    }

    public Map<IdentifierCategory, Integer> counters() {
        synchronized (lock) {
            return new EnumMap<>(counters);
        }
    }

    public Set<String> issuedNames(IdentifierCategory category) {
        synchronized (lock) {
            return Set.copyOf(issuedByCategory.getOrDefault(category, Set.of()));
        }
    }

    public int size() {
        return entries.size();
    }

    public MappingState persist() {
        synchronized (lock) {
            List<MappingState.Entry> stateEntries = new ArrayList<>();
            for (MappingEntry entry : insertionOrder) {
                SourceLocation firstSeen = entry.getFirstSeen();
                stateEntries.add(MappingState.Entry.builder()
                        .originalName(entry.getOriginalName())
                        .replacement(entry.getReplacement())
                        .category(entry.getCategory().name())
                        .externallyVisible(entry.isExternallyVisible())
                        .firstSeenFile(firstSeen != null ? firstSeen.getFile() : null)
                        .firstSeenLine(firstSeen != null ? firstSeen.getLine() : 0)
                        .occurrenceCount(entry.getOccurrenceCount())
                        .neverRename(entry.isNeverRename())
                        .build());
            }
            Map<String, Integer> stateCounters = new TreeMap<>();
            counters.forEach((category, value) -> stateCounters.put(category.name(), value));

            return MappingState.builder()
                    .namingScheme(scheme.name())
                    .entries(stateEntries)
                    .counters(stateCounters)
                    .neverRename(new ArrayList<>(new TreeSet<>(neverRename)))
                    .build();
        }
    }

    /**
     * Replaces the table's content with a persisted state so that a new run extends
     * the earlier one: known names keep their replacements, counters continue.
     */
    public void restore(MappingState state) {
        if (state == null) {
            throw new MappingStateException("Mapping state is empty");
        }
        synchronized (lock) {
            entries.clear();
            insertionOrder.clear();
            counters.clear();
            issuedByCategory.clear();
            issued.clear();
            neverRename.clear();

            if (state.getNamingScheme() != null && !scheme.name().equalsIgnoreCase(state.getNamingScheme())) {
                log.warn("Mapping state was produced with naming scheme {}, continuing with {}",
                        state.getNamingScheme(), scheme);
            }

            if (state.getNeverRename() != null) {
                state.getNeverRename().forEach(name -> neverRename.add(normalize(name)));
            }
            if (state.getCounters() != null) {
                state.getCounters().forEach((tag, value) -> counters.put(parseCategory(tag), value));
            }
            if (state.getEntries() != null) {
                for (MappingState.Entry e : state.getEntries()) {
                    restoreEntry(e);
                }
            }
            log.info("Restored {} mappings", entries.size());
        }
    }

    private void restoreEntry(MappingState.Entry e) {
        if (e.getOriginalName() == null || e.getReplacement() == null) {
            throw new MappingStateException("Mapping entry without original name or replacement");
        }
        IdentifierCategory category = parseCategory(e.getCategory());
        String key = normalize(e.getOriginalName());
        String replacement = e.getReplacement().toUpperCase(Locale.ROOT);
        if (entries.containsKey(key)) {
            throw new MappingStateException("Duplicate mapping for " + e.getOriginalName());
        }
        if (issued.contains(replacement)) {
            throw new MappingStateException("Replacement " + replacement + " issued twice");
        }
        MappingEntry entry = MappingEntry.builder()
                .originalName(e.getOriginalName())
                .originalKey(key)
                .replacement(replacement)
                .category(category)
                .firstSeen(e.getFirstSeenFile() != null ? SourceLocation.of(e.getFirstSeenFile(), e.getFirstSeenLine()) : null)
                .externallyVisible(e.isExternallyVisible())
                .neverRename(e.isNeverRename())
                .occurrenceCount(Math.max(1, e.getOccurrenceCount()))
                .build();
        store(entry);
    }

    private void store(MappingEntry entry) {
        entries.put(entry.getOriginalKey(), entry);
        insertionOrder.add(entry);
        issued.add(entry.getReplacement());
        issuedByCategory.computeIfAbsent(entry.getCategory(), c -> new HashSet<>()).add(entry.getReplacement());
    }

    private boolean isAcceptable(String candidate) {
        return IdentifierRules.isValid(candidate)
                && !ReservedWords.isReserved(candidate)
                && !issued.contains(candidate)
                && !neverRename.contains(candidate);
    }

    private static IdentifierCategory parseCategory(String tag) {
        try {
            return IdentifierCategory.fromTag(tag);
        } catch (IllegalArgumentException e) {
            throw new MappingStateException("Unknown identifier category: " + tag, e);
        }
    }

    private static String normalize(String identifier) {
        return identifier.trim().toUpperCase(Locale.ROOT);
    }
}
