package com.mainframe.anonymizer.validation;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.classify.ClassifiedIdentifier;
import com.mainframe.anonymizer.classify.IdentifierClassifier;
import com.mainframe.anonymizer.dependency.FragmentLocator;
import com.mainframe.anonymizer.dependency.SourceUnit;
import com.mainframe.anonymizer.mapping.MappingEntry;
import com.mainframe.anonymizer.mapping.MappingTable;
import com.mainframe.anonymizer.naming.IdentifierRules;
import com.mainframe.anonymizer.parser.IncludeStatement;
import com.mainframe.anonymizer.parser.IncludeStatementScanner;
import com.mainframe.anonymizer.parser.ReservedWords;
import com.mainframe.anonymizer.parser.SourceLine;

/**
 * Checks a batch without rewriting it: fixed-format columns, COPY references that
 * resolve inside the batch and declared names within the COBOL length limit.
 * A mapping table can be checked as well, for instance one loaded from an earlier run.
 */
public class SourceValidator {
    private static final Logger log = LoggerFactory.getLogger(SourceValidator.class);

    static final int MAX_LINE_LENGTH = 80;

    private final IncludeStatementScanner scanner = new IncludeStatementScanner();
    private final IdentifierClassifier classifier = new IdentifierClassifier();
    private final FragmentLocator locator;

    public SourceValidator() {
        this(FragmentLocator.none());
    }

    /**
     * @param locator copybooks found through it count as resolved COPY references
     */
    public SourceValidator(FragmentLocator locator) {
        this.locator = locator;
    }

    public ValidationReport validate(List<SourceUnit> units) {
        ValidationReport report = new ValidationReport();
        Set<String> unitNames = units.stream()
                .map(SourceUnit::getUnitName)
                .collect(Collectors.toSet());

        for (SourceUnit unit : units) {
            log.debug("Validating {}", unit.getFileName());
            checkColumns(unit, report);
            checkIncludes(unit, unitNames, report);
            checkDeclaredNames(unit, report);
            report.countFile(unit.getLines().size());
        }
        return report;
    }

    /**
     * Replacements must be valid COBOL words and no two names may share one.
     */
    public ValidationReport validate(MappingTable table) {
        ValidationReport report = new ValidationReport();
        Map<String, String> owners = new HashMap<>();

        for (MappingEntry entry : table.entries()) {
            if (entry.isNeverRename()) {
                continue;
            }
            String replacement = entry.getReplacement();
            if (!IdentifierRules.isValid(replacement)) {
                report.add(ValidationSeverity.ERROR, null, 0,
                        "Replacement " + replacement + " of " + entry.getOriginalName() + " is not a valid COBOL word");
            }
            String previous = owners.putIfAbsent(replacement.toUpperCase(Locale.ROOT), entry.getOriginalName());
            if (previous != null) {
                report.add(ValidationSeverity.ERROR, null, 0,
                        "Replacement " + replacement + " is used by both " + previous + " and "
                                + entry.getOriginalName());
            }
        }
        return report;
    }

    private void checkColumns(SourceUnit unit, ValidationReport report) {
        for (SourceLine line : unit.getLines()) {
            String raw = line.getRaw();
            if (raw.length() > MAX_LINE_LENGTH) {
                report.add(ValidationSeverity.ERROR, unit.getFileName(), line.getLineNumber(),
                        "Line is " + raw.length() + " columns long, the limit is " + MAX_LINE_LENGTH);
            }
            if (!line.isComment() && raw.length() > SourceLine.CODE_END
                    && !raw.substring(SourceLine.CODE_END).isBlank()) {
                report.add(ValidationSeverity.WARNING, unit.getFileName(), line.getLineNumber(),
                        "Text after column " + SourceLine.CODE_END + " is ignored by the compiler");
            }
        }
    }

    private void checkIncludes(SourceUnit unit, Set<String> unitNames, ValidationReport report) {
        for (IncludeStatement statement : scanner.scan(unit.getFileName(), unit.getLines())) {
            String fragment = statement.getFragmentName();
            if (unitNames.contains(fragment) || ReservedWords.isSystemIdentifier(fragment)) {
                continue;
            }
            if (locator.find(fragment).isEmpty()) {
                report.add(ValidationSeverity.WARNING, unit.getFileName(), statement.getLine(),
                        "COPY " + fragment + " does not match any file of the batch");
            }
        }
    }

    private void checkDeclaredNames(SourceUnit unit, ValidationReport report) {
        List<ClassifiedIdentifier> identifiers = classifier.classify(unit.getFileName(), unit.getLines())
                .getIdentifiers();
        for (ClassifiedIdentifier identifier : identifiers) {
            if (identifier.getName().length() > IdentifierRules.MAX_LENGTH) {
                report.add(ValidationSeverity.ERROR, unit.getFileName(), identifier.getLocation().getLine(),
                        "Identifier " + identifier.getName() + " is longer than " + IdentifierRules.MAX_LENGTH
                                + " characters");
            }
        }
    }
}
