package com.mainframe.anonymizer.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Findings of one validation run plus what was looked at.
 */
@Getter
public class ValidationReport {
    private final List<ValidationIssue> issues = new ArrayList<>();
    private int filesValidated;
    private int linesValidated;

    public void add(ValidationSeverity severity, String fileName, int line, String message) {
        issues.add(ValidationIssue.builder()
                .severity(severity)
                .fileName(fileName)
                .line(line)
                .message(message)
                .build());
    }

    void countFile(int lines) {
        filesValidated++;
        linesValidated += lines;
    }

    /**
     * Adds the findings and counts of another report.
     */
    public void merge(ValidationReport other) {
        issues.addAll(other.issues);
        filesValidated += other.filesValidated;
        linesValidated += other.linesValidated;
    }

    public List<ValidationIssue> errors() {
        return of(ValidationSeverity.ERROR);
    }

    public List<ValidationIssue> warnings() {
        return of(ValidationSeverity.WARNING);
    }

    public boolean isValid() {
        return errors().isEmpty();
    }

    private List<ValidationIssue> of(ValidationSeverity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .collect(Collectors.toList());
    }
}
