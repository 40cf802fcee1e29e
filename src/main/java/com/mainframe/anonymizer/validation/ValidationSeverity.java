package com.mainframe.anonymizer.validation;

/**
 * How serious a validation finding is. Only errors fail a validation run.
 */
public enum ValidationSeverity {
    ERROR,
    WARNING,
    INFO
}
