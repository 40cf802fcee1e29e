package com.mainframe.anonymizer.engine;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors, warnings and infos collected during a run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class BatchDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasErrors() {
	  return !this.errors.isEmpty();
  }

  public boolean hasWarnings() {
	  return !this.warnings.isEmpty();
  }

}
