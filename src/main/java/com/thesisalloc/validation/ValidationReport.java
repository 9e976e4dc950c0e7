// Copyright 2010-2021 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.thesisalloc.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Outcome of {@link InputValidator#validate}: errors first, then warnings. */
public final class ValidationReport {
  private final List<ValidationIssue> errors;
  private final List<ValidationIssue> warnings;

  ValidationReport(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
    this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
  }

  /** True if there is no error; warnings do not count. */
  public boolean isValid() {
    return errors.isEmpty();
  }

  public List<ValidationIssue> getErrors() {
    return errors;
  }

  public List<ValidationIssue> getWarnings() {
    return warnings;
  }

  public List<ValidationIssue> getIssues() {
    List<ValidationIssue> issues = new ArrayList<>(errors);
    issues.addAll(warnings);
    return issues;
  }

  public String getSummary() {
    if (errors.isEmpty() && warnings.isEmpty()) {
      return "All validations passed";
    }
    List<String> parts = new ArrayList<>();
    if (!errors.isEmpty()) {
      parts.add(errors.size() + " error(s) found");
    }
    if (!warnings.isEmpty()) {
      parts.add(warnings.size() + " warning(s) found");
    }
    return String.join(", ", parts);
  }
}
