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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** One finding of the {@link InputValidator}, with the ids it concerns. */
public final class ValidationIssue {
  /** Errors block a solve; warnings are only reported. */
  public enum Severity {
    ERROR,
    WARNING
  }

  private final Severity severity;
  private final String message;
  private final Map<String, String> context;

  public ValidationIssue(Severity severity, String message, Map<String, String> context) {
    this.severity = severity;
    this.message = message;
    this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  static ValidationIssue error(String message, String... keyValues) {
    return new ValidationIssue(Severity.ERROR, message, toContext(keyValues));
  }

  static ValidationIssue warning(String message, String... keyValues) {
    return new ValidationIssue(Severity.WARNING, message, toContext(keyValues));
  }

  private static Map<String, String> toContext(String... keyValues) {
    Map<String, String> context = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      context.put(keyValues[i], keyValues[i + 1]);
    }
    return context;
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getMessage() {
    return message;
  }

  public Map<String, String> getContext() {
    return context;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /** Formats as {@code [ERROR] message (key=value, ...)}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(severity.name().toUpperCase(Locale.ROOT)).append("] ").append(message);
    if (!context.isEmpty()) {
      sb.append(" (");
      boolean first = true;
      for (Map.Entry<String, String> entry : context.entrySet()) {
        if (!first) {
          sb.append(", ");
        }
        sb.append(entry.getKey()).append('=').append(entry.getValue());
        first = false;
      }
      sb.append(')');
    }
    return sb.toString();
  }
}
