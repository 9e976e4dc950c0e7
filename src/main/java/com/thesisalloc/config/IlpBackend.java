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

package com.thesisalloc.config;

/** Integer-program engine used by the exact solver. */
public enum IlpBackend {
  /** OR-Tools model solver with SCIP. */
  SCIP("scip"),
  /** OR-Tools model solver with CP-SAT. */
  CP_SAT("cp-sat");

  private final String key;

  IlpBackend(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static IlpBackend parse(String value) {
    for (IlpBackend backend : values()) {
      if (backend.key.equals(value)) {
        return backend;
      }
    }
    throw new InvalidConfigException("ilp_backend", "expected scip or cp-sat, got " + value);
  }
}
