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

import java.util.Locale;

/** How department minimums are enforced by the exact solver. */
public enum DeptMinMode {
  /** A shortfall is allowed at a per-unit penalty. */
  SOFT,
  /** The minimum must be met, otherwise the model is infeasible. */
  HARD;

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DeptMinMode parse(String value) {
    for (DeptMinMode mode : values()) {
      if (mode.key().equals(value)) {
        return mode;
      }
    }
    throw new InvalidConfigException("dept_min_mode", "expected soft or hard, got " + value);
  }
}
