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

/** Solving strategy. */
public enum Algorithm {
  ILP,
  FLOW,
  HYBRID;

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Algorithm parse(String value) {
    for (Algorithm algorithm : values()) {
      if (algorithm.key().equals(value)) {
        return algorithm;
      }
    }
    throw new InvalidConfigException("algorithm", "expected ilp, flow or hybrid, got " + value);
  }
}
