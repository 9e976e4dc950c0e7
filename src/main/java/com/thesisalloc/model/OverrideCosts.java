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

package com.thesisalloc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Manually specified (student, topic) costs. An override wins over every tier and rank rule, but
 * not over a forced topic or a ban.
 */
public final class OverrideCosts {
  private static final OverrideCosts EMPTY = new OverrideCosts(Collections.emptyMap());

  private final Map<String, Map<String, Integer>> costs;
  private final int size;

  private OverrideCosts(Map<String, Map<String, Integer>> costs) {
    this.costs = costs;
    int count = 0;
    for (Map<String, Integer> perStudent : costs.values()) {
      count += perStudent.size();
    }
    this.size = count;
  }

  public static OverrideCosts empty() {
    return EMPTY;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public OptionalInt get(String studentId, String topicId) {
    Map<String, Integer> perStudent = costs.get(studentId);
    if (perStudent == null) {
      return OptionalInt.empty();
    }
    Integer cost = perStudent.get(topicId);
    return cost == null ? OptionalInt.empty() : OptionalInt.of(cost);
  }

  /** Overrides of one student, keyed by topic id. */
  public Map<String, Integer> forStudent(String studentId) {
    return costs.getOrDefault(studentId, Collections.emptyMap());
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** Builder for {@link OverrideCosts}; a later put for the same pair replaces the earlier one. */
  public static final class Builder {
    private final Map<String, Map<String, Integer>> costs = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String studentId, String topicId, int cost) {
      costs.computeIfAbsent(studentId, k -> new LinkedHashMap<>()).put(topicId, cost);
      return this;
    }

    public OverrideCosts build() {
      Map<String, Map<String, Integer>> copy = new LinkedHashMap<>();
      for (Map.Entry<String, Map<String, Integer>> entry : costs.entrySet()) {
        copy.put(
            entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
      }
      return new OverrideCosts(Collections.unmodifiableMap(copy));
    }
  }
}
