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

package com.thesisalloc.diagnostics;

import com.thesisalloc.cost.CostMatrix;
import java.util.ArrayList;
import java.util.List;

/** Finds students whose assigned topic has an equally cheap admissible alternative. */
public final class TieDetector {
  private TieDetector() {}

  /**
   * Scans every assigned student.
   *
   * @param assignedTopic topic index per planning student of {@code costs}, -1 if unassigned
   */
  public static List<TieReport> detect(CostMatrix costs, int[] assignedTopic) {
    List<TieReport> ties = new ArrayList<>();
    for (int s = 0; s < costs.numStudents(); ++s) {
      int assigned = assignedTopic[s];
      if (assigned < 0) {
        continue;
      }
      int assignedCost = costs.cost(s, assigned);
      int[] topics = costs.rowTopics(s);
      int[] rowCosts = costs.rowCosts(s);
      List<String> alternatives = new ArrayList<>();
      for (int i = 0; i < topics.length; ++i) {
        if (topics[i] != assigned && rowCosts[i] == assignedCost) {
          alternatives.add(costs.topic(topics[i]).getId());
        }
      }
      if (!alternatives.isEmpty()) {
        ties.add(
            new TieReport(
                costs.student(s).getId(),
                costs.topic(assigned).getId(),
                assignedCost,
                alternatives));
      }
    }
    return ties;
  }
}
