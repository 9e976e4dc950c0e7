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

import com.thesisalloc.capacity.CapacityModel;
import com.thesisalloc.cost.CostMatrix;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives {@link Diagnostics} from a finished solve.
 *
 * <p>Overflow and shortfall amounts are measured on the assignment itself, so both solvers report
 * them the same way: overflow is {@code max(0, load - capacity)}, shortfall is {@code max(0,
 * minimum - load)}.
 */
public final class DiagnosticsBuilder {
  private DiagnosticsBuilder() {}

  /**
   * @param assignedTopic topic index per planning student of {@code costs}, -1 if unassigned
   * @param objectiveValue solver objective, {@code NaN} if there is none
   * @param ties tie witnesses, empty when the solver does not produce them
   */
  public static Diagnostics derive(
      CostMatrix costs,
      CapacityModel capacities,
      int[] assignedTopic,
      SolveStatus status,
      double objectiveValue,
      List<TieReport> ties) {
    List<String> unassignable = new ArrayList<>();
    List<String> unassigned = new ArrayList<>();
    for (int s = 0; s < costs.numStudents(); ++s) {
      if (costs.isUnassignable(s)) {
        unassignable.add(costs.student(s).getId());
      } else if (assignedTopic[s] < 0) {
        unassigned.add(costs.student(s).getId());
      }
    }

    int[] topicLoads = capacities.topicLoads(assignedTopic);
    int[] coachLoads = capacities.coachLoads(topicLoads);
    int[] departmentLoads = capacities.departmentLoads(topicLoads);

    Map<String, Integer> topicOverflow = new LinkedHashMap<>();
    for (int t = 0; t < capacities.numTopics(); ++t) {
      topicOverflow.put(
          costs.topic(t).getId(), Math.max(0, topicLoads[t] - capacities.topicCapacity(t)));
    }
    Map<String, Integer> coachOverflow = new LinkedHashMap<>();
    for (int c = 0; c < capacities.numCoaches(); ++c) {
      coachOverflow.put(
          capacities.coach(c).getId(), Math.max(0, coachLoads[c] - capacities.coachCapacity(c)));
    }
    Map<String, Integer> shortfall = new LinkedHashMap<>();
    for (int d = 0; d < capacities.numDepartments(); ++d) {
      int minimum = capacities.departmentMinimum(d);
      if (minimum > 0) {
        shortfall.put(capacities.department(d).getId(), Math.max(0, minimum - departmentLoads[d]));
      }
    }

    return new Diagnostics(
        status,
        objectiveValue,
        unassignable,
        unassigned,
        topicOverflow,
        coachOverflow,
        shortfall,
        ties == null ? Collections.<TieReport>emptyList() : ties);
  }
}
