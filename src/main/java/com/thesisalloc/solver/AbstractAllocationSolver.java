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

package com.thesisalloc.solver;

import com.thesisalloc.capacity.CapacityModel;
import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.cost.CostMatrix;
import com.thesisalloc.cost.PreferenceCostModel;
import com.thesisalloc.diagnostics.Diagnostics;
import com.thesisalloc.diagnostics.DiagnosticsBuilder;
import com.thesisalloc.diagnostics.SolveStatus;
import com.thesisalloc.diagnostics.TieReport;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.AssignmentRow;
import com.thesisalloc.model.PreferenceRank;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import java.util.ArrayList;
import java.util.List;

/** Shared build/solve lifecycle and result extraction of the single-strategy solvers. */
public abstract class AbstractAllocationSolver implements AllocationSolver {
  protected final AllocationInput input;
  protected final AllocationConfig config;
  protected final PreferenceCostModel costModel;

  protected CostMatrix costs;
  protected CapacityModel capacities;
  private boolean built;

  protected AbstractAllocationSolver(AllocationInput input, AllocationConfig config) {
    this.input = input;
    this.config = config;
    this.costModel = new PreferenceCostModel(config.getPreference(), input.getOverrides());
  }

  @Override
  public final void build() {
    costs = costModel.computeCosts(input);
    capacities = new CapacityModel(input, costs, config.getCapacity());
    buildModel();
    built = true;
  }

  @Override
  public final AllocationResult solve() {
    if (!built) {
      throw new IllegalStateException("Model not built. Call build() first.");
    }
    return solveModel();
  }

  /** Formulates the strategy's model from {@link #costs} and {@link #capacities}. */
  protected abstract void buildModel();

  protected abstract AllocationResult solveModel();

  /**
   * Turns a per-student topic choice into rows plus diagnostics.
   *
   * @param assignedTopic topic index per planning student, -1 if unassigned
   */
  protected AllocationResult toResult(
      int[] assignedTopic, SolveStatus status, double objectiveValue, List<TieReport> ties) {
    Diagnostics diagnostics =
        DiagnosticsBuilder.derive(costs, capacities, assignedTopic, status, objectiveValue, ties);
    List<AssignmentRow> rows = new ArrayList<>();
    for (int s = 0; s < costs.numStudents(); ++s) {
      int t = assignedTopic[s];
      if (t < 0) {
        continue;
      }
      Student student = costs.student(s);
      Topic topic = costs.topic(t);
      rows.add(
          new AssignmentRow(
              student.getId(),
              topic.getId(),
              topic.getCoachId(),
              topic.getDepartmentId(),
              PreferenceRank.classify(student, topic.getId()),
              costs.cost(s, t),
              diagnostics.getTopicOverflow().getOrDefault(topic.getId(), 0) > 0,
              diagnostics.getCoachOverflow().getOrDefault(topic.getCoachId(), 0) > 0));
    }
    return new AllocationResult(rows, diagnostics, algorithm(), algorithm().key());
  }
}
