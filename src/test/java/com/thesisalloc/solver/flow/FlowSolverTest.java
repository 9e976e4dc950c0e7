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

package com.thesisalloc.solver.flow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.thesisalloc.Scenarios;
import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.cost.PreferenceCostModel;
import com.thesisalloc.diagnostics.Diagnostics;
import com.thesisalloc.diagnostics.SolveStatus;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.AssignmentRow;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import com.thesisalloc.solver.AllocationResult;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public final class FlowSolverTest {
  private static AllocationResult solve(AllocationInput input, AllocationConfig config) {
    FlowSolver solver = new FlowSolver(input, config);
    solver.build();
    return solver.solve();
  }

  @Test
  public void solve_beforeBuild_throws() {
    FlowSolver solver = new FlowSolver(Scenarios.twoPopularTopics(), Scenarios.strictConfig());
    assertThrows(IllegalStateException.class, solver::solve);
  }

  @Test
  public void build_createsLayeredNetwork() {
    FlowSolver solver = new FlowSolver(Scenarios.twoPopularTopics(), Scenarios.strictConfig());
    solver.build();
    MinCostFlowNetwork network = solver.getNetwork();
    // source + 3 students + 2 topics + 1 coach + sink
    assertThat(network.getNumNodes()).isEqualTo(8);
    // 3 source arcs + 6 pair arcs + 2 topic arcs + 1 coach arc
    assertThat(network.getNumArcs()).isEqualTo(12);
  }

  @Test
  public void solve_twoPopularTopics_splitsTwoAndOne() {
    AllocationResult result = solve(Scenarios.twoPopularTopics(), Scenarios.strictConfig());
    Diagnostics diagnostics = result.getDiagnostics();

    assertThat(diagnostics.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
    assertThat(diagnostics.getObjectiveValue()).isWithin(1e-9).of(1.0);
    Map<String, Integer> counts = new HashMap<>();
    for (AssignmentRow row : result.getRows()) {
      counts.merge(row.getTopicId(), 1, Integer::sum);
    }
    assertThat(counts).containsExactly("A", 2, "B", 1);
    assertThat(diagnostics.getUnassignedAfterSolve()).isEmpty();
    assertThat(diagnostics.getTies()).isEmpty();
    assertThat(result.getAlgorithmLabel()).isEqualTo("flow");
  }

  @Test
  public void solve_capacityTooSmall_isPartial() {
    // Overflow toggles do not apply to the flow network.
    AllocationConfig config = Scenarios.withTopicOverflow(Scenarios.strictConfig(), true);
    AllocationResult result = solve(Scenarios.crowdedTopic(), config);
    Diagnostics diagnostics = result.getDiagnostics();

    assertThat(diagnostics.getStatus()).isEqualTo(SolveStatus.PARTIAL);
    assertThat(result.getRows()).hasSize(1);
    assertThat(diagnostics.getUnassignedAfterSolve()).hasSize(2);
    assertThat(diagnostics.getTopicOverflow()).containsExactly("A", 0);
    assertThat(diagnostics.getObjectiveValue()).isWithin(1e-9).of(0.0);
  }

  @Test
  public void solve_coachCapacity_limitsAcrossTopics() {
    AllocationInput input =
        AllocationInput.newBuilder()
            .addStudent(Student.newBuilder("S1").addRanks("A").build())
            .addStudent(Student.newBuilder("S2").addRanks("B").build())
            .addStudent(Student.newBuilder("S3").addRanks("C", "A").build())
            .addTopic(new Topic("A", "C1", "D1", 2))
            .addTopic(new Topic("B", "C1", "D1", 2))
            .addTopic(new Topic("C", "C2", "D1", 1))
            .addCoach(new Coach("C1", "D1", 1))
            .addCoach(new Coach("C2", "D1", 1))
            .addDepartment(new Department("D1", 0))
            .build();
    AllocationResult result = solve(input, Scenarios.strictConfig());

    // C1 takes one of S1 and S2; S3 gets C through C2.
    assertThat(result.getRows()).hasSize(2);
    assertThat(result.getDiagnostics().getCoachOverflow()).containsExactly("C1", 0, "C2", 0);
    assertThat(result.getDiagnostics().getStatus()).isEqualTo(SolveStatus.PARTIAL);
  }

  @Test
  public void solve_forcedTopic_isRouted() {
    AllocationInput input =
        AllocationInput.newBuilder()
            .addStudent(Student.newBuilder("S1").addRanks("A").setForcedTopic("B").build())
            .addTopic(new Topic("A", "C1", "D1", 1))
            .addTopic(new Topic("B", "C1", "D1", 1))
            .addCoach(new Coach("C1", "D1", 2))
            .addDepartment(new Department("D1", 0))
            .build();
    AllocationResult result = solve(input, AllocationConfig.defaults());

    assertThat(result.getRows()).hasSize(1);
    assertThat(result.getRows().get(0).getTopicId()).isEqualTo("B");
    assertThat(result.getDiagnostics().getObjectiveValue())
        .isWithin(1e-9)
        .of(PreferenceCostModel.FORCED_COST);
  }
}
