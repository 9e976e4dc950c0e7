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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.Loader;
import com.thesisalloc.Scenarios;
import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.config.Algorithm;
import com.thesisalloc.diagnostics.SolveStatus;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.solver.flow.FlowSolver;
import com.thesisalloc.solver.ilp.ExactSolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class HybridSelectorTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static AllocationResult runHybrid(AllocationInput input, AllocationConfig config) {
    HybridSelector hybrid =
        new HybridSelector(new ExactSolver(input, config), new FlowSolver(input, config));
    hybrid.build();
    return hybrid.solve();
  }

  @Test
  public void solve_beforeBuild_throws() {
    AllocationInput input = Scenarios.twoPopularTopics();
    AllocationConfig config = Scenarios.strictConfig();
    HybridSelector hybrid =
        new HybridSelector(new ExactSolver(input, config), new FlowSolver(input, config));
    assertThrows(IllegalStateException.class, hybrid::solve);
  }

  @Test
  public void solve_equalObjectives_keepsExactResult() {
    AllocationResult result = runHybrid(Scenarios.twoPopularTopics(), Scenarios.strictConfig());

    assertThat(result.getAlgorithm()).isEqualTo(Algorithm.ILP);
    assertThat(result.getAlgorithmLabel()).isEqualTo(HybridSelector.ILP_BETTER);
    assertThat(result.getDiagnostics().getObjectiveValue()).isWithin(1e-6).of(1.0);
  }

  @Test
  public void solve_flowWithoutPenalties_winsOnRawObjective() {
    // The exact solver pays for two overflow places; the flow solver simply leaves two out.
    AllocationConfig config = Scenarios.withTopicOverflow(Scenarios.strictConfig(), true);
    AllocationResult result = runHybrid(Scenarios.crowdedTopic(), config);

    assertThat(result.getAlgorithm()).isEqualTo(Algorithm.FLOW);
    assertThat(result.getAlgorithmLabel()).isEqualTo(HybridSelector.FLOW_BETTER);
    assertThat(result.getDiagnostics().getStatus()).isEqualTo(SolveStatus.PARTIAL);
    assertThat(result.getRows()).hasSize(1);
  }

  @Test
  public void solve_exactInfeasible_fallsBackToFlow() {
    AllocationResult result = runHybrid(Scenarios.crowdedTopic(), Scenarios.strictConfig());

    assertThat(result.getAlgorithm()).isEqualTo(Algorithm.FLOW);
    assertThat(result.getDiagnostics().hasObjectiveValue()).isTrue();
  }
}
