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

import com.thesisalloc.config.Algorithm;
import java.util.logging.Logger;

/**
 * Runs the exact and the flow solver one after the other and keeps the result with the lower
 * objective. Each objective is measured in its own solver's terms: the flow objective never holds
 * overflow or shortfall penalties. The exact result wins ties, and a missing objective counts as
 * infinitely bad.
 */
public final class HybridSelector implements AllocationSolver {
  private static final Logger logger = Logger.getLogger(HybridSelector.class.getName());

  public static final String ILP_BETTER = "hybrid (ilp better)";
  public static final String FLOW_BETTER = "hybrid (flow better)";

  private final AllocationSolver exact;
  private final AllocationSolver flow;
  private boolean built;

  public HybridSelector(AllocationSolver exact, AllocationSolver flow) {
    this.exact = exact;
    this.flow = flow;
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.HYBRID;
  }

  @Override
  public void build() {
    exact.build();
    flow.build();
    built = true;
  }

  @Override
  public AllocationResult solve() {
    if (!built) {
      throw new IllegalStateException("Model not built. Call build() first.");
    }
    AllocationResult exactResult = exact.solve();
    AllocationResult flowResult = flow.solve();
    double exactObjective = comparable(exactResult);
    double flowObjective = comparable(flowResult);
    logger.info("Hybrid objectives: ilp=" + exactObjective + ", flow=" + flowObjective);
    if (exactObjective <= flowObjective) {
      return exactResult.withLabel(ILP_BETTER);
    }
    return flowResult.withLabel(FLOW_BETTER);
  }

  private static double comparable(AllocationResult result) {
    double objective = result.getDiagnostics().getObjectiveValue();
    return Double.isNaN(objective) ? Double.POSITIVE_INFINITY : objective;
  }
}
