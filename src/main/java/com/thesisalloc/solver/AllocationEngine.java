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

import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.solver.flow.FlowSolver;
import com.thesisalloc.solver.ilp.ExactSolver;
import com.thesisalloc.solver.ilp.IntegerProgramBackend;
import com.thesisalloc.solver.ilp.IntegerProgramBackends;
import java.util.logging.Logger;

/** Entry point of the core: picks the strategy named by the configuration, builds and solves it. */
public final class AllocationEngine {
  private static final Logger logger = Logger.getLogger(AllocationEngine.class.getName());

  private final AllocationInput input;
  private final AllocationConfig config;
  private final IntegerProgramBackend backend;

  public AllocationEngine(AllocationInput input, AllocationConfig config) {
    this(input, config, null);
  }

  /** @param backend exact-solver backend, or null to use the one configured */
  public AllocationEngine(
      AllocationInput input, AllocationConfig config, IntegerProgramBackend backend) {
    this.input = input;
    this.config = config;
    this.backend = backend;
  }

  /** Creates the solver for the configured algorithm, unbuilt. */
  public AllocationSolver newSolver() {
    switch (config.getSolver().getAlgorithm()) {
      case ILP:
        return newExactSolver();
      case FLOW:
        return new FlowSolver(input, config);
      case HYBRID:
        return new HybridSelector(newExactSolver(), new FlowSolver(input, config));
      default:
        throw new IllegalStateException(
            "Unsupported algorithm: " + config.getSolver().getAlgorithm());
    }
  }

  private ExactSolver newExactSolver() {
    IntegerProgramBackend ilpBackend =
        backend != null
            ? backend
            : IntegerProgramBackends.create(config.getSolver().getIlpBackend());
    return new ExactSolver(input, config, ilpBackend);
  }

  public AllocationResult run() {
    AllocationSolver solver = newSolver();
    logger.info("Running " + solver.algorithm().key() + " allocation");
    long start = System.currentTimeMillis();
    solver.build();
    AllocationResult result = solver.solve();
    logger.info(
        "Allocation finished in " + (System.currentTimeMillis() - start) + " ms: "
            + result.getRows().size() + " assignments, status "
            + result.getDiagnostics().getStatusString());
    return result;
  }
}
