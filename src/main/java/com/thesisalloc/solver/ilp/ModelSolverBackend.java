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

package com.thesisalloc.solver.ilp;

import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.ModelSolver;
import com.thesisalloc.config.SolverConfig;
import com.thesisalloc.diagnostics.SolveStatus;
import java.util.logging.Logger;

/** Solves integer programs with the OR-Tools model solver, either SCIP or CP-SAT. */
public final class ModelSolverBackend implements IntegerProgramBackend {
  private static final Logger logger = Logger.getLogger(ModelSolverBackend.class.getName());

  public static final String SCIP = "scip";
  public static final String SAT = "sat";

  private final String solverName;

  /** @param solverName {@link #SCIP} or {@link #SAT} */
  public ModelSolverBackend(String solverName) {
    if (!SCIP.equals(solverName) && !SAT.equals(solverName)) {
      throw new IllegalArgumentException("unsupported model solver: " + solverName);
    }
    this.solverName = solverName;
  }

  @Override
  public String name() {
    return solverName;
  }

  @Override
  public IntegerProgramSolution solve(ModelBuilder model, SolverConfig config) {
    Loader.loadNativeLibraries();
    ModelSolver solver = new ModelSolver(solverName);
    if (!solver.solverIsSupported()) {
      throw new IllegalStateException("Solver " + solverName + " is not available");
    }
    if (config.getTimeLimit().isPresent()) {
      solver.setTimeLimit(config.getTimeLimit().get());
    }
    if (config.getRandomSeed().isPresent()) {
      solver.setSolverSpecificParameters(seedParameters(config.getRandomSeed().getAsInt()));
    }

    logger.fine(
        "Solving " + model.getName() + " with " + solverName + ": " + model.numVariables()
            + " variables, " + model.numConstraints() + " constraints");
    final com.google.ortools.modelbuilder.SolveStatus resultStatus = solver.solve(model);
    SolveStatus status = toSolveStatus(resultStatus);
    if (!status.hasSolution() || !solver.hasSolution()) {
      return IntegerProgramSolution.noSolution(status);
    }
    long[] values = new long[model.numVariables()];
    for (int i = 0; i < values.length; ++i) {
      // Integer variables come back as doubles with a small tolerance.
      values[i] = Math.round(solver.getValue(model.varFromIndex(i)));
    }
    return new IntegerProgramSolution(status, solver.getObjectiveValue(), values);
  }

  private String seedParameters(int seed) {
    if (SAT.equals(solverName)) {
      return "random_seed:" + seed;
    }
    // SCIP only accepts non-negative shifts.
    return "randomization/randomseedshift = " + Math.abs(seed);
  }

  static SolveStatus toSolveStatus(com.google.ortools.modelbuilder.SolveStatus status) {
    switch (status) {
      case OPTIMAL:
        return SolveStatus.OPTIMAL;
      case FEASIBLE:
        return SolveStatus.FEASIBLE;
      case INFEASIBLE:
        return SolveStatus.INFEASIBLE;
      case UNBOUNDED:
        return SolveStatus.UNBOUNDED;
      case MODEL_INVALID:
        return SolveStatus.MODEL_INVALID;
      case NOT_SOLVED:
        return SolveStatus.NOT_SOLVED;
      default:
        return SolveStatus.ABNORMAL;
    }
  }
}
