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

import com.google.ortools.modelbuilder.Variable;
import com.thesisalloc.diagnostics.SolveStatus;

/**
 * Result of a backend solve: status, objective and one rounded value per model variable. Values
 * are looked up by variable index, so variables of a model and of its clone read the same slot.
 */
public final class IntegerProgramSolution {
  private final SolveStatus status;
  private final double objectiveValue;
  private final long[] values;

  public IntegerProgramSolution(SolveStatus status, double objectiveValue, long[] values) {
    this.status = status;
    this.objectiveValue = objectiveValue;
    this.values = values;
  }

  /** A solve that produced no solution at all. */
  public static IntegerProgramSolution noSolution(SolveStatus status) {
    return new IntegerProgramSolution(status, Double.NaN, null);
  }

  public SolveStatus getStatus() {
    return status;
  }

  public boolean hasSolution() {
    return values != null;
  }

  /** Objective of the returned solution; {@code NaN} without solution. */
  public double getObjectiveValue() {
    return objectiveValue;
  }

  public long value(Variable variable) {
    if (values == null) {
      throw new IllegalStateException("no solution was found (status " + status + ")");
    }
    return values[variable.getIndex()];
  }
}
