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

/** Outcome of a solve. Only {@link #OPTIMAL} means the objective is proven minimal. */
public enum SolveStatus {
  OPTIMAL("Optimal"),
  /** A feasible solution was found but not proven optimal, typically because of a time limit. */
  FEASIBLE("Feasible"),
  /** The flow solver could not route every assignable student within the hard capacities. */
  PARTIAL("Partial"),
  INFEASIBLE("Infeasible"),
  UNBOUNDED("Unbounded"),
  /** No solution was found, typically because of a time limit. */
  NOT_SOLVED("Not Solved"),
  MODEL_INVALID("Model Invalid"),
  ABNORMAL("Abnormal");

  private final String label;

  SolveStatus(String label) {
    this.label = label;
  }

  /** Human-readable status, as printed in reports. */
  public String getLabel() {
    return label;
  }

  /** Whether an assignment can be read from the solve. */
  public boolean hasSolution() {
    return this == OPTIMAL || this == FEASIBLE || this == PARTIAL;
  }
}
