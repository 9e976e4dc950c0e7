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
import com.thesisalloc.diagnostics.Diagnostics;
import com.thesisalloc.model.AssignmentRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Assignment rows and diagnostics of one solve, owned by the caller. */
public final class AllocationResult {
  private final List<AssignmentRow> rows;
  private final Diagnostics diagnostics;
  private final Algorithm algorithm;
  private final String algorithmLabel;

  public AllocationResult(
      List<AssignmentRow> rows, Diagnostics diagnostics, Algorithm algorithm, String label) {
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    this.diagnostics = diagnostics;
    this.algorithm = algorithm;
    this.algorithmLabel = label;
  }

  public List<AssignmentRow> getRows() {
    return rows;
  }

  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  /** Algorithm that produced the rows; for a hybrid run, the winning one. */
  public Algorithm getAlgorithm() {
    return algorithm;
  }

  /** Label such as {@code "ilp"} or {@code "hybrid (flow better)"}. */
  public String getAlgorithmLabel() {
    return algorithmLabel;
  }

  /** Returns a copy carrying a different label. */
  public AllocationResult withLabel(String label) {
    return new AllocationResult(rows, diagnostics, algorithm, label);
  }
}
