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

/**
 * A solving strategy. {@link #build()} must be called before {@link #solve()}; solving an unbuilt
 * solver throws {@link IllegalStateException}.
 */
public interface AllocationSolver {
  /** Computes costs and formulates the model. */
  void build();

  /** Solves the built model. Infeasibility and time limits are reported, never thrown. */
  AllocationResult solve();

  Algorithm algorithm();
}
