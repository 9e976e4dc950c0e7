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

import com.google.ortools.modelbuilder.ModelBuilder;
import com.thesisalloc.config.SolverConfig;

/**
 * Solves an integer program held in a {@link ModelBuilder}. Implementations honour the time limit
 * and random seed of the {@link SolverConfig} where their engine supports it, and report limits
 * and infeasibility through the solution status instead of throwing.
 */
public interface IntegerProgramBackend {
  String name();

  IntegerProgramSolution solve(ModelBuilder model, SolverConfig config);
}
