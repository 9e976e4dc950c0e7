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

package com.thesisalloc.config;

import java.util.Objects;

/** Complete, validated configuration of one allocation run. */
public final class AllocationConfig {
  private final PreferenceConfig preference;
  private final CapacityConfig capacity;
  private final SolverConfig solver;

  public AllocationConfig(
      PreferenceConfig preference, CapacityConfig capacity, SolverConfig solver) {
    this.preference = Objects.requireNonNull(preference, "preference");
    this.capacity = Objects.requireNonNull(capacity, "capacity");
    this.solver = Objects.requireNonNull(solver, "solver");
  }

  public static AllocationConfig defaults() {
    return new AllocationConfig(
        PreferenceConfig.defaults(), CapacityConfig.defaults(), SolverConfig.defaults());
  }

  public PreferenceConfig getPreference() {
    return preference;
  }

  public CapacityConfig getCapacity() {
    return capacity;
  }

  public SolverConfig getSolver() {
    return solver;
  }

  public AllocationConfig withPreference(PreferenceConfig preference) {
    return new AllocationConfig(preference, capacity, solver);
  }

  public AllocationConfig withCapacity(CapacityConfig capacity) {
    return new AllocationConfig(preference, capacity, solver);
  }

  public AllocationConfig withSolver(SolverConfig solver) {
    return new AllocationConfig(preference, capacity, solver);
  }

  @Override
  public String toString() {
    return preference + " " + capacity + " " + solver;
  }
}
