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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the reporting side needs besides the assignment rows.
 *
 * <p>Planning students are partitioned into the assigned ones, {@link #getUnassignable()} and
 * {@link #getUnassignedAfterSolve()}. Overflow maps hold one entry per topic and per coach;
 * the shortfall map holds one entry per department with a positive desired minimum.
 */
public final class Diagnostics {
  private final SolveStatus status;
  private final double objectiveValue;
  private final List<String> unassignable;
  private final List<String> unassignedAfterSolve;
  private final Map<String, Integer> topicOverflow;
  private final Map<String, Integer> coachOverflow;
  private final Map<String, Integer> departmentShortfall;
  private final List<TieReport> ties;

  Diagnostics(
      SolveStatus status,
      double objectiveValue,
      List<String> unassignable,
      List<String> unassignedAfterSolve,
      Map<String, Integer> topicOverflow,
      Map<String, Integer> coachOverflow,
      Map<String, Integer> departmentShortfall,
      List<TieReport> ties) {
    this.status = status;
    this.objectiveValue = objectiveValue;
    this.unassignable = Collections.unmodifiableList(new ArrayList<>(unassignable));
    this.unassignedAfterSolve = Collections.unmodifiableList(new ArrayList<>(unassignedAfterSolve));
    this.topicOverflow = Collections.unmodifiableMap(new LinkedHashMap<>(topicOverflow));
    this.coachOverflow = Collections.unmodifiableMap(new LinkedHashMap<>(coachOverflow));
    this.departmentShortfall =
        Collections.unmodifiableMap(new LinkedHashMap<>(departmentShortfall));
    this.ties = Collections.unmodifiableList(new ArrayList<>(ties));
  }

  public SolveStatus getStatus() {
    return status;
  }

  /** Status as a display string, e.g. {@code "Optimal"}. */
  public String getStatusString() {
    return status.getLabel();
  }

  /** Objective reported by the solver, {@code NaN} if no solution was found. */
  public double getObjectiveValue() {
    return objectiveValue;
  }

  public boolean hasObjectiveValue() {
    return !Double.isNaN(objectiveValue);
  }

  /** Planning students with no admissible topic. */
  public List<String> getUnassignable() {
    return unassignable;
  }

  /** Planning students with admissible topics that the solve left without a topic. */
  public List<String> getUnassignedAfterSolve() {
    return unassignedAfterSolve;
  }

  public Map<String, Integer> getTopicOverflow() {
    return topicOverflow;
  }

  public Map<String, Integer> getCoachOverflow() {
    return coachOverflow;
  }

  public Map<String, Integer> getDepartmentShortfall() {
    return departmentShortfall;
  }

  /** Tie witnesses; always empty for the flow solver. */
  public List<TieReport> getTies() {
    return ties;
  }

  @Override
  public String toString() {
    return "Diagnostics{status=" + status.getLabel()
        + ", objective=" + objectiveValue
        + ", unassignable=" + unassignable.size()
        + ", unassignedAfterSolve=" + unassignedAfterSolve.size()
        + ", ties=" + ties.size() + "}";
  }
}
