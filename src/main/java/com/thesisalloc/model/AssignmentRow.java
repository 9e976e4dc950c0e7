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

package com.thesisalloc.model;

import java.util.Objects;

/** One student's assignment as handed to the reporting side. */
public final class AssignmentRow {
  private final String studentId;
  private final String topicId;
  private final String coachId;
  private final String departmentId;
  private final PreferenceRank preferenceRank;
  private final int effectiveCost;
  private final boolean viaTopicOverflow;
  private final boolean viaCoachOverflow;

  public AssignmentRow(
      String studentId,
      String topicId,
      String coachId,
      String departmentId,
      PreferenceRank preferenceRank,
      int effectiveCost,
      boolean viaTopicOverflow,
      boolean viaCoachOverflow) {
    this.studentId = studentId;
    this.topicId = topicId;
    this.coachId = coachId;
    this.departmentId = departmentId;
    this.preferenceRank = preferenceRank;
    this.effectiveCost = effectiveCost;
    this.viaTopicOverflow = viaTopicOverflow;
    this.viaCoachOverflow = viaCoachOverflow;
  }

  public String getStudentId() {
    return studentId;
  }

  public String getTopicId() {
    return topicId;
  }

  public String getCoachId() {
    return coachId;
  }

  public String getDepartmentId() {
    return departmentId;
  }

  public PreferenceRank getPreferenceRank() {
    return preferenceRank;
  }

  /** The cost the solver used for this pair. */
  public int getEffectiveCost() {
    return effectiveCost;
  }

  /** True if the assigned topic is filled above its capacity. */
  public boolean isViaTopicOverflow() {
    return viaTopicOverflow;
  }

  /** True if the assigned coach is filled above its capacity. */
  public boolean isViaCoachOverflow() {
    return viaCoachOverflow;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AssignmentRow)) {
      return false;
    }
    AssignmentRow other = (AssignmentRow) o;
    return studentId.equals(other.studentId)
        && topicId.equals(other.topicId)
        && coachId.equals(other.coachId)
        && departmentId.equals(other.departmentId)
        && preferenceRank == other.preferenceRank
        && effectiveCost == other.effectiveCost
        && viaTopicOverflow == other.viaTopicOverflow
        && viaCoachOverflow == other.viaCoachOverflow;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        studentId,
        topicId,
        coachId,
        departmentId,
        preferenceRank,
        effectiveCost,
        viaTopicOverflow,
        viaCoachOverflow);
  }

  @Override
  public String toString() {
    return studentId + " -> " + topicId + " (" + preferenceRank + ", cost=" + effectiveCost + ")";
  }
}
