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
import java.util.List;
import java.util.Objects;

/**
 * Witness that the optimum may not be unique: the student has admissible topics other than the
 * assigned one with the very same cost.
 */
public final class TieReport {
  private final String studentId;
  private final String assignedTopicId;
  private final int cost;
  private final List<String> alternativeTopicIds;

  public TieReport(
      String studentId, String assignedTopicId, int cost, List<String> alternativeTopicIds) {
    this.studentId = studentId;
    this.assignedTopicId = assignedTopicId;
    this.cost = cost;
    this.alternativeTopicIds = Collections.unmodifiableList(new ArrayList<>(alternativeTopicIds));
  }

  public String getStudentId() {
    return studentId;
  }

  public String getAssignedTopicId() {
    return assignedTopicId;
  }

  public int getCost() {
    return cost;
  }

  public List<String> getAlternativeTopicIds() {
    return alternativeTopicIds;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TieReport)) {
      return false;
    }
    TieReport other = (TieReport) o;
    return studentId.equals(other.studentId)
        && assignedTopicId.equals(other.assignedTopicId)
        && cost == other.cost
        && alternativeTopicIds.equals(other.alternativeTopicIds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(studentId, assignedTopicId, cost, alternativeTopicIds);
  }

  @Override
  public String toString() {
    return studentId + ": assigned " + assignedTopicId + " (cost=" + cost + "), could also take: "
        + alternativeTopicIds;
  }
}
