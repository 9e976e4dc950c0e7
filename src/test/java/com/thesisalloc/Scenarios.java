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

package com.thesisalloc;

import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.config.CapacityConfig;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;

/** Small allocation instances shared by the solver tests. */
public final class Scenarios {
  private Scenarios() {}

  /** Configuration with both overflows off and unranked topics inadmissible. */
  public static AllocationConfig strictConfig() {
    AllocationConfig defaults = AllocationConfig.defaults();
    return defaults
        .withPreference(defaults.getPreference().toBuilder().setAllowUnranked(false).build())
        .withCapacity(
            defaults.getCapacity().toBuilder()
                .setTopicOverflow(false)
                .setCoachOverflow(false)
                .build());
  }

  /** S1, S2, S3 all rank A then B; A and B hold 2 each under one coach with room for 4. */
  public static AllocationInput twoPopularTopics() {
    return AllocationInput.newBuilder()
        .addStudent(Student.newBuilder("S1").addRanks("A", "B").build())
        .addStudent(Student.newBuilder("S2").addRanks("A", "B").build())
        .addStudent(Student.newBuilder("S3").addRanks("A", "B").build())
        .addTopic(new Topic("A", "C1", "D1", 2))
        .addTopic(new Topic("B", "C1", "D1", 2))
        .addCoach(new Coach("C1", "D1", 4))
        .addDepartment(new Department("D1", 0))
        .build();
  }

  /**
   * Every student has distinct costs (ranks without the top-2 bias) and the optimum is unique:
   * S1 to A, S2 to C, S3 to B with total cost 1.
   */
  public static AllocationInput distinctCosts() {
    return AllocationInput.newBuilder()
        .addStudent(Student.newBuilder("S1").addRanks("A", "B", "C").build())
        .addStudent(Student.newBuilder("S2").addRanks("A", "C", "B").build())
        .addStudent(Student.newBuilder("S3").addRanks("B", "A", "C").build())
        .addTopic(new Topic("A", "C1", "D1", 1))
        .addTopic(new Topic("B", "C1", "D1", 1))
        .addTopic(new Topic("C", "C2", "D1", 2))
        .addCoach(new Coach("C1", "D1", 10))
        .addCoach(new Coach("C2", "D1", 10))
        .addDepartment(new Department("D1", 0))
        .build();
  }

  public static AllocationConfig distinctCostsConfig() {
    AllocationConfig strict = strictConfig();
    return strict.withPreference(strict.getPreference().toBuilder().setTop2Bias(false).build());
  }

  /** Three students that only accept A, which holds one. */
  public static AllocationInput crowdedTopic() {
    return AllocationInput.newBuilder()
        .addStudent(Student.newBuilder("S1").addRanks("A").build())
        .addStudent(Student.newBuilder("S2").addRanks("A").build())
        .addStudent(Student.newBuilder("S3").addRanks("A").build())
        .addTopic(new Topic("A", "C1", "D1", 1))
        .addCoach(new Coach("C1", "D1", 5))
        .addDepartment(new Department("D1", 0))
        .build();
  }

  /**
   * Two students ranking only A (department D1); B belongs to D2 whose desired minimum is {@code
   * minimum}. B is reachable at the unranked cost.
   */
  public static AllocationInput departmentMinimum(int minimum) {
    return AllocationInput.newBuilder()
        .addStudent(Student.newBuilder("S1").addRanks("A").build())
        .addStudent(Student.newBuilder("S2").addRanks("A").build())
        .addTopic(new Topic("A", "C1", "D1", 2))
        .addTopic(new Topic("B", "C2", "D2", 5))
        .addCoach(new Coach("C1", "D1", 5))
        .addCoach(new Coach("C2", "D2", 5))
        .addDepartment(new Department("D1", 0))
        .addDepartment(new Department("D2", minimum))
        .build();
  }

  public static AllocationConfig withTopicOverflow(AllocationConfig config, boolean enabled) {
    CapacityConfig capacity = config.getCapacity().toBuilder().setTopicOverflow(enabled).build();
    return config.withCapacity(capacity);
  }
}
