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

package com.thesisalloc.cost;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.thesisalloc.config.PreferenceConfig;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.OverrideCosts;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

public final class PreferenceCostModelTest {
  private static final Topic A = new Topic("A", "C1", "D1", 1);
  private static final Topic B = new Topic("B", "C1", "D1", 1);
  private static final Topic C = new Topic("C", "C1", "D1", 1);

  private static PreferenceCostModel defaultModel() {
    return new PreferenceCostModel(PreferenceConfig.defaults(), OverrideCosts.empty());
  }

  @Test
  public void cost_forcedTopic_dominatesEverything() {
    Student student =
        Student.newBuilder("S1").addTier(1, "A").addRanks("A").setForcedTopic("B").build();
    OverrideCosts overrides = OverrideCosts.newBuilder().put("S1", "B", 7).build();
    PreferenceCostModel model = new PreferenceCostModel(PreferenceConfig.defaults(), overrides);

    assertThat(model.cost(student, B)).isEqualTo(OptionalInt.of(PreferenceCostModel.FORCED_COST));
    assertThat(model.cost(student, A)).isEqualTo(OptionalInt.empty());
    assertThat(model.cost(student, C)).isEqualTo(OptionalInt.empty());
  }

  @Test
  public void cost_bannedForcedTopic_leavesNothingAdmissible() {
    Student student = Student.newBuilder("S1").setForcedTopic("A").addBanned("A").build();
    PreferenceCostModel model = defaultModel();

    assertThat(model.cost(student, A).isPresent()).isFalse();
    assertThat(model.cost(student, B).isPresent()).isFalse();
  }

  @Test
  public void cost_banWinsOverOverrideAndPreferences() {
    Student student = Student.newBuilder("S1").addTier(1, "A").addBanned("A").build();
    OverrideCosts overrides = OverrideCosts.newBuilder().put("S1", "A", 3).build();
    PreferenceCostModel model = new PreferenceCostModel(PreferenceConfig.defaults(), overrides);

    assertThat(model.cost(student, A).isPresent()).isFalse();
  }

  @Test
  public void cost_overrideWinsOverTiers() {
    Student student = Student.newBuilder("S1").addTier(3, "A").addRanks("B").build();
    OverrideCosts overrides =
        OverrideCosts.newBuilder().put("S1", "A", 42).put("S1", "C", -3).build();
    PreferenceCostModel model = new PreferenceCostModel(PreferenceConfig.defaults(), overrides);

    assertThat(model.cost(student, A)).isEqualTo(OptionalInt.of(42));
    assertThat(model.cost(student, C)).isEqualTo(OptionalInt.of(-3));
    assertThat(model.cost(student, B)).isEqualTo(OptionalInt.of(0));
  }

  @Test
  public void cost_tiersAndRanks_useConfiguredCosts() {
    PreferenceConfig config =
        PreferenceConfig.newBuilder()
            .setTier2Cost(4)
            .setTier3Cost(9)
            .setUnrankedCost(50)
            .build();
    Student student =
        Student.newBuilder("S1")
            .addTier(1, "T1")
            .addTier(2, "T2")
            .addTier(3, "T3")
            .addRanks("R1", "R2", "R3", "R4", "R5")
            .build();
    PreferenceCostModel model = new PreferenceCostModel(config, OverrideCosts.empty());

    assertThat(model.cost(student, new Topic("T1", "C1", "D1", 1))).isEqualTo(OptionalInt.of(0));
    assertThat(model.cost(student, new Topic("T2", "C1", "D1", 1))).isEqualTo(OptionalInt.of(4));
    assertThat(model.cost(student, new Topic("T3", "C1", "D1", 1))).isEqualTo(OptionalInt.of(9));
    assertThat(model.cost(student, new Topic("R1", "C1", "D1", 1))).isEqualTo(OptionalInt.of(0));
    assertThat(model.cost(student, new Topic("R2", "C1", "D1", 1))).isEqualTo(OptionalInt.of(1));
    assertThat(model.cost(student, new Topic("R3", "C1", "D1", 1)))
        .isEqualTo(OptionalInt.of(100));
    assertThat(model.cost(student, new Topic("R5", "C1", "D1", 1)))
        .isEqualTo(OptionalInt.of(102));
    assertThat(model.cost(student, new Topic("X", "C1", "D1", 1))).isEqualTo(OptionalInt.of(50));
  }

  @Test
  public void rankCost_withoutTop2Bias_isLinear() {
    PreferenceConfig config = PreferenceConfig.newBuilder().setTop2Bias(false).build();
    PreferenceCostModel model = new PreferenceCostModel(config, OverrideCosts.empty());
    for (int rank = 1; rank <= 5; ++rank) {
      assertThat(model.rankCost(rank)).isEqualTo(rank - 1);
    }
  }

  @Test
  public void defaults_orderPreferenceClasses() {
    PreferenceConfig config = PreferenceConfig.defaults();
    PreferenceCostModel model = defaultModel();

    assertThat(PreferenceCostModel.FORCED_COST).isLessThan(0);
    assertThat(0).isLessThan(config.getTier2Cost());
    assertThat(config.getTier2Cost()).isLessThan(config.getTier3Cost());
    assertThat(config.getTier3Cost()).isLessThan(model.rankCost(3));
    assertThat(model.rankCost(5)).isLessThan(config.getUnrankedCost());
  }

  @Test
  public void cost_unrankedDisallowed_isInadmissible() {
    PreferenceConfig config = PreferenceConfig.newBuilder().setAllowUnranked(false).build();
    PreferenceCostModel model = new PreferenceCostModel(config, OverrideCosts.empty());
    Student student = Student.newBuilder("S1").addRanks("A").build();

    assertThat(model.cost(student, A)).isEqualTo(OptionalInt.of(0));
    assertThat(model.cost(student, B).isPresent()).isFalse();
  }

  @Test
  public void computeCosts_buildsSparseMatrixOverPlanningStudents() {
    AllocationInput input =
        AllocationInput.newBuilder()
            .addStudent(Student.newBuilder("S1").addRanks("A", "C").build())
            .addStudent(Student.newBuilder("S2").setPlanning(false).addRanks("A").build())
            .addStudent(Student.newBuilder("S3").addBanned("A", "B", "C").build())
            .addTopic(A)
            .addTopic(B)
            .addTopic(C)
            .addCoach(new Coach("C1", "D1", 3))
            .addDepartment(new Department("D1", 0))
            .build();
    PreferenceConfig config = PreferenceConfig.newBuilder().setAllowUnranked(false).build();
    CostMatrix costs =
        new PreferenceCostModel(config, OverrideCosts.empty()).computeCosts(input);

    assertThat(costs.numStudents()).isEqualTo(2);
    assertThat(costs.numTopics()).isEqualTo(3);
    assertThat(costs.numEntries()).isEqualTo(2);
    assertThat(costs.studentIndex("S2")).isEqualTo(-1);
    int s1 = costs.studentIndex("S1");
    assertThat(costs.rowTopics(s1)).asList().containsExactly(0, 2).inOrder();
    assertThat(costs.cost(s1, costs.topicIndex("C"))).isEqualTo(1);
    assertThat(costs.isAdmissible(s1, costs.topicIndex("B"))).isFalse();
    assertThat(costs.columnStudents(0)).asList().containsExactly(s1);
    assertThat(costs.unassignableStudentIds()).containsExactly("S3");
    assertThat(costs.numAssignableStudents()).isEqualTo(1);
    assertThrows(IllegalArgumentException.class, () -> costs.cost(s1, costs.topicIndex("B")));
  }
}
