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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public final class PreferenceRankTest {
  @Test
  public void classify_followsForcedThenTiersThenRanks() {
    Student student =
        Student.newBuilder("S1")
            .addTier(1, "T1")
            .addTier(2, "T2")
            .addTier(3, "T3")
            .addRanks("T1", "R2", "R3")
            .setForcedTopic("F")
            .build();

    assertThat(PreferenceRank.classify(student, "F")).isEqualTo(PreferenceRank.FORCED);
    assertThat(PreferenceRank.classify(student, "T1")).isEqualTo(PreferenceRank.TIER_1);
    assertThat(PreferenceRank.classify(student, "T2")).isEqualTo(PreferenceRank.TIER_2);
    assertThat(PreferenceRank.classify(student, "T3")).isEqualTo(PreferenceRank.TIER_3);
    assertThat(PreferenceRank.classify(student, "R2")).isEqualTo(PreferenceRank.RANK_2);
    assertThat(PreferenceRank.classify(student, "R3")).isEqualTo(PreferenceRank.RANK_3);
    assertThat(PreferenceRank.classify(student, "X")).isEqualTo(PreferenceRank.UNRANKED);
  }

  @Test
  public void codes_roundTripAndDoNotCollide() {
    assertThat(PreferenceRank.FORCED.getCode()).isEqualTo(-1);
    assertThat(PreferenceRank.TIER_1.getCode()).isEqualTo(0);
    assertThat(PreferenceRank.RANK_1.getCode()).isEqualTo(10);
    assertThat(PreferenceRank.RANK_5.getCode()).isEqualTo(14);
    assertThat(PreferenceRank.UNRANKED.getCode()).isEqualTo(999);
    for (PreferenceRank rank : PreferenceRank.values()) {
      assertThat(PreferenceRank.fromCode(rank.getCode())).isEqualTo(rank);
    }
    assertThrows(IllegalArgumentException.class, () -> PreferenceRank.fromCode(3));
    assertThrows(IllegalArgumentException.class, () -> PreferenceRank.forRank(6));
  }

  @Test
  public void student_rejectsSixthRank() {
    Student.Builder builder = Student.newBuilder("S1").addRanks("A", "B", "C", "D", "E");
    assertThrows(IllegalArgumentException.class, () -> builder.addRanks("F"));
    assertThrows(IllegalArgumentException.class, () -> builder.addTier(4, "A"));
  }
}
