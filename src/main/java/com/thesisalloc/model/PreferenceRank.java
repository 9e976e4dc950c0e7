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

/**
 * Reporting classification of an assignment. Codes do not collide between tiers and ranks so that
 * they can be counted from a flat CSV column.
 */
public enum PreferenceRank {
  FORCED(-1),
  TIER_1(0),
  TIER_2(1),
  TIER_3(2),
  RANK_1(10),
  RANK_2(11),
  RANK_3(12),
  RANK_4(13),
  RANK_5(14),
  UNRANKED(999);

  private final int code;

  PreferenceRank(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * Classifies {@code topicId} for {@code student}: forced first, then tiers, then ranks. Override
   * costs do not take part, an overridden pair keeps the classification of its preferences.
   */
  public static PreferenceRank classify(Student student, String topicId) {
    if (topicId.equals(student.getForcedTopic().orElse(null))) {
      return FORCED;
    }
    if (student.getTier(1).contains(topicId)) {
      return TIER_1;
    }
    if (student.getTier(2).contains(topicId)) {
      return TIER_2;
    }
    if (student.getTier(3).contains(topicId)) {
      return TIER_3;
    }
    int rank = student.rankOf(topicId);
    if (rank > 0) {
      return forRank(rank);
    }
    return UNRANKED;
  }

  /** Returns the constant of a 1-based rank position. */
  public static PreferenceRank forRank(int rank) {
    switch (rank) {
      case 1:
        return RANK_1;
      case 2:
        return RANK_2;
      case 3:
        return RANK_3;
      case 4:
        return RANK_4;
      case 5:
        return RANK_5;
      default:
        throw new IllegalArgumentException("rank out of range: " + rank);
    }
  }

  public static PreferenceRank fromCode(int code) {
    for (PreferenceRank rank : values()) {
      if (rank.code == code) {
        return rank;
      }
    }
    throw new IllegalArgumentException("unknown preference rank code: " + code);
  }
}
