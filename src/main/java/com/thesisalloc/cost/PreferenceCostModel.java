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

import com.thesisalloc.config.PreferenceConfig;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.OverrideCosts;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Computes the cost of every admissible (student, topic) pair.
 *
 * <p>Rules are applied in order and the first match wins:
 *
 * <ol>
 *   <li>forced topic: {@link #FORCED_COST} for that topic, every other topic inadmissible;
 *   <li>banned topic: inadmissible;
 *   <li>override cost, used verbatim;
 *   <li>tier 1, 2, 3: 0, {@code tier2_cost}, {@code tier3_cost};
 *   <li>ranked list: by 1-based position, see {@link #rankCost(int)};
 *   <li>anything else: {@code unranked_cost} if unranked topics are allowed, otherwise
 *       inadmissible.
 * </ol>
 */
public final class PreferenceCostModel {
  private static final Logger logger = Logger.getLogger(PreferenceCostModel.class.getName());

  /** Cost of a forced pair, low enough to dominate any penalty combination. */
  public static final int FORCED_COST = -10000;

  private final PreferenceConfig config;
  private final OverrideCosts overrides;

  public PreferenceCostModel(PreferenceConfig config, OverrideCosts overrides) {
    this.config = config;
    this.overrides = overrides;
  }

  /**
   * Builds the cost matrix over the planning students and all topics of {@code input}. Rows are
   * independent, so they are computed in parallel; the result does not depend on the schedule.
   */
  public CostMatrix computeCosts(AllocationInput input) {
    final List<Student> students = input.getPlanningStudents();
    final List<Topic> topics = new ArrayList<>(input.getTopics().values());
    final int[][] rowTopics = new int[students.size()][];
    final int[][] rowCosts = new int[students.size()][];

    IntStream.range(0, students.size())
        .parallel()
        .forEach(
            s -> {
              Student student = students.get(s);
              int[] topicBuffer = new int[topics.size()];
              int[] costBuffer = new int[topics.size()];
              int size = 0;
              for (int t = 0; t < topics.size(); ++t) {
                OptionalInt cost = cost(student, topics.get(t));
                if (cost.isPresent()) {
                  topicBuffer[size] = t;
                  costBuffer[size] = cost.getAsInt();
                  size++;
                }
              }
              rowTopics[s] = Arrays.copyOf(topicBuffer, size);
              rowCosts[s] = Arrays.copyOf(costBuffer, size);
            });

    CostMatrix matrix = new CostMatrix(students, topics, rowTopics, rowCosts);
    logger.fine(
        "Cost matrix: " + matrix.numStudents() + " planning students, " + matrix.numTopics()
            + " topics, " + matrix.numEntries() + " admissible pairs");
    List<String> unassignable = matrix.unassignableStudentIds();
    if (!unassignable.isEmpty()) {
      logger.warning(unassignable.size() + " student(s) have no admissible topic: " + unassignable);
    }
    return matrix;
  }

  /**
   * Returns the cost of one pair, or empty if the pair is inadmissible. Students that are not
   * planning have no admissible pair.
   */
  public OptionalInt cost(Student student, Topic topic) {
    if (!student.isPlanning()) {
      return OptionalInt.empty();
    }
    String topicId = topic.getId();
    if (student.getForcedTopic().isPresent()) {
      if (student.getForcedTopic().get().equals(topicId) && !student.isBanned(topicId)) {
        return OptionalInt.of(FORCED_COST);
      }
      return OptionalInt.empty();
    }
    if (student.isBanned(topicId)) {
      return OptionalInt.empty();
    }
    OptionalInt override = overrides.get(student.getId(), topicId);
    if (override.isPresent()) {
      return override;
    }
    if (student.getTier(1).contains(topicId)) {
      return OptionalInt.of(0);
    }
    if (student.getTier(2).contains(topicId)) {
      return OptionalInt.of(config.getTier2Cost());
    }
    if (student.getTier(3).contains(topicId)) {
      return OptionalInt.of(config.getTier3Cost());
    }
    int rank = student.rankOf(topicId);
    if (rank > 0) {
      return OptionalInt.of(rankCost(rank));
    }
    if (config.allowUnranked()) {
      return OptionalInt.of(config.getUnrankedCost());
    }
    return OptionalInt.empty();
  }

  /**
   * Cost of a 1-based rank. With the top-2 bias: 0, 1, then 100 + (rank - 3). Without it: rank - 1.
   */
  public int rankCost(int rank) {
    if (config.top2Bias()) {
      if (rank == 1) {
        return 0;
      }
      if (rank == 2) {
        return 1;
      }
      return 100 + (rank - 3);
    }
    return rank - 1;
  }
}
