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

package com.thesisalloc.io;

import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.OverrideCosts;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads the allocation input from CSV files.
 *
 * <ul>
 *   <li>capacities: one row per topic with {@code topic_id, coach_id, department_id,
 *       maximum_students_per_topic, maximum_students_per_coach, desired_minimum_by_department}.
 *       Coaches and departments are collected from the rows and must agree wherever they repeat.
 *   <li>students: {@code student_id, plan_thesis, pref1..pref5, tier1..tier3, banned,
 *       forced_topic}; tiers and bans are pipe-separated.
 *   <li>overrides (optional): {@code student_id, topic_id, cost}.
 * </ul>
 *
 * Headers are matched after normalisation, so {@code "Maximum students per topic"} works too.
 */
public final class DataRepository {
  private static final Logger logger = Logger.getLogger(DataRepository.class.getName());

  private final Path studentsPath;
  private final Path capacitiesPath;
  private final Path overridesPath;

  /** @param overridesPath may be null */
  public DataRepository(Path studentsPath, Path capacitiesPath, Path overridesPath) {
    this.studentsPath = studentsPath;
    this.capacitiesPath = capacitiesPath;
    this.overridesPath = overridesPath;
  }

  public AllocationInput load() throws IOException {
    AllocationInput.Builder builder = AllocationInput.newBuilder();
    loadCapacities(CsvTable.read(capacitiesPath), builder);
    loadStudents(CsvTable.read(studentsPath), builder);
    if (overridesPath != null) {
      builder.setOverrides(loadOverrides(CsvTable.read(overridesPath)));
    }
    AllocationInput input = builder.build();
    logger.info(
        "Loaded " + input.getStudents().size() + " students ("
            + input.getPlanningStudents().size() + " planning), " + input.getTopics().size()
            + " topics, " + input.getCoaches().size() + " coaches, "
            + input.getDepartments().size() + " departments, "
            + input.getOverrides().size() + " overrides");
    return input;
  }

  static void loadCapacities(CsvTable table, AllocationInput.Builder builder) {
    if (table.getRows().isEmpty()) {
      throw new DataFormatException(table.getName(), 0, "no capacity rows");
    }
    Map<String, Topic> topics = new LinkedHashMap<>();
    Map<String, Integer> coachCapacity = new LinkedHashMap<>();
    Map<String, String> coachDepartment = new LinkedHashMap<>();
    Map<String, Integer> departmentMinimum = new LinkedHashMap<>();

    for (CsvTable.Row row : table.getRows()) {
      String topicId = row.get("topic_id");
      String coachId = row.get("coach_id");
      String departmentId = row.get("department_id");
      int topicCap = toIntOrZero(row.get("maximum_students_per_topic"));
      int coachCap = toIntOrZero(row.get("maximum_students_per_coach"));
      int minimum = toIntOrZero(row.get("desired_minimum_by_department"));
      if (topicId.isEmpty() || coachId.isEmpty() || departmentId.isEmpty()) {
        throw new DataFormatException(
            table.getName(), row.getLine(), "topic_id, coach_id and department_id are required");
      }

      Topic topic = new Topic(topicId, coachId, departmentId, topicCap);
      Topic known = topics.putIfAbsent(topicId, topic);
      if (known != null && !known.equals(topic)) {
        throw new DataFormatException(
            table.getName(), row.getLine(), "inconsistent rows for topic " + topicId);
      }
      Integer knownCap = coachCapacity.putIfAbsent(coachId, coachCap);
      if (knownCap != null && knownCap != coachCap) {
        throw new DataFormatException(
            table.getName(),
            row.getLine(),
            "inconsistent maximum_students_per_coach for coach " + coachId);
      }
      String knownDepartment = coachDepartment.putIfAbsent(coachId, departmentId);
      if (knownDepartment != null && !knownDepartment.equals(departmentId)) {
        throw new DataFormatException(
            table.getName(),
            row.getLine(),
            "coach " + coachId + " appears in departments " + knownDepartment + " and "
                + departmentId);
      }
      Integer knownMinimum = departmentMinimum.putIfAbsent(departmentId, minimum);
      // A blank minimum on a later row does not conflict.
      if (knownMinimum != null && minimum != 0 && knownMinimum != minimum) {
        throw new DataFormatException(
            table.getName(),
            row.getLine(),
            "inconsistent desired_minimum_by_department for department " + departmentId);
      }
    }

    for (Topic topic : topics.values()) {
      builder.addTopic(topic);
    }
    for (Map.Entry<String, Integer> entry : coachCapacity.entrySet()) {
      builder.addCoach(
          new Coach(entry.getKey(), coachDepartment.get(entry.getKey()), entry.getValue()));
    }
    for (Map.Entry<String, Integer> entry : departmentMinimum.entrySet()) {
      builder.addDepartment(new Department(entry.getKey(), entry.getValue()));
    }
  }

  static void loadStudents(CsvTable table, AllocationInput.Builder builder) {
    for (CsvTable.Row row : table.getRows()) {
      String id = row.get("student_id");
      if (id.isEmpty()) {
        continue;
      }
      Student.Builder student =
          Student.newBuilder(id)
              .setPlanning(row.get("plan_thesis").toLowerCase(Locale.ROOT).equals("yes"));
      for (int rank = 1; rank <= Student.MAX_RANKS; ++rank) {
        String topicId = row.get("pref" + rank);
        if (!topicId.isEmpty()) {
          student.addRanks(topicId);
        }
      }
      for (int tier = 1; tier <= 3; ++tier) {
        student.addTier(tier, CsvTable.splitPipe(row.get("tier" + tier)));
      }
      for (String topicId : CsvTable.splitPipe(row.get("banned"))) {
        student.addBanned(topicId);
      }
      String forced = row.get("forced_topic");
      if (!forced.isEmpty()) {
        student.setForcedTopic(forced);
      }
      builder.addStudent(student.build());
    }
  }

  static OverrideCosts loadOverrides(CsvTable table) {
    OverrideCosts.Builder overrides = OverrideCosts.newBuilder();
    for (CsvTable.Row row : table.getRows()) {
      String studentId = row.get("student_id");
      String topicId = row.get("topic_id");
      int cost;
      try {
        cost = Integer.parseInt(row.get("cost"));
      } catch (NumberFormatException e) {
        logger.warning(
            table.getName() + ":" + row.getLine() + ": skipping override with cost '"
                + row.get("cost") + "'");
        continue;
      }
      if (!studentId.isEmpty() && !topicId.isEmpty()) {
        overrides.put(studentId, topicId, cost);
      }
    }
    return overrides.build();
  }

  private static int toIntOrZero(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
