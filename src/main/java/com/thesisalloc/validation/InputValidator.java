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

package com.thesisalloc.validation;

import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks loaded entities before they reach the solvers, which trust their input.
 *
 * <p>Broken entities and dangling topic to coach or coach to department references are errors.
 * Preferences, tiers and bans of planning students that name unknown topics are warnings: the cost
 * model simply never sees those topics.
 */
public final class InputValidator {
  private static final Logger logger = Logger.getLogger(InputValidator.class.getName());

  public ValidationReport validate(AllocationInput input) {
    List<ValidationIssue> errors = new ArrayList<>();
    List<ValidationIssue> warnings = new ArrayList<>();
    checkEntities(input, errors);
    checkReferences(input, errors, warnings);
    ValidationReport report = new ValidationReport(errors, warnings);
    for (ValidationIssue issue : report.getIssues()) {
      if (issue.isError()) {
        logger.severe(issue.toString());
      } else {
        logger.warning(issue.toString());
      }
    }
    logger.info("Validation: " + report.getSummary());
    return report;
  }

  private static void checkEntities(AllocationInput input, List<ValidationIssue> errors) {
    Map<String, Topic> topics = input.getTopics();
    for (Student student : input.getStudents().values()) {
      if (student.getId().trim().isEmpty()) {
        errors.add(ValidationIssue.error("Student has a blank id"));
      }
      if (student.getForcedTopic().isPresent()) {
        String forced = student.getForcedTopic().get();
        if (student.isBanned(forced)) {
          errors.add(
              ValidationIssue.error(
                  "Student has forced_topic in banned list",
                  "student_id", student.getId(),
                  "forced_topic", forced));
        }
        if (!topics.containsKey(forced)) {
          errors.add(
              ValidationIssue.error(
                  "Student's forced_topic does not exist",
                  "student_id", student.getId(),
                  "forced_topic", forced));
        }
      }
    }
    for (Topic topic : topics.values()) {
      if (topic.getId().trim().isEmpty() || topic.getCapacity() <= 0) {
        errors.add(
            ValidationIssue.error(
                "Topic has invalid data",
                "topic_id", topic.getId(),
                "cap", Integer.toString(topic.getCapacity())));
      }
    }
    for (Coach coach : input.getCoaches().values()) {
      if (coach.getId().trim().isEmpty() || coach.getCapacity() <= 0) {
        errors.add(
            ValidationIssue.error(
                "Coach has invalid data",
                "coach_id", coach.getId(),
                "cap", Integer.toString(coach.getCapacity())));
      }
    }
    for (Department department : input.getDepartments().values()) {
      if (department.getId().trim().isEmpty() || department.getDesiredMinimum() < 0) {
        errors.add(
            ValidationIssue.error(
                "Department has invalid data", "department_id", department.getId()));
      }
    }
  }

  private static void checkReferences(
      AllocationInput input, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
    Map<String, Topic> topics = input.getTopics();
    Map<String, Coach> coaches = input.getCoaches();
    Map<String, Department> departments = input.getDepartments();
    for (Topic topic : topics.values()) {
      Coach coach = coaches.get(topic.getCoachId());
      if (coach == null) {
        errors.add(
            ValidationIssue.error(
                "Topic references non-existent coach",
                "topic_id", topic.getId(),
                "coach_id", topic.getCoachId()));
      } else if (!departments.containsKey(coach.getDepartmentId())) {
        errors.add(
            ValidationIssue.error(
                "Coach references non-existent department",
                "coach_id", coach.getId(),
                "department_id", coach.getDepartmentId()));
      }
    }

    for (Student student : input.getStudents().values()) {
      if (!student.isPlanning()) {
        continue;
      }
      for (String topicId : student.getRanks()) {
        if (!topics.containsKey(topicId)) {
          warnings.add(
              ValidationIssue.warning(
                  "Student preference references non-existent topic",
                  "student_id", student.getId(),
                  "topic_id", topicId));
        }
      }
      for (Set<String> tier : student.getTiers().values()) {
        for (String topicId : tier) {
          if (!topics.containsKey(topicId)) {
            warnings.add(
                ValidationIssue.warning(
                    "Student tier preference references non-existent topic",
                    "student_id", student.getId(),
                    "topic_id", topicId));
          }
        }
      }
      for (String topicId : student.getBanned()) {
        if (!topics.containsKey(topicId)) {
          warnings.add(
              ValidationIssue.warning(
                  "Student banned topic does not exist",
                  "student_id", student.getId(),
                  "topic_id", topicId));
        }
      }
    }
  }
}
