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

import static com.google.common.truth.Truth.assertThat;

import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public final class InputValidatorTest {
  private static AllocationInput.Builder validInput() {
    return AllocationInput.newBuilder()
        .addStudent(Student.newBuilder("S1").addRanks("A", "B").build())
        .addTopic(new Topic("A", "C1", "D1", 2))
        .addTopic(new Topic("B", "C1", "D1", 1))
        .addCoach(new Coach("C1", "D1", 3))
        .addDepartment(new Department("D1", 0));
  }

  private static List<String> messages(List<ValidationIssue> issues) {
    return issues.stream().map(ValidationIssue::getMessage).collect(Collectors.toList());
  }

  @Test
  public void validate_cleanInput() {
    ValidationReport report = new InputValidator().validate(validInput().build());

    assertThat(report.isValid()).isTrue();
    assertThat(report.getIssues()).isEmpty();
    assertThat(report.getSummary()).isEqualTo("All validations passed");
  }

  @Test
  public void validate_forcedTopicBannedAndUnknown() {
    AllocationInput input =
        validInput()
            .addStudent(Student.newBuilder("S2").setForcedTopic("A").addBanned("A").build())
            .addStudent(Student.newBuilder("S3").setForcedTopic("Z").build())
            .build();

    ValidationReport report = new InputValidator().validate(input);

    assertThat(report.isValid()).isFalse();
    assertThat(messages(report.getErrors()))
        .containsExactly(
            "Student has forced_topic in banned list", "Student's forced_topic does not exist")
        .inOrder();
    assertThat(report.getErrors().get(0).getContext())
        .containsExactly("student_id", "S2", "forced_topic", "A")
        .inOrder();
  }

  @Test
  public void validate_invalidEntities() {
    AllocationInput input =
        validInput()
            .addTopic(new Topic("T0", "C1", "D1", 0))
            .addCoach(new Coach("C0", "D1", -1))
            .addDepartment(new Department("D0", -2))
            .build();

    ValidationReport report = new InputValidator().validate(input);

    assertThat(messages(report.getErrors()))
        .containsExactly(
            "Topic has invalid data", "Coach has invalid data", "Department has invalid data")
        .inOrder();
    assertThat(report.getErrors().get(0).toString())
        .isEqualTo("[ERROR] Topic has invalid data (topic_id=T0, cap=0)");
  }

  @Test
  public void validate_danglingReferences() {
    AllocationInput input =
        validInput()
            .addTopic(new Topic("X", "C9", "D1", 1))
            .addTopic(new Topic("Y", "C2", "D2", 1))
            .addCoach(new Coach("C2", "D2", 1))
            .build();

    ValidationReport report = new InputValidator().validate(input);

    assertThat(messages(report.getErrors()))
        .containsExactly(
            "Topic references non-existent coach", "Coach references non-existent department")
        .inOrder();
    assertThat(report.getSummary()).isEqualTo("2 error(s) found");
  }

  @Test
  public void validate_unknownPreferencesAreWarnings() {
    AllocationInput input =
        validInput()
            .addStudent(
                Student.newBuilder("S2")
                    .addRanks("A", "Q")
                    .addTier(2, "R")
                    .addBanned("Z")
                    .build())
            // Students outside planning are not checked.
            .addStudent(Student.newBuilder("S3").setPlanning(false).addRanks("Q").build())
            .build();

    ValidationReport report = new InputValidator().validate(input);

    assertThat(report.isValid()).isTrue();
    assertThat(messages(report.getWarnings()))
        .containsExactly(
            "Student preference references non-existent topic",
            "Student tier preference references non-existent topic",
            "Student banned topic does not exist")
        .inOrder();
    assertThat(report.getSummary()).isEqualTo("3 warning(s) found");
  }
}
