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

import com.thesisalloc.model.AssignmentRow;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes assignment rows as CSV, one line per assigned student. */
public final class AllocationCsvWriter {
  static final String[] HEADER = {
    "student",
    "assigned_topic",
    "assigned_coach",
    "department_id",
    "preference_rank",
    "effective_cost",
    "via_topic_overflow",
    "via_coach_overflow"
  };

  private AllocationCsvWriter() {}

  public static void write(Path path, List<AssignmentRow> rows) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(writer, rows);
    }
  }

  /** The preference rank column holds the numeric code. */
  public static void write(Writer writer, List<AssignmentRow> rows) throws IOException {
    CsvTable.writeRecord(writer, (Object[]) HEADER);
    for (AssignmentRow row : rows) {
      CsvTable.writeRecord(
          writer,
          row.getStudentId(),
          row.getTopicId(),
          row.getCoachId(),
          row.getDepartmentId(),
          row.getPreferenceRank().getCode(),
          row.getEffectiveCost(),
          row.isViaTopicOverflow(),
          row.isViaCoachOverflow());
    }
    writer.flush();
  }
}
