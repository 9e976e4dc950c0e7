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

import com.thesisalloc.diagnostics.Diagnostics;
import com.thesisalloc.diagnostics.TieReport;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.AssignmentRow;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.PreferenceRank;
import com.thesisalloc.model.Topic;
import com.thesisalloc.solver.AllocationResult;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Writes the human-readable run summary. */
public final class SummaryWriter {
  /** Tied students listed in full; the rest are only counted. */
  static final int MAX_LISTED_TIES = 10;

  private SummaryWriter() {}

  public static void write(Path path, AllocationResult result, AllocationInput input)
      throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(writer, result, input);
    }
  }

  public static void write(Writer writer, AllocationResult result, AllocationInput input) {
    PrintWriter out = new PrintWriter(writer);
    Diagnostics diagnostics = result.getDiagnostics();
    List<AssignmentRow> rows = result.getRows();

    out.println("Algorithm: " + result.getAlgorithmLabel());
    out.println("Solver status: " + diagnostics.getStatusString());
    out.println(
        "Objective: "
            + (diagnostics.hasObjectiveValue()
                ? formatObjective(diagnostics.getObjectiveValue())
                : "n/a"));
    out.println("Assigned students: " + rows.size());
    out.println();

    printList(
        out,
        "Unassignable students (no admissible topics): ",
        diagnostics.getUnassignable());
    out.println();
    printList(out, "Unassigned after solve: ", diagnostics.getUnassignedAfterSolve());

    out.println();
    out.println("--- SOLUTION UNIQUENESS ---");
    List<TieReport> ties = diagnostics.getTies();
    if (ties.isEmpty()) {
      out.println("Solution appears unique (no ties in costs).");
    } else {
      out.println(
          "Solution may not be unique: " + ties.size()
              + " student(s) have equally good alternatives:");
      for (int i = 0; i < Math.min(MAX_LISTED_TIES, ties.size()); ++i) {
        TieReport tie = ties.get(i);
        out.println(
            "  " + tie.getStudentId() + ": assigned " + tie.getAssignedTopicId()
                + " (cost=" + tie.getCost() + "), could also take: "
                + tie.getAlternativeTopicIds());
      }
      if (ties.size() > MAX_LISTED_TIES) {
        out.println(
            "  ... and " + (ties.size() - MAX_LISTED_TIES)
                + " more students with tied costs.");
      }
    }

    Map<PreferenceRank, Integer> rankCounts = new EnumMap<>(PreferenceRank.class);
    Map<String, Integer> topicUse = new HashMap<>();
    Map<String, Integer> coachUse = new HashMap<>();
    Map<String, Integer> departmentUse = new HashMap<>();
    for (AssignmentRow row : rows) {
      rankCounts.merge(row.getPreferenceRank(), 1, Integer::sum);
      topicUse.merge(row.getTopicId(), 1, Integer::sum);
      coachUse.merge(row.getCoachId(), 1, Integer::sum);
      departmentUse.merge(row.getDepartmentId(), 1, Integer::sum);
    }

    out.println();
    out.println("Forced assignments: " + rankCounts.getOrDefault(PreferenceRank.FORCED, 0));
    out.println();
    out.println("Preference satisfaction:");
    out.println("  Tier1: " + rankCounts.getOrDefault(PreferenceRank.TIER_1, 0));
    out.println("  Tier2: " + rankCounts.getOrDefault(PreferenceRank.TIER_2, 0));
    out.println("  Tier3: " + rankCounts.getOrDefault(PreferenceRank.TIER_3, 0));
    out.println();
    out.println("Ranked choice satisfaction:");
    String[] ordinals = {"1st", "2nd", "3rd", "4th", "5th"};
    for (int rank = 1; rank <= ordinals.length; ++rank) {
      out.println(
          "  " + ordinals[rank - 1] + " choice: "
              + rankCounts.getOrDefault(PreferenceRank.forRank(rank), 0));
    }
    out.println("  Unranked : " + rankCounts.getOrDefault(PreferenceRank.UNRANKED, 0));

    out.println();
    out.println("Topic utilization:");
    for (Topic topic : input.getTopics().values()) {
      printUtilisation(
          out,
          topic.getId(),
          topicUse.getOrDefault(topic.getId(), 0),
          topic.getCapacity(),
          diagnostics.getTopicOverflow().getOrDefault(topic.getId(), 0));
    }
    out.println();
    out.println("Coach utilization:");
    for (Coach coach : input.getCoaches().values()) {
      printUtilisation(
          out,
          coach.getId(),
          coachUse.getOrDefault(coach.getId(), 0),
          coach.getCapacity(),
          diagnostics.getCoachOverflow().getOrDefault(coach.getId(), 0));
    }

    out.println();
    out.println("Department totals:");
    for (Department department : input.getDepartments().values()) {
      StringBuilder line =
          new StringBuilder("  ")
              .append(department.getId())
              .append(": ")
              .append(departmentUse.getOrDefault(department.getId(), 0));
      if (department.getDesiredMinimum() > 0) {
        line.append(" (desired_min=")
            .append(department.getDesiredMinimum())
            .append(", shortfall=")
            .append(diagnostics.getDepartmentShortfall().getOrDefault(department.getId(), 0))
            .append(')');
      }
      out.println(line);
    }
    out.flush();
  }

  private static void printList(PrintWriter out, String title, List<String> ids) {
    out.println(title + ids.size());
    for (String id : ids) {
      out.println("  - " + id);
    }
  }

  private static void printUtilisation(
      PrintWriter out, String id, int used, int capacity, int overflow) {
    out.println(
        "  " + id + ": " + used + " / " + capacity
            + (overflow > 0 ? "  (overflow=" + overflow + ")" : ""));
  }

  private static String formatObjective(double objective) {
    if (objective == Math.rint(objective) && Math.abs(objective) < 1e15) {
      return Long.toString((long) objective);
    }
    return Double.toString(objective);
  }
}
