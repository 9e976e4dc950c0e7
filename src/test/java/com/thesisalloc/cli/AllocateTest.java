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

package com.thesisalloc.cli;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.config.AllocationConfigLoader;
import com.thesisalloc.config.Algorithm;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class AllocateTest {
  private static final String CAPACITIES =
      "topic_id,coach_id,department_id,maximum_students_per_topic,maximum_students_per_coach,"
          + "desired_minimum_by_department\n"
          + "A,C1,D1,1,5,0\n"
          + "B,C1,D1,1,5,0\n";

  private static final String STUDENTS =
      "student_id,plan_thesis,pref1,pref2\n" + "S1,yes,A,B\n" + "S2,yes,A,B\n" + "S3,no,A,\n";

  @TempDir Path tempDir;

  private Path students;
  private Path capacities;

  @BeforeEach
  public void setUp() throws IOException {
    students = write("students.csv", STUDENTS);
    capacities = write("capacities.csv", CAPACITIES);
  }

  private Path write(String name, String text) throws IOException {
    Path path = tempDir.resolve(name);
    Files.write(path, text.getBytes(StandardCharsets.UTF_8));
    return path;
  }

  @Test
  public void parse_allOptions() {
    Allocate.Options options =
        Allocate.parse(
            new String[] {
              "--students", "s.csv", "--capacities", "c.csv", "--overrides", "o.csv",
              "--out", "a.csv", "--summary", "sum.txt", "--config", "x.properties",
              "--set", "algorithm=flow", "--set", " P_topic =5", "--log-level", "debug",
              "--validate-only", "--no-validate", "--save-config", "y.properties"
            });

    assertThat(options.students).isEqualTo(Paths.get("s.csv"));
    assertThat(options.capacities).isEqualTo(Paths.get("c.csv"));
    assertThat(options.overrides).isEqualTo(Paths.get("o.csv"));
    assertThat(options.out).isEqualTo(Paths.get("a.csv"));
    assertThat(options.summary).isEqualTo(Paths.get("sum.txt"));
    assertThat(options.config).isEqualTo(Paths.get("x.properties"));
    assertThat(options.saveConfig).isEqualTo(Paths.get("y.properties"));
    assertThat(options.logLevel).isEqualTo("debug");
    assertThat(options.validateOnly).isTrue();
    assertThat(options.noValidate).isTrue();
    assertThat(options.settings.getProperty("algorithm")).isEqualTo("flow");
    assertThat(options.settings.getProperty("P_topic")).isEqualTo("5");
  }

  @Test
  public void parse_rejectsBadArguments() {
    assertThrows(
        IllegalArgumentException.class, () -> Allocate.parse(new String[] {"--bogus", "x"}));
    assertThrows(IllegalArgumentException.class, () -> Allocate.parse(new String[] {"--out"}));
    assertThrows(
        IllegalArgumentException.class, () -> Allocate.parse(new String[] {"--set", "=1"}));
  }

  @Test
  public void parseLevel_acceptsCommonNames() {
    assertThat(Allocate.parseLevel("debug")).isEqualTo(Level.FINE);
    assertThat(Allocate.parseLevel("WARN")).isEqualTo(Level.WARNING);
    assertThat(Allocate.parseLevel("error")).isEqualTo(Level.SEVERE);
    assertThat(Allocate.parseLevel("info")).isEqualTo(Level.INFO);
    assertThrows(IllegalArgumentException.class, () -> Allocate.parseLevel("loud"));
  }

  @Test
  public void run_flowAllocationWritesBothOutputs() throws IOException {
    Path out = tempDir.resolve("allocation.csv");
    Path summary = tempDir.resolve("summary.txt");

    int code =
        Allocate.run(
            new String[] {
              "--students", students.toString(), "--capacities", capacities.toString(),
              "--out", out.toString(), "--summary", summary.toString(),
              "--set", "algorithm=flow", "--log-level", "WARNING"
            });

    assertThat(code).isEqualTo(0);
    List<String> rows = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertThat(rows).hasSize(3);
    assertThat(rows.get(0)).startsWith("student,assigned_topic");
    List<String> lines = Files.readAllLines(summary, StandardCharsets.UTF_8);
    assertThat(lines).contains("Algorithm: flow");
    assertThat(lines).contains("Assigned students: 2");
  }

  @Test
  public void run_validateOnlyNeedsNoOutputs() {
    int code =
        Allocate.run(
            new String[] {
              "--students", students.toString(), "--capacities", capacities.toString(),
              "--validate-only"
            });

    assertThat(code).isEqualTo(0);
  }

  @Test
  public void run_invalidInputFails() throws IOException {
    Path badCapacities =
        write(
            "bad.csv",
            "topic_id,coach_id,department_id,maximum_students_per_topic,"
                + "maximum_students_per_coach\nA,C1,D1,0,5\n");

    int code =
        Allocate.run(
            new String[] {
              "--students", students.toString(), "--capacities", badCapacities.toString(),
              "--validate-only"
            });

    assertThat(code).isEqualTo(1);
  }

  @Test
  public void run_missingArgumentsFail() {
    assertThat(Allocate.run(new String[] {"--students", students.toString()})).isEqualTo(1);
    assertThat(Allocate.run(new String[] {"--unknown"})).isEqualTo(1);
    assertThat(
            Allocate.run(
                new String[] {
                  "--students", students.toString(), "--capacities", capacities.toString(),
                  "--set", "algorithm=greedy", "--validate-only"
                }))
        .isEqualTo(1);
  }

  @Test
  public void run_saveConfigWritesMergedSettings() throws IOException {
    Path saved = tempDir.resolve("saved.properties");

    int code =
        Allocate.run(
            new String[] {
              "--set", "algorithm=hybrid", "--set", "time_limit_sec=5", "--save-config",
              saved.toString()
            });

    assertThat(code).isEqualTo(0);
    AllocationConfig config = AllocationConfigLoader.load(saved);
    assertThat(config.getSolver().getAlgorithm()).isEqualTo(Algorithm.HYBRID);
  }
}
