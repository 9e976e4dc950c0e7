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

import com.thesisalloc.model.Student;
import com.thesisalloc.model.Topic;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Sparse student x topic cost matrix over planning students.
 *
 * <p>Row {@code s} lists the admissible topic indices of student {@code s} in increasing order,
 * with their costs in a parallel array. A student with an empty row is unassignable. Columns are
 * precomputed so that capacity constraints can iterate the students of a topic directly.
 */
public final class CostMatrix {
  private final List<Student> students;
  private final List<Topic> topics;
  private final Map<String, Integer> studentIndex;
  private final Map<String, Integer> topicIndex;
  private final int[][] rowTopics;
  private final int[][] rowCosts;
  private final int[][] columnStudents;
  private final int numEntries;

  CostMatrix(List<Student> students, List<Topic> topics, int[][] rowTopics, int[][] rowCosts) {
    this.students = Collections.unmodifiableList(new ArrayList<>(students));
    this.topics = Collections.unmodifiableList(new ArrayList<>(topics));
    this.rowTopics = rowTopics;
    this.rowCosts = rowCosts;
    this.studentIndex = indexById(students.size(), i -> students.get(i).getId());
    this.topicIndex = indexById(topics.size(), i -> topics.get(i).getId());

    int[] columnSizes = new int[topics.size()];
    int entries = 0;
    for (int[] row : rowTopics) {
      for (int t : row) {
        columnSizes[t]++;
      }
      entries += row.length;
    }
    this.numEntries = entries;
    this.columnStudents = new int[topics.size()][];
    for (int t = 0; t < topics.size(); ++t) {
      columnStudents[t] = new int[columnSizes[t]];
    }
    int[] fill = new int[topics.size()];
    for (int s = 0; s < rowTopics.length; ++s) {
      for (int t : rowTopics[s]) {
        columnStudents[t][fill[t]++] = s;
      }
    }
  }

  private static Map<String, Integer> indexById(int size, IntFunction<String> id) {
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < size; ++i) {
      index.put(id.apply(i), i);
    }
    return index;
  }

  public int numStudents() {
    return students.size();
  }

  public int numTopics() {
    return topics.size();
  }

  /** Number of admissible (student, topic) pairs. */
  public int numEntries() {
    return numEntries;
  }

  public Student student(int s) {
    return students.get(s);
  }

  public Topic topic(int t) {
    return topics.get(t);
  }

  public List<Student> students() {
    return students;
  }

  public List<Topic> topics() {
    return topics;
  }

  /** Returns the index of a planning student, or -1. */
  public int studentIndex(String studentId) {
    return studentIndex.getOrDefault(studentId, -1);
  }

  /** Returns the index of a topic, or -1. */
  public int topicIndex(String topicId) {
    return topicIndex.getOrDefault(topicId, -1);
  }

  /** Admissible topic indices of student {@code s}, ascending. Do not modify. */
  public int[] rowTopics(int s) {
    return rowTopics[s];
  }

  /** Costs parallel to {@link #rowTopics(int)}. Do not modify. */
  public int[] rowCosts(int s) {
    return rowCosts[s];
  }

  /** Students for which topic {@code t} is admissible, ascending. Do not modify. */
  public int[] columnStudents(int t) {
    return columnStudents[t];
  }

  public boolean isAdmissible(int s, int t) {
    return Arrays.binarySearch(rowTopics[s], t) >= 0;
  }

  /** Cost of an admissible pair; throws if the pair has no edge. */
  public int cost(int s, int t) {
    int position = Arrays.binarySearch(rowTopics[s], t);
    if (position < 0) {
      throw new IllegalArgumentException(
          "no edge between " + students.get(s).getId() + " and " + topics.get(t).getId());
    }
    return rowCosts[s][position];
  }

  public boolean isUnassignable(int s) {
    return rowTopics[s].length == 0;
  }

  /** Ids of planning students without any admissible topic, in input order. */
  public List<String> unassignableStudentIds() {
    List<String> ids = new ArrayList<>();
    for (int s = 0; s < students.size(); ++s) {
      if (isUnassignable(s)) {
        ids.add(students.get(s).getId());
      }
    }
    return ids;
  }

  public int numAssignableStudents() {
    int count = 0;
    for (int[] row : rowTopics) {
      if (row.length > 0) {
        count++;
      }
    }
    return count;
  }
}
