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

package com.thesisalloc.capacity;

import com.thesisalloc.config.CapacityConfig;
import com.thesisalloc.config.DeptMinMode;
import com.thesisalloc.cost.CostMatrix;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.model.Coach;
import com.thesisalloc.model.Department;
import com.thesisalloc.model.Topic;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Capacities and department minimums in the index space of a {@link CostMatrix}, shared by both
 * solvers.
 *
 * <p>Topic {@code t} here is topic {@code t} of the cost matrix. Coaches and departments get their
 * own dense indices in input order. A topic aggregates into the coach that owns it and into its
 * department; a topic whose department is not among the departments has department index -1.
 */
public final class CapacityModel {
  private final CapacityConfig config;
  private final List<Coach> coaches;
  private final List<Department> departments;
  private final int[] topicCapacity;
  private final int[] topicCoach;
  private final int[] topicDepartment;
  private final int[] coachCapacity;
  private final int[] departmentMinimum;
  private final int[][] coachTopics;
  private final int[][] departmentTopics;

  public CapacityModel(AllocationInput input, CostMatrix costs, CapacityConfig config) {
    this.config = config;
    this.coaches = Collections.unmodifiableList(new ArrayList<>(input.getCoaches().values()));
    this.departments =
        Collections.unmodifiableList(new ArrayList<>(input.getDepartments().values()));

    Map<String, Integer> coachIndex = new HashMap<>();
    coachCapacity = new int[coaches.size()];
    for (int c = 0; c < coaches.size(); ++c) {
      coachIndex.put(coaches.get(c).getId(), c);
      coachCapacity[c] = coaches.get(c).getCapacity();
    }
    Map<String, Integer> departmentIndex = new HashMap<>();
    departmentMinimum = new int[departments.size()];
    for (int d = 0; d < departments.size(); ++d) {
      departmentIndex.put(departments.get(d).getId(), d);
      departmentMinimum[d] = departments.get(d).getDesiredMinimum();
    }

    int numTopics = costs.numTopics();
    topicCapacity = new int[numTopics];
    topicCoach = new int[numTopics];
    topicDepartment = new int[numTopics];
    List<List<Integer>> byCoach = newBuckets(coaches.size());
    List<List<Integer>> byDepartment = newBuckets(departments.size());
    for (int t = 0; t < numTopics; ++t) {
      Topic topic = costs.topic(t);
      topicCapacity[t] = topic.getCapacity();
      // Input is validated upstream: every topic's coach exists.
      topicCoach[t] = coachIndex.get(topic.getCoachId());
      topicDepartment[t] = departmentIndex.getOrDefault(topic.getDepartmentId(), -1);
      byCoach.get(topicCoach[t]).add(t);
      if (topicDepartment[t] >= 0) {
        byDepartment.get(topicDepartment[t]).add(t);
      }
    }
    coachTopics = toArrays(byCoach);
    departmentTopics = toArrays(byDepartment);
  }

  private static List<List<Integer>> newBuckets(int size) {
    List<List<Integer>> buckets = new ArrayList<>(size);
    for (int i = 0; i < size; ++i) {
      buckets.add(new ArrayList<>());
    }
    return buckets;
  }

  private static int[][] toArrays(List<List<Integer>> buckets) {
    int[][] arrays = new int[buckets.size()][];
    for (int i = 0; i < buckets.size(); ++i) {
      arrays[i] = buckets.get(i).stream().mapToInt(Integer::intValue).toArray();
    }
    return arrays;
  }

  public CapacityConfig getConfig() {
    return config;
  }

  public boolean isTopicOverflowEnabled() {
    return config.isTopicOverflowEnabled();
  }

  public boolean isCoachOverflowEnabled() {
    return config.isCoachOverflowEnabled();
  }

  public DeptMinMode getDeptMinMode() {
    return config.getDeptMinMode();
  }

  public int numTopics() {
    return topicCapacity.length;
  }

  public int numCoaches() {
    return coaches.size();
  }

  public int numDepartments() {
    return departments.size();
  }

  public Coach coach(int c) {
    return coaches.get(c);
  }

  public Department department(int d) {
    return departments.get(d);
  }

  public int topicCapacity(int t) {
    return topicCapacity[t];
  }

  public int topicCoach(int t) {
    return topicCoach[t];
  }

  /** Department index of topic {@code t}, or -1. */
  public int topicDepartment(int t) {
    return topicDepartment[t];
  }

  public int coachCapacity(int c) {
    return coachCapacity[c];
  }

  public int departmentMinimum(int d) {
    return departmentMinimum[d];
  }

  /** Topics owned by coach {@code c}. Do not modify. */
  public int[] coachTopics(int c) {
    return coachTopics[c];
  }

  /** Topics of department {@code d}. Do not modify. */
  public int[] departmentTopics(int d) {
    return departmentTopics[d];
  }

  /** Students per topic for an assignment given as a topic index per student (-1 if none). */
  public int[] topicLoads(int[] assignedTopic) {
    int[] loads = new int[numTopics()];
    for (int t : assignedTopic) {
      if (t >= 0) {
        loads[t]++;
      }
    }
    return loads;
  }

  /** Aggregates topic loads into coach loads. */
  public int[] coachLoads(int[] topicLoads) {
    int[] loads = new int[numCoaches()];
    for (int t = 0; t < topicLoads.length; ++t) {
      loads[topicCoach[t]] += topicLoads[t];
    }
    return loads;
  }

  /** Aggregates topic loads into department loads. */
  public int[] departmentLoads(int[] topicLoads) {
    int[] loads = new int[numDepartments()];
    for (int t = 0; t < topicLoads.length; ++t) {
      if (topicDepartment[t] >= 0) {
        loads[topicDepartment[t]] += topicLoads[t];
      }
    }
    return loads;
  }
}
