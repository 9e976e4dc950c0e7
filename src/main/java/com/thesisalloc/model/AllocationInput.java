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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The validated entities of one allocation run, keyed by id in insertion order. Iteration order
 * of every map is the order entities were added, which fixes the index order used by the solvers.
 */
public final class AllocationInput {
  private final Map<String, Student> students;
  private final Map<String, Topic> topics;
  private final Map<String, Coach> coaches;
  private final Map<String, Department> departments;
  private final OverrideCosts overrides;

  private AllocationInput(Builder builder) {
    this.students = Collections.unmodifiableMap(new LinkedHashMap<>(builder.students));
    this.topics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.topics));
    this.coaches = Collections.unmodifiableMap(new LinkedHashMap<>(builder.coaches));
    this.departments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.departments));
    this.overrides = builder.overrides;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Map<String, Student> getStudents() {
    return students;
  }

  /** Students that opted in, in input order. */
  public List<Student> getPlanningStudents() {
    List<Student> planning = new ArrayList<>();
    for (Student student : students.values()) {
      if (student.isPlanning()) {
        planning.add(student);
      }
    }
    return planning;
  }

  public Map<String, Topic> getTopics() {
    return topics;
  }

  public Map<String, Coach> getCoaches() {
    return coaches;
  }

  public Map<String, Department> getDepartments() {
    return departments;
  }

  public OverrideCosts getOverrides() {
    return overrides;
  }

  /** Builder for {@link AllocationInput}. */
  public static final class Builder {
    private final Map<String, Student> students = new LinkedHashMap<>();
    private final Map<String, Topic> topics = new LinkedHashMap<>();
    private final Map<String, Coach> coaches = new LinkedHashMap<>();
    private final Map<String, Department> departments = new LinkedHashMap<>();
    private OverrideCosts overrides = OverrideCosts.empty();

    private Builder() {}

    public Builder addStudent(Student student) {
      students.put(student.getId(), student);
      return this;
    }

    public Builder addTopic(Topic topic) {
      topics.put(topic.getId(), topic);
      return this;
    }

    public Builder addCoach(Coach coach) {
      coaches.put(coach.getId(), coach);
      return this;
    }

    public Builder addDepartment(Department department) {
      departments.put(department.getId(), department);
      return this;
    }

    public Builder setOverrides(OverrideCosts overrides) {
      this.overrides = overrides;
      return this;
    }

    public AllocationInput build() {
      return new AllocationInput(this);
    }
  }
}
