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

import java.util.Objects;

/** A coach; its capacity bounds the students assigned over all of its topics. */
public final class Coach {
  private final String id;
  private final String departmentId;
  private final int capacity;

  public Coach(String id, String departmentId, int capacity) {
    this.id = Objects.requireNonNull(id, "id");
    this.departmentId = Objects.requireNonNull(departmentId, "departmentId");
    this.capacity = capacity;
  }

  public String getId() {
    return id;
  }

  public String getDepartmentId() {
    return departmentId;
  }

  public int getCapacity() {
    return capacity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Coach)) {
      return false;
    }
    Coach other = (Coach) o;
    return id.equals(other.id)
        && departmentId.equals(other.departmentId)
        && capacity == other.capacity;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, departmentId, capacity);
  }

  @Override
  public String toString() {
    return "Coach{" + id + ", dept=" + departmentId + ", cap=" + capacity + "}";
  }
}
