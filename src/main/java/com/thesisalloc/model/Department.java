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

/** A department; a desired minimum of 0 means no constraint. */
public final class Department {
  private final String id;
  private final int desiredMinimum;

  public Department(String id, int desiredMinimum) {
    this.id = Objects.requireNonNull(id, "id");
    this.desiredMinimum = desiredMinimum;
  }

  public String getId() {
    return id;
  }

  public int getDesiredMinimum() {
    return desiredMinimum;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Department)) {
      return false;
    }
    Department other = (Department) o;
    return id.equals(other.id) && desiredMinimum == other.desiredMinimum;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, desiredMinimum);
  }

  @Override
  public String toString() {
    return "Department{" + id + ", min=" + desiredMinimum + "}";
  }
}
