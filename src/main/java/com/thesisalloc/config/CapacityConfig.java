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

package com.thesisalloc.config;

/**
 * Overflow toggles, department-minimum mode and the penalties of the exact solver. The flow
 * solver only reads the capacities themselves and ignores every field here.
 */
public final class CapacityConfig {
  private final boolean topicOverflow;
  private final boolean coachOverflow;
  private final DeptMinMode deptMinMode;
  private final int deptShortfallPenalty;
  private final int topicOverflowPenalty;
  private final int coachOverflowPenalty;

  private CapacityConfig(Builder builder) {
    this.topicOverflow = builder.topicOverflow;
    this.coachOverflow = builder.coachOverflow;
    this.deptMinMode = builder.deptMinMode;
    this.deptShortfallPenalty = builder.deptShortfallPenalty;
    this.topicOverflowPenalty = builder.topicOverflowPenalty;
    this.coachOverflowPenalty = builder.coachOverflowPenalty;
  }

  public static CapacityConfig defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setTopicOverflow(topicOverflow)
        .setCoachOverflow(coachOverflow)
        .setDeptMinMode(deptMinMode)
        .setDeptShortfallPenalty(deptShortfallPenalty)
        .setTopicOverflowPenalty(topicOverflowPenalty)
        .setCoachOverflowPenalty(coachOverflowPenalty);
  }

  public boolean isTopicOverflowEnabled() {
    return topicOverflow;
  }

  public boolean isCoachOverflowEnabled() {
    return coachOverflow;
  }

  public DeptMinMode getDeptMinMode() {
    return deptMinMode;
  }

  public int getDeptShortfallPenalty() {
    return deptShortfallPenalty;
  }

  public int getTopicOverflowPenalty() {
    return topicOverflowPenalty;
  }

  public int getCoachOverflowPenalty() {
    return coachOverflowPenalty;
  }

  @Override
  public String toString() {
    return "CapacityConfig{topicOverflow=" + topicOverflow
        + ", coachOverflow=" + coachOverflow
        + ", deptMinMode=" + deptMinMode.key()
        + ", P_dept_shortfall=" + deptShortfallPenalty
        + ", P_topic=" + topicOverflowPenalty
        + ", P_coach=" + coachOverflowPenalty + "}";
  }

  /** Builder for {@link CapacityConfig}. */
  public static final class Builder {
    private boolean topicOverflow = true;
    private boolean coachOverflow = true;
    private DeptMinMode deptMinMode = DeptMinMode.SOFT;
    private int deptShortfallPenalty = 1000;
    private int topicOverflowPenalty = 800;
    private int coachOverflowPenalty = 600;

    private Builder() {}

    public Builder setTopicOverflow(boolean enabled) {
      this.topicOverflow = enabled;
      return this;
    }

    public Builder setCoachOverflow(boolean enabled) {
      this.coachOverflow = enabled;
      return this;
    }

    public Builder setDeptMinMode(DeptMinMode mode) {
      this.deptMinMode = mode;
      return this;
    }

    public Builder setDeptShortfallPenalty(int penalty) {
      this.deptShortfallPenalty = penalty;
      return this;
    }

    public Builder setTopicOverflowPenalty(int penalty) {
      this.topicOverflowPenalty = penalty;
      return this;
    }

    public Builder setCoachOverflowPenalty(int penalty) {
      this.coachOverflowPenalty = penalty;
      return this;
    }

    /** Validates and builds; penalties must be strictly positive. */
    public CapacityConfig build() {
      if (deptMinMode == null) {
        throw new InvalidConfigException("dept_min_mode", "must be set");
      }
      checkPositive("P_dept_shortfall", deptShortfallPenalty);
      checkPositive("P_topic", topicOverflowPenalty);
      checkPositive("P_coach", coachOverflowPenalty);
      return new CapacityConfig(this);
    }

    private static void checkPositive(String key, int value) {
      if (value <= 0) {
        throw new InvalidConfigException(key, "penalty must be positive, got " + value);
      }
    }
  }
}
