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

/** Parameters of the preference cost model. */
public final class PreferenceConfig {
  private final boolean allowUnranked;
  private final int tier2Cost;
  private final int tier3Cost;
  private final int unrankedCost;
  private final boolean top2Bias;

  private PreferenceConfig(Builder builder) {
    this.allowUnranked = builder.allowUnranked;
    this.tier2Cost = builder.tier2Cost;
    this.tier3Cost = builder.tier3Cost;
    this.unrankedCost = builder.unrankedCost;
    this.top2Bias = builder.top2Bias;
  }

  public static PreferenceConfig defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setAllowUnranked(allowUnranked)
        .setTier2Cost(tier2Cost)
        .setTier3Cost(tier3Cost)
        .setUnrankedCost(unrankedCost)
        .setTop2Bias(top2Bias);
  }

  /** Whether topics outside every tier and rank are admissible at {@link #getUnrankedCost()}. */
  public boolean allowUnranked() {
    return allowUnranked;
  }

  public int getTier2Cost() {
    return tier2Cost;
  }

  public int getTier3Cost() {
    return tier3Cost;
  }

  public int getUnrankedCost() {
    return unrankedCost;
  }

  /** Whether the first two ranks are cheap and the rest start at 100. */
  public boolean top2Bias() {
    return top2Bias;
  }

  @Override
  public String toString() {
    return "PreferenceConfig{allowUnranked=" + allowUnranked
        + ", tier2Cost=" + tier2Cost
        + ", tier3Cost=" + tier3Cost
        + ", unrankedCost=" + unrankedCost
        + ", top2Bias=" + top2Bias + "}";
  }

  /** Builder for {@link PreferenceConfig}. */
  public static final class Builder {
    private boolean allowUnranked = true;
    private int tier2Cost = 1;
    private int tier3Cost = 5;
    private int unrankedCost = 200;
    private boolean top2Bias = true;

    private Builder() {}

    public Builder setAllowUnranked(boolean allowUnranked) {
      this.allowUnranked = allowUnranked;
      return this;
    }

    public Builder setTier2Cost(int tier2Cost) {
      this.tier2Cost = tier2Cost;
      return this;
    }

    public Builder setTier3Cost(int tier3Cost) {
      this.tier3Cost = tier3Cost;
      return this;
    }

    public Builder setUnrankedCost(int unrankedCost) {
      this.unrankedCost = unrankedCost;
      return this;
    }

    public Builder setTop2Bias(boolean top2Bias) {
      this.top2Bias = top2Bias;
      return this;
    }

    public PreferenceConfig build() {
      return new PreferenceConfig(this);
    }
  }
}
