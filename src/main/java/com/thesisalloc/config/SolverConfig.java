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

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/** Solver selection and search limits. */
public final class SolverConfig {
  private final Algorithm algorithm;
  private final Integer timeLimitSeconds;
  private final Integer randomSeed;
  private final Double epsilonSuboptimal;
  private final IlpBackend ilpBackend;

  private SolverConfig(Builder builder) {
    this.algorithm = builder.algorithm;
    this.timeLimitSeconds = builder.timeLimitSeconds;
    this.randomSeed = builder.randomSeed;
    this.epsilonSuboptimal = builder.epsilonSuboptimal;
    this.ilpBackend = builder.ilpBackend;
  }

  public static SolverConfig defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setAlgorithm(algorithm)
        .setTimeLimitSeconds(timeLimitSeconds)
        .setRandomSeed(randomSeed)
        .setEpsilonSuboptimal(epsilonSuboptimal)
        .setIlpBackend(ilpBackend);
  }

  public Algorithm getAlgorithm() {
    return algorithm;
  }

  public OptionalInt getTimeLimitSeconds() {
    return timeLimitSeconds == null ? OptionalInt.empty() : OptionalInt.of(timeLimitSeconds);
  }

  public Optional<Duration> getTimeLimit() {
    return timeLimitSeconds == null
        ? Optional.empty()
        : Optional.of(Duration.ofSeconds(timeLimitSeconds));
  }

  public OptionalInt getRandomSeed() {
    return randomSeed == null ? OptionalInt.empty() : OptionalInt.of(randomSeed);
  }

  public OptionalDouble getEpsilonSuboptimal() {
    return epsilonSuboptimal == null
        ? OptionalDouble.empty()
        : OptionalDouble.of(epsilonSuboptimal);
  }

  public IlpBackend getIlpBackend() {
    return ilpBackend;
  }

  @Override
  public String toString() {
    return "SolverConfig{algorithm=" + algorithm.key()
        + ", timeLimitSec=" + timeLimitSeconds
        + ", randomSeed=" + randomSeed
        + ", epsilonSuboptimal=" + epsilonSuboptimal
        + ", ilpBackend=" + ilpBackend.key() + "}";
  }

  /** Builder for {@link SolverConfig}; {@code null} clears an optional value. */
  public static final class Builder {
    private Algorithm algorithm = Algorithm.ILP;
    private Integer timeLimitSeconds;
    private Integer randomSeed;
    private Double epsilonSuboptimal;
    private IlpBackend ilpBackend = IlpBackend.SCIP;

    private Builder() {}

    public Builder setAlgorithm(Algorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    public Builder setTimeLimitSeconds(Integer seconds) {
      this.timeLimitSeconds = seconds;
      return this;
    }

    public Builder setRandomSeed(Integer seed) {
      this.randomSeed = seed;
      return this;
    }

    public Builder setEpsilonSuboptimal(Double epsilon) {
      this.epsilonSuboptimal = epsilon;
      return this;
    }

    public Builder setIlpBackend(IlpBackend backend) {
      this.ilpBackend = backend;
      return this;
    }

    public SolverConfig build() {
      if (algorithm == null) {
        throw new InvalidConfigException("algorithm", "must be set");
      }
      if (ilpBackend == null) {
        throw new InvalidConfigException("ilp_backend", "must be set");
      }
      if (timeLimitSeconds != null && timeLimitSeconds <= 0) {
        throw new InvalidConfigException(
            "time_limit_sec", "must be positive, got " + timeLimitSeconds);
      }
      if (epsilonSuboptimal != null
          && (epsilonSuboptimal.isNaN() || epsilonSuboptimal < 0 || epsilonSuboptimal >= 1)) {
        throw new InvalidConfigException(
            "epsilon_suboptimal", "must be in [0, 1), got " + epsilonSuboptimal);
      }
      return new SolverConfig(this);
    }
  }
}
