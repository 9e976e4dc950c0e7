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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * A student taking part in the allocation.
 *
 * <p>Preferences come in two flavours: tiers (rank 1 to 3, each a set of topic ids) and an ordered
 * list of up to {@link #MAX_RANKS} topic ids. A student that has not opted in ({@code plan ==
 * false}) never takes part in a solve.
 */
public final class Student {
  /** Maximum length of the ranked preference list. */
  public static final int MAX_RANKS = 5;

  private final String id;
  private final boolean plan;
  private final Map<Integer, Set<String>> tiers;
  private final List<String> ranks;
  private final Set<String> banned;
  private final String forcedTopic;

  private Student(Builder builder) {
    this.id = builder.id;
    this.plan = builder.plan;
    Map<Integer, Set<String>> tierCopy = new TreeMap<>();
    for (Map.Entry<Integer, Set<String>> entry : builder.tiers.entrySet()) {
      if (!entry.getValue().isEmpty()) {
        tierCopy.put(
            entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
      }
    }
    this.tiers = Collections.unmodifiableMap(tierCopy);
    this.ranks = Collections.unmodifiableList(new ArrayList<>(builder.ranks));
    this.banned = Collections.unmodifiableSet(new LinkedHashSet<>(builder.banned));
    this.forcedTopic = builder.forcedTopic;
  }

  public static Builder newBuilder(String id) {
    return new Builder(id);
  }

  public String getId() {
    return id;
  }

  /** Whether the student opted in to the allocation. */
  public boolean isPlanning() {
    return plan;
  }

  /** Returns the topics of the given tier (1 to 3), empty if the tier is not set. */
  public Set<String> getTier(int tier) {
    return tiers.getOrDefault(tier, Collections.emptySet());
  }

  public Map<Integer, Set<String>> getTiers() {
    return tiers;
  }

  /** Ranked preferences, strongest first. */
  public List<String> getRanks() {
    return ranks;
  }

  /** Returns the 1-based position of {@code topicId} in the ranked list, or 0 if absent. */
  public int rankOf(String topicId) {
    return ranks.indexOf(topicId) + 1;
  }

  public Set<String> getBanned() {
    return banned;
  }

  public boolean isBanned(String topicId) {
    return banned.contains(topicId);
  }

  public Optional<String> getForcedTopic() {
    return Optional.ofNullable(forcedTopic);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Student)) {
      return false;
    }
    Student other = (Student) o;
    return id.equals(other.id)
        && plan == other.plan
        && tiers.equals(other.tiers)
        && ranks.equals(other.ranks)
        && banned.equals(other.banned)
        && Objects.equals(forcedTopic, other.forcedTopic);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, plan, tiers, ranks, banned, forcedTopic);
  }

  @Override
  public String toString() {
    return "Student{" + id + (plan ? "" : ", not planning") + "}";
  }

  /** Builder for {@link Student}. */
  public static final class Builder {
    private final String id;
    private boolean plan = true;
    private final Map<Integer, Set<String>> tiers = new TreeMap<>();
    private final List<String> ranks = new ArrayList<>();
    private final Set<String> banned = new LinkedHashSet<>();
    private String forcedTopic;

    private Builder(String id) {
      this.id = Objects.requireNonNull(id, "id");
    }

    public Builder setPlanning(boolean plan) {
      this.plan = plan;
      return this;
    }

    /** Adds topics to tier 1, 2 or 3. */
    public Builder addTier(int tier, String... topicIds) {
      if (tier < 1 || tier > 3) {
        throw new IllegalArgumentException("tier must be in [1, 3], got " + tier);
      }
      Set<String> topics = tiers.computeIfAbsent(tier, k -> new LinkedHashSet<>());
      Collections.addAll(topics, topicIds);
      return this;
    }

    public Builder addTier(int tier, Iterable<String> topicIds) {
      for (String topicId : topicIds) {
        addTier(tier, topicId);
      }
      return this;
    }

    /** Appends to the ranked list; the first call gives rank 1. */
    public Builder addRanks(String... topicIds) {
      for (String topicId : topicIds) {
        if (ranks.size() == MAX_RANKS) {
          throw new IllegalArgumentException(
              "student " + id + " has more than " + MAX_RANKS + " ranked preferences");
        }
        ranks.add(topicId);
      }
      return this;
    }

    public Builder addBanned(String... topicIds) {
      Collections.addAll(banned, topicIds);
      return this;
    }

    public Builder setForcedTopic(String topicId) {
      this.forcedTopic = topicId;
      return this;
    }

    public Student build() {
      return new Student(this);
    }
  }
}
