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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads and writes {@link AllocationConfig} as flat properties. Keys follow the option names of
 * the allocator ({@code tier2_cost}, {@code dept_min_mode}, {@code P_topic}, ...). Missing keys
 * keep their defaults; an empty value clears an optional solver setting.
 */
public final class AllocationConfigLoader {
  private static final Logger logger = Logger.getLogger(AllocationConfigLoader.class.getName());

  public static final String ALLOW_UNRANKED = "allow_unranked";
  public static final String TIER2_COST = "tier2_cost";
  public static final String TIER3_COST = "tier3_cost";
  public static final String UNRANKED_COST = "unranked_cost";
  public static final String TOP2_BIAS = "top2_bias";
  public static final String ENABLE_TOPIC_OVERFLOW = "enable_topic_overflow";
  public static final String ENABLE_COACH_OVERFLOW = "enable_coach_overflow";
  public static final String DEPT_MIN_MODE = "dept_min_mode";
  public static final String P_DEPT_SHORTFALL = "P_dept_shortfall";
  public static final String P_TOPIC = "P_topic";
  public static final String P_COACH = "P_coach";
  public static final String ALGORITHM = "algorithm";
  public static final String TIME_LIMIT_SEC = "time_limit_sec";
  public static final String RANDOM_SEED = "random_seed";
  public static final String EPSILON_SUBOPTIMAL = "epsilon_suboptimal";
  public static final String ILP_BACKEND = "ilp_backend";

  private static final Set<String> KNOWN_KEYS =
      new HashSet<>(
          Arrays.asList(
              ALLOW_UNRANKED,
              TIER2_COST,
              TIER3_COST,
              UNRANKED_COST,
              TOP2_BIAS,
              ENABLE_TOPIC_OVERFLOW,
              ENABLE_COACH_OVERFLOW,
              DEPT_MIN_MODE,
              P_DEPT_SHORTFALL,
              P_TOPIC,
              P_COACH,
              ALGORITHM,
              TIME_LIMIT_SEC,
              RANDOM_SEED,
              EPSILON_SUBOPTIMAL,
              ILP_BACKEND));

  private AllocationConfigLoader() {}

  public static AllocationConfig load(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Properties properties = new Properties();
      properties.load(reader);
      return fromProperties(properties);
    }
  }

  public static AllocationConfig load(InputStream in) throws IOException {
    Properties properties = new Properties();
    properties.load(in);
    return fromProperties(properties);
  }

  /** Builds a validated configuration on top of the defaults. */
  public static AllocationConfig fromProperties(Properties properties) {
    return apply(AllocationConfig.defaults(), properties);
  }

  /** Overlays {@code properties} on {@code base} and validates the result. */
  public static AllocationConfig apply(AllocationConfig base, Properties properties) {
    for (String key : properties.stringPropertyNames()) {
      if (!KNOWN_KEYS.contains(key)) {
        logger.warning("Ignoring unknown configuration key: " + key);
      }
    }

    PreferenceConfig.Builder preference = base.getPreference().toBuilder();
    String value;
    if ((value = get(properties, ALLOW_UNRANKED)) != null) {
      preference.setAllowUnranked(parseBoolean(ALLOW_UNRANKED, value));
    }
    if ((value = get(properties, TIER2_COST)) != null) {
      preference.setTier2Cost(parseInt(TIER2_COST, value));
    }
    if ((value = get(properties, TIER3_COST)) != null) {
      preference.setTier3Cost(parseInt(TIER3_COST, value));
    }
    if ((value = get(properties, UNRANKED_COST)) != null) {
      preference.setUnrankedCost(parseInt(UNRANKED_COST, value));
    }
    if ((value = get(properties, TOP2_BIAS)) != null) {
      preference.setTop2Bias(parseBoolean(TOP2_BIAS, value));
    }

    CapacityConfig.Builder capacity = base.getCapacity().toBuilder();
    if ((value = get(properties, ENABLE_TOPIC_OVERFLOW)) != null) {
      capacity.setTopicOverflow(parseBoolean(ENABLE_TOPIC_OVERFLOW, value));
    }
    if ((value = get(properties, ENABLE_COACH_OVERFLOW)) != null) {
      capacity.setCoachOverflow(parseBoolean(ENABLE_COACH_OVERFLOW, value));
    }
    if ((value = get(properties, DEPT_MIN_MODE)) != null) {
      capacity.setDeptMinMode(DeptMinMode.parse(value));
    }
    if ((value = get(properties, P_DEPT_SHORTFALL)) != null) {
      capacity.setDeptShortfallPenalty(parseInt(P_DEPT_SHORTFALL, value));
    }
    if ((value = get(properties, P_TOPIC)) != null) {
      capacity.setTopicOverflowPenalty(parseInt(P_TOPIC, value));
    }
    if ((value = get(properties, P_COACH)) != null) {
      capacity.setCoachOverflowPenalty(parseInt(P_COACH, value));
    }

    SolverConfig.Builder solver = base.getSolver().toBuilder();
    if ((value = get(properties, ALGORITHM)) != null) {
      solver.setAlgorithm(Algorithm.parse(value));
    }
    if ((value = get(properties, TIME_LIMIT_SEC)) != null) {
      solver.setTimeLimitSeconds(value.isEmpty() ? null : parseInt(TIME_LIMIT_SEC, value));
    }
    if ((value = get(properties, RANDOM_SEED)) != null) {
      solver.setRandomSeed(value.isEmpty() ? null : parseInt(RANDOM_SEED, value));
    }
    if ((value = get(properties, EPSILON_SUBOPTIMAL)) != null) {
      solver.setEpsilonSuboptimal(
          value.isEmpty() ? null : parseDouble(EPSILON_SUBOPTIMAL, value));
    }
    if ((value = get(properties, ILP_BACKEND)) != null) {
      solver.setIlpBackend(IlpBackend.parse(value));
    }

    return new AllocationConfig(preference.build(), capacity.build(), solver.build());
  }

  /** Exports every key, unset optional values as empty strings. */
  public static Properties toProperties(AllocationConfig config) {
    Properties properties = new Properties();
    PreferenceConfig preference = config.getPreference();
    properties.setProperty(ALLOW_UNRANKED, Boolean.toString(preference.allowUnranked()));
    properties.setProperty(TIER2_COST, Integer.toString(preference.getTier2Cost()));
    properties.setProperty(TIER3_COST, Integer.toString(preference.getTier3Cost()));
    properties.setProperty(UNRANKED_COST, Integer.toString(preference.getUnrankedCost()));
    properties.setProperty(TOP2_BIAS, Boolean.toString(preference.top2Bias()));

    CapacityConfig capacity = config.getCapacity();
    properties.setProperty(
        ENABLE_TOPIC_OVERFLOW, Boolean.toString(capacity.isTopicOverflowEnabled()));
    properties.setProperty(
        ENABLE_COACH_OVERFLOW, Boolean.toString(capacity.isCoachOverflowEnabled()));
    properties.setProperty(DEPT_MIN_MODE, capacity.getDeptMinMode().key());
    properties.setProperty(
        P_DEPT_SHORTFALL, Integer.toString(capacity.getDeptShortfallPenalty()));
    properties.setProperty(P_TOPIC, Integer.toString(capacity.getTopicOverflowPenalty()));
    properties.setProperty(P_COACH, Integer.toString(capacity.getCoachOverflowPenalty()));

    SolverConfig solver = config.getSolver();
    properties.setProperty(ALGORITHM, solver.getAlgorithm().key());
    properties.setProperty(
        TIME_LIMIT_SEC,
        solver.getTimeLimitSeconds().isPresent()
            ? Integer.toString(solver.getTimeLimitSeconds().getAsInt())
            : "");
    properties.setProperty(
        RANDOM_SEED,
        solver.getRandomSeed().isPresent()
            ? Integer.toString(solver.getRandomSeed().getAsInt())
            : "");
    properties.setProperty(
        EPSILON_SUBOPTIMAL,
        solver.getEpsilonSuboptimal().isPresent()
            ? Double.toString(solver.getEpsilonSuboptimal().getAsDouble())
            : "");
    properties.setProperty(ILP_BACKEND, solver.getIlpBackend().key());
    return properties;
  }

  public static void save(AllocationConfig config, OutputStream out) throws IOException {
    toProperties(config).store(out, "Thesis allocation configuration");
  }

  private static String get(Properties properties, String key) {
    String value = properties.getProperty(key);
    return value == null ? null : value.trim();
  }

  private static boolean parseBoolean(String key, String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    if (lower.equals("true")) {
      return true;
    }
    if (lower.equals("false")) {
      return false;
    }
    throw new InvalidConfigException(key, "expected true or false, got " + value);
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new InvalidConfigException(key, "expected an integer, got " + value, e);
    }
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new InvalidConfigException(key, "expected a number, got " + value, e);
    }
  }
}
