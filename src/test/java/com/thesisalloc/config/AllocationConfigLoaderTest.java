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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public final class AllocationConfigLoaderTest {
  private static InputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void load_overridesDefaults() throws IOException {
    AllocationConfig config =
        AllocationConfigLoader.load(
            stream(
                "allow_unranked = false\n"
                    + "tier3_cost = 7\n"
                    + "dept_min_mode = hard\n"
                    + "P_topic = 900\n"
                    + "algorithm = hybrid\n"
                    + "time_limit_sec = 60\n"
                    + "random_seed = 42\n"
                    + "epsilon_suboptimal = 0.05\n"
                    + "ilp_backend = cp-sat\n"));

    assertThat(config.getPreference().allowUnranked()).isFalse();
    assertThat(config.getPreference().getTier3Cost()).isEqualTo(7);
    assertThat(config.getPreference().getTier2Cost()).isEqualTo(1);
    assertThat(config.getCapacity().getDeptMinMode()).isEqualTo(DeptMinMode.HARD);
    assertThat(config.getCapacity().getTopicOverflowPenalty()).isEqualTo(900);
    assertThat(config.getSolver().getAlgorithm()).isEqualTo(Algorithm.HYBRID);
    assertThat(config.getSolver().getTimeLimitSeconds().getAsInt()).isEqualTo(60);
    assertThat(config.getSolver().getRandomSeed().getAsInt()).isEqualTo(42);
    assertThat(config.getSolver().getEpsilonSuboptimal().getAsDouble()).isEqualTo(0.05);
    assertThat(config.getSolver().getIlpBackend()).isEqualTo(IlpBackend.CP_SAT);
  }

  @Test
  public void load_invalidValues_failFast() {
    InvalidConfigException mode =
        assertThrows(
            InvalidConfigException.class,
            () -> AllocationConfigLoader.load(stream("dept_min_mode = maybe\n")));
    assertThat(mode).hasMessageThat().contains("dept_min_mode");
    assertThrows(
        InvalidConfigException.class,
        () -> AllocationConfigLoader.load(stream("P_coach = 0\n")));
    assertThrows(
        InvalidConfigException.class,
        () -> AllocationConfigLoader.load(stream("tier2_cost = cheap\n")));
    assertThrows(
        InvalidConfigException.class,
        () -> AllocationConfigLoader.load(stream("top2_bias = yes\n")));
    assertThrows(
        InvalidConfigException.class,
        () -> AllocationConfigLoader.load(stream("time_limit_sec = -5\n")));
  }

  @Test
  public void apply_unknownKeyIsIgnoredAndEmptyValueClears() {
    AllocationConfig base =
        AllocationConfigLoader.fromProperties(properties("random_seed", "9"));
    assertThat(base.getSolver().getRandomSeed().getAsInt()).isEqualTo(9);

    Properties overlay = properties("random_seed", "");
    overlay.setProperty("no_such_key", "1");
    AllocationConfig cleared = AllocationConfigLoader.apply(base, overlay);
    assertThat(cleared.getSolver().getRandomSeed().isPresent()).isFalse();
  }

  @Test
  public void save_thenLoad_givesSameValues() throws IOException {
    AllocationConfig config =
        AllocationConfigLoader.fromProperties(properties("unranked_cost", "300"));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    AllocationConfigLoader.save(config, out);
    AllocationConfig reloaded =
        AllocationConfigLoader.load(new ByteArrayInputStream(out.toByteArray()));

    assertThat(AllocationConfigLoader.toProperties(reloaded))
        .isEqualTo(AllocationConfigLoader.toProperties(config));
    assertThat(reloaded.getPreference().getUnrankedCost()).isEqualTo(300);
  }

  private static Properties properties(String key, String value) {
    Properties properties = new Properties();
    properties.setProperty(key, value);
    return properties;
  }
}
