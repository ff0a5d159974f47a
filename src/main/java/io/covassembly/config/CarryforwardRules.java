// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.covassembly.config;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Map;

/**
 * Carryforward settings of every configured flag, plus the rule applied to flags without their
 * own configuration.
 */
@AutoValue
public abstract class CarryforwardRules {

  public abstract ImmutableMap<String, FlagConfiguration> flags();

  /** Applies to flags absent from {@link #flags()}. */
  public abstract FlagConfiguration defaultRule();

  public static CarryforwardRules create(
      Map<String, FlagConfiguration> flags, FlagConfiguration defaultRule) {
    return new AutoValue_CarryforwardRules(ImmutableMap.copyOf(flags), defaultRule);
  }

  /** No flag is carried forward. */
  public static CarryforwardRules none() {
    return create(ImmutableMap.of(), FlagConfiguration.notCarriedForward());
  }

  public FlagConfiguration forFlag(String flag) {
    FlagConfiguration configuration = flags().get(flag);
    return configuration == null ? defaultRule() : configuration;
  }

  public boolean isCarriedForward(String flag) {
    return forFlag(flag).carryforward();
  }

  /** The subset of {@code flags} that carry forward in {@code mode}. */
  public ImmutableSortedSet<String> carriedForwardIn(
      Collection<String> flags, CarryforwardMode mode) {
    ImmutableSortedSet.Builder<String> result = ImmutableSortedSet.naturalOrder();
    for (String flag : flags) {
      FlagConfiguration configuration = forFlag(flag);
      if (configuration.carryforward() && configuration.carryforwardMode() == mode) {
        result.add(flag);
      }
    }
    return result.build();
  }

  /** Whether any flag, or the default rule, carries forward by labels. */
  public boolean usesLabels() {
    if (isLabelRule(defaultRule())) {
      return true;
    }
    for (FlagConfiguration configuration : flags().values()) {
      if (isLabelRule(configuration)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isLabelRule(FlagConfiguration configuration) {
    return configuration.carryforward()
        && configuration.carryforwardMode() == CarryforwardMode.LABELS;
  }
}
