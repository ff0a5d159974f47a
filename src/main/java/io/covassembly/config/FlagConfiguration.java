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
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Per-flag settings: whether the flag carries forward, in which mode, and its path filters. */
@AutoValue
public abstract class FlagConfiguration {

  public abstract boolean carryforward();

  public abstract CarryforwardMode carryforwardMode();

  /** Path patterns whose matches are left out of uploads carrying this flag. */
  public abstract ImmutableList<String> ignore();

  /** Include and {@code !}-prefixed exclude patterns for uploads carrying this flag. */
  public abstract ImmutableList<String> paths();

  public static FlagConfiguration create(
      boolean carryforward, CarryforwardMode mode, List<String> ignore, List<String> paths) {
    return new AutoValue_FlagConfiguration(
        carryforward, mode, ImmutableList.copyOf(ignore), ImmutableList.copyOf(paths));
  }

  public static FlagConfiguration carriedForward(CarryforwardMode mode) {
    return create(true, mode, ImmutableList.of(), ImmutableList.of());
  }

  public static FlagConfiguration notCarriedForward() {
    return create(false, CarryforwardMode.ALL, ImmutableList.of(), ImmutableList.of());
  }
}
