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

package io.covassembly.builder;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;

/**
 * A test label attached to a coverage observation, either already registered with the builder
 * session ({@link #id()}) or as the raw label text ({@link #label()}). The empty label stands for
 * all labels.
 */
@AutoValue
public abstract class LabelHint {

  @Nullable
  public abstract Integer id();

  @Nullable
  public abstract String label();

  public static LabelHint ofId(int id) {
    checkArgument(id >= 0, "Label ids are non-negative: %s", id);
    return new AutoValue_LabelHint(id, null);
  }

  public static LabelHint ofLabel(String label) {
    return new AutoValue_LabelHint(null, label);
  }
}
