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

package io.covassembly.upload;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Collection;

/** Sessions removed from a report because a new upload replaced their carried-forward data. */
@AutoValue
public abstract class SessionAdjustmentResult {

  /** Sessions removed entirely, in ascending order. */
  public abstract ImmutableList<Integer> fullyDeletedSessionIds();

  /** Sessions that lost some labels but still contribute, in ascending order. */
  public abstract ImmutableList<Integer> partiallyDeletedSessionIds();

  static SessionAdjustmentResult create(
      Collection<Integer> fullyDeleted, Collection<Integer> partiallyDeleted) {
    return new AutoValue_SessionAdjustmentResult(
        ImmutableList.sortedCopyOf(fullyDeleted), ImmutableList.sortedCopyOf(partiallyDeleted));
  }

  public static SessionAdjustmentResult none() {
    return create(ImmutableList.of(), ImmutableList.of());
  }
}
