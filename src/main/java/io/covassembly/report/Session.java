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

package io.covassembly.report;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Map;
import javax.annotation.Nullable;

/** One upload's, or one carried-forward upload's, contribution to a report. */
@AutoValue
public abstract class Session {

  /** Id of a session that has not been added to a report yet. */
  public static final int UNASSIGNED_ID = -1;

  public abstract int id();

  public abstract ImmutableSortedSet<String> flags();

  public abstract SessionType sessionType();

  /** Name given to the upload by the uploader, if any. */
  @Nullable
  public abstract String name();

  /** CI provider the upload came from. */
  @Nullable
  public abstract String provider();

  /** Build number or id assigned by the CI provider. */
  @Nullable
  public abstract String buildCode();

  @Nullable
  public abstract String job();

  @Nullable
  public abstract String buildUrl();

  public abstract ImmutableMap<String, String> env();

  /** Totals of what this session contributed when it was merged. */
  @Nullable
  public abstract ReportTotals totals();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_Session.Builder()
        .setId(UNASSIGNED_ID)
        .setFlags(ImmutableSortedSet.of())
        .setSessionType(SessionType.UPLOADED)
        .setEnv(ImmutableMap.of());
  }

  public boolean hasAnyFlag(Collection<String> candidates) {
    for (String flag : candidates) {
      if (flags().contains(flag)) {
        return true;
      }
    }
    return false;
  }

  Session withId(int id) {
    return toBuilder().setId(id).build();
  }

  /** Builder for {@link Session}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(int id);

    public abstract Builder setFlags(Collection<String> flags);

    public abstract Builder setSessionType(SessionType sessionType);

    public abstract Builder setName(@Nullable String name);

    public abstract Builder setProvider(@Nullable String provider);

    public abstract Builder setBuildCode(@Nullable String buildCode);

    public abstract Builder setJob(@Nullable String job);

    public abstract Builder setBuildUrl(@Nullable String buildUrl);

    public abstract Builder setEnv(Map<String, String> env);

    public abstract Builder setTotals(@Nullable ReportTotals totals);

    public abstract Session build();
  }
}
