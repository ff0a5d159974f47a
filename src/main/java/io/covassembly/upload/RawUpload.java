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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The parsed content of an upload: its coverage files plus the metadata sent along with them. */
@AutoValue
public abstract class RawUpload {

  public abstract ImmutableList<UploadedFile> files();

  /** Newline separated list of the repository's files, if the uploader sent one. */
  @Nullable
  public abstract String toc();

  /** {@code KEY=value} lines describing the CI environment, if the uploader sent them. */
  @Nullable
  public abstract String env();

  /** Extra directories relative paths in the coverage files may be relative to. */
  public abstract ImmutableList<String> basesToTry();

  public static RawUpload create(List<UploadedFile> files) {
    return create(files, null, null, ImmutableList.of());
  }

  public static RawUpload create(
      List<UploadedFile> files,
      @Nullable String toc,
      @Nullable String env,
      List<String> basesToTry) {
    return new AutoValue_RawUpload(
        ImmutableList.copyOf(files), toc, env, ImmutableList.copyOf(basesToTry));
  }

  /** The environment lines as a map. Lines without {@code =} are skipped. */
  public ImmutableMap<String, String> envMap() {
    if (env() == null) {
      return ImmutableMap.of();
    }
    Map<String, String> result = new LinkedHashMap<>();
    for (String line : Splitter.on('\n').omitEmptyStrings().split(env())) {
      List<String> parts = Splitter.on('=').limit(2).splitToList(line.trim());
      if (parts.size() == 2) {
        result.put(parts.get(0), parts.get(1));
      }
    }
    return ImmutableMap.copyOf(result);
  }
}
