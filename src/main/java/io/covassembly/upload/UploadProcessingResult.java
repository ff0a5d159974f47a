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
import java.util.List;

/** A merged upload together with the files that could not be used. */
@AutoValue
public abstract class UploadProcessingResult {

  public abstract MergeResult mergeResult();

  public abstract ImmutableList<FileError> errors();

  static UploadProcessingResult create(MergeResult mergeResult, List<FileError> errors) {
    return new AutoValue_UploadProcessingResult(mergeResult, ImmutableList.copyOf(errors));
  }
}
