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

/** One coverage file of an upload, as sent by the uploader. */
@AutoValue
public abstract class UploadedFile {

  /** The file's path on the machine that produced it. */
  public abstract String name();

  public abstract String content();

  public static UploadedFile create(String name, String content) {
    return new AutoValue_UploadedFile(name, content);
  }
}
