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

import java.util.concurrent.atomic.LongAdder;

/** Counters updated while uploads are processed. Safe for concurrent use. */
public final class AssemblyCounters {

  private final LongAdder decodedFiles = new LongAdder();
  private final LongAdder corruptFiles = new LongAdder();
  private final LongAdder expiredFiles = new LongAdder();
  private final LongAdder unrecognizedFiles = new LongAdder();
  private final LongAdder rejectedPaths = new LongAdder();
  private final LongAdder mergedUploads = new LongAdder();

  public void recordDecodedFile() {
    decodedFiles.increment();
  }

  public void recordCorruptFile() {
    corruptFiles.increment();
  }

  public void recordExpiredFile() {
    expiredFiles.increment();
  }

  public void recordUnrecognizedFile() {
    unrecognizedFiles.increment();
  }

  public void recordRejectedPaths(long count) {
    rejectedPaths.add(count);
  }

  public void recordMergedUpload() {
    mergedUploads.increment();
  }

  public long decodedFiles() {
    return decodedFiles.sum();
  }

  public long corruptFiles() {
    return corruptFiles.sum();
  }

  public long expiredFiles() {
    return expiredFiles.sum();
  }

  public long unrecognizedFiles() {
    return unrecognizedFiles.sum();
  }

  public long rejectedPaths() {
    return rejectedPaths.sum();
  }

  public long mergedUploads() {
    return mergedUploads.sum();
  }

  @Override
  public String toString() {
    return String.format(
        "decoded=%d corrupt=%d expired=%d unrecognized=%d rejectedPaths=%d merged=%d",
        decodedFiles(),
        corruptFiles(),
        expiredFiles(),
        unrecognizedFiles(),
        rejectedPaths(),
        mergedUploads());
  }
}
