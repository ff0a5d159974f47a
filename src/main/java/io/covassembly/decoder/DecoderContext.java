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

package io.covassembly.decoder;

import io.covassembly.config.AssemblyContext;
import io.covassembly.errors.ReportExpiredException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import javax.annotation.Nullable;

/** What a decoder may consult besides the uploaded content. */
public final class DecoderContext {

  private final Clock clock;
  @Nullable private final Duration maxReportAge;

  public DecoderContext(Clock clock, @Nullable Duration maxReportAge) {
    this.clock = clock;
    this.maxReportAge = maxReportAge;
  }

  public static DecoderContext from(AssemblyContext context) {
    return new DecoderContext(context.clock(), context.maxReportAge());
  }

  public Clock clock() {
    return clock;
  }

  @Nullable
  public Duration maxReportAge() {
    return maxReportAge;
  }

  /**
   * Rejects reports generated longer ago than the configured maximum age.
   *
   * @throws ReportExpiredException if {@code timestamp} is too old
   */
  public void checkNotExpired(Instant timestamp, String filename) throws ReportExpiredException {
    if (maxReportAge == null) {
      return;
    }
    if (timestamp.plus(maxReportAge).isBefore(clock.instant())) {
      throw new ReportExpiredException(timestamp, filename);
    }
  }
}
