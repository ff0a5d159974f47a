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

import com.google.common.collect.ImmutableList;
import io.covassembly.errors.CorruptInputException;
import io.covassembly.errors.ReportExpiredException;

/** Turns the content of one uploaded coverage file into line observations. */
public interface LanguageDecoder {

  /** Short name of the format, used in logs. */
  String name();

  /** Whether this decoder understands {@code content}. Must be cheap and must not throw. */
  boolean matches(String content, String firstLine, String filename);

  /**
   * Decodes {@code content}.
   *
   * @throws CorruptInputException if the content violates the format
   * @throws ReportExpiredException if the report is older than {@code context} allows
   */
  ImmutableList<DecodedLine> decode(String content, String filename, DecoderContext context)
      throws CorruptInputException, ReportExpiredException;
}
