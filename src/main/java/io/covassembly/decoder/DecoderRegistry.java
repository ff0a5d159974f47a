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
import java.util.List;
import java.util.Optional;

/** Decoders in priority order. The first one that recognizes a file decodes it. */
public final class DecoderRegistry {

  private final ImmutableList<LanguageDecoder> decoders;

  public DecoderRegistry(List<LanguageDecoder> decoders) {
    this.decoders = ImmutableList.copyOf(decoders);
  }

  /** The decoders shipped with this library. */
  public static DecoderRegistry withDefaults() {
    return new DecoderRegistry(ImmutableList.of(new LcovDecoder()));
  }

  public ImmutableList<LanguageDecoder> decoders() {
    return decoders;
  }

  public Optional<LanguageDecoder> find(String content, String filename) {
    String firstLine = firstLine(content);
    for (LanguageDecoder decoder : decoders) {
      if (decoder.matches(content, firstLine, filename)) {
        return Optional.of(decoder);
      }
    }
    return Optional.empty();
  }

  private static String firstLine(String content) {
    String trimmed = content.stripLeading();
    int newline = trimmed.indexOf('\n');
    return (newline < 0 ? trimmed : trimmed.substring(0, newline)).trim();
  }
}
