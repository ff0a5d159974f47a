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

package io.covassembly.paths;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayDeque;
import java.util.Deque;

/** Lexical clean-up of file paths found in coverage reports. No file system access. */
public final class PathCleaner {

  private static final Splitter SLASH_SPLITTER = Splitter.on('/');
  private static final Joiner SLASH_JOINER = Joiner.on('/');
  private static final CharMatcher LEADING_NOISE = CharMatcher.anyOf("./");

  private PathCleaner() {}

  /**
   * Cleans a path the way table of contents entries and looked-up paths are compared: surrounding
   * whitespace and carriage returns are removed, escaped spaces unescaped, backslashes turned into
   * slashes, {@code **}{@code /} globs dropped and {@code .} and {@code ..} segments resolved.
   *
   * <p>Idempotent: {@code clean(clean(p)).equals(clean(p))}.
   */
  public static String clean(String path) {
    // A single pass can expose new whitespace or globs, e.g. "./ a", so repeat until stable.
    String previous;
    String cleaned = path;
    do {
      previous = cleaned;
      cleaned =
          normalize(
              previous
                  .trim()
                  .replace("**/", "")
                  .replace("\r", "")
                  .replace("\\ ", " ")
                  .replace('\\', '/'));
    } while (!cleaned.equals(previous));
    return cleaned;
  }

  /**
   * Prepares an uploaded path for resolution: backslashes become slashes, leading {@code .} and
   * {@code /} characters are stripped and the rest is normalized.
   */
  public static String preClean(String path) {
    return normalize(LEADING_NOISE.trimLeadingFrom(path.replace('\\', '/')));
  }

  /**
   * Resolves {@code .} and {@code ..} segments and collapses repeated slashes. A leading slash is
   * kept, as are {@code ..} segments that cannot be resolved. The empty path normalizes to {@code
   * "."}.
   */
  static String normalize(String path) {
    if (path.isEmpty()) {
      return ".";
    }
    boolean absolute = path.startsWith("/");
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : SLASH_SPLITTER.split(path)) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
          segments.removeLast();
          continue;
        }
        if (absolute) {
          continue;
        }
      }
      segments.addLast(segment);
    }
    String joined = SLASH_JOINER.join(segments);
    if (absolute) {
      return "/" + joined;
    }
    return joined.isEmpty() ? "." : joined;
  }
}
