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

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a path belongs in the report. Patterns starting with {@code !} exclude, the
 * others include; both are regular expressions anchored at the start of the path.
 *
 * <p>Without patterns, with a {@code .*} pattern, or with exclusions only, every path not
 * excluded is included. The {@code !.*} pattern turns exclusion off.
 */
public final class UserPathIncludes {

  private static final String INCLUDE_ALL = ".*";
  private static final String EXCLUDE_ALL = "!.*";

  private final boolean noPatterns;
  private final boolean includeAll;
  private final ImmutableList<Pattern> includes;
  private final ImmutableList<Pattern> excludes;

  /** @throws java.util.regex.PatternSyntaxException if a pattern is not a valid expression */
  public UserPathIncludes(Collection<String> patterns) {
    Set<String> unique = new LinkedHashSet<>(patterns);
    ImmutableList.Builder<Pattern> includes = ImmutableList.builder();
    ImmutableList.Builder<Pattern> excludes = ImmutableList.builder();
    boolean hasIncludes = false;
    for (String pattern : unique) {
      if (pattern.startsWith("!")) {
        excludes.add(Pattern.compile(pattern.substring(1)));
      } else {
        hasIncludes = true;
        includes.add(Pattern.compile(pattern));
      }
    }
    this.noPatterns = unique.isEmpty();
    this.includeAll = unique.contains(INCLUDE_ALL) || !hasIncludes;
    this.includes = includeAll ? ImmutableList.of() : includes.build();
    this.excludes = unique.contains(EXCLUDE_ALL) ? ImmutableList.of() : excludes.build();
  }

  public static UserPathIncludes includeEverything() {
    return new UserPathIncludes(ImmutableList.of());
  }

  /** Returns whether {@code path} should be kept. Empty paths are kept only without patterns. */
  public boolean test(String path) {
    if (noPatterns) {
      return true;
    }
    if (path.isEmpty()) {
      return false;
    }
    if (!includeAll && !matchesAny(includes, path)) {
      return false;
    }
    return !matchesAny(excludes, path);
  }

  private static boolean matchesAny(ImmutableList<Pattern> patterns, String path) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(path).lookingAt()) {
        return true;
      }
    }
    return false;
  }

  /** Turns an ignore entry into an exclusion and an exclusion back into an inclusion. */
  public static String invert(String pattern) {
    return pattern.startsWith("!") ? pattern.substring(1) : "!" + pattern;
  }
}
