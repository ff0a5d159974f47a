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
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * User-supplied path rewrites of the form {@code pattern::replacement}.
 *
 * <p>A rule with an empty pattern adds its replacement as a prefix to every path. Any other rule
 * is a regular expression anchored at the start of the path; the first rule that matches replaces
 * the matched prefix with its replacement, or strips it when the replacement is empty. In patterns
 * {@code **} stands for any sequence of characters and a lone {@code *} for one path component.
 */
public final class UserPathFixes {

  private static final String SEPARATOR = "::";
  private static final Pattern LONE_STAR = Pattern.compile("(?<!\\.)\\*");
  private static final CharMatcher SLASH = CharMatcher.is('/');

  private static final class Substitution {
    final Pattern pattern;
    final String replacement;

    Substitution(Pattern pattern, String replacement) {
      this.pattern = pattern;
      this.replacement = replacement;
    }
  }

  private final ImmutableList<Substitution> substitutions;
  private final ImmutableList<String> prefixes;

  private UserPathFixes(ImmutableList<Substitution> substitutions, ImmutableList<String> prefixes) {
    this.substitutions = substitutions;
    this.prefixes = prefixes;
  }

  /**
   * Parses {@code pattern::replacement} rules. A rule without a separator strips its pattern.
   *
   * @throws IllegalArgumentException if a pattern is not a valid regular expression
   */
  public static UserPathFixes parse(List<String> rules) {
    ImmutableList.Builder<Substitution> substitutions = ImmutableList.builder();
    ImmutableList.Builder<String> prefixes = ImmutableList.builder();
    for (String rule : rules) {
      int separator = rule.indexOf(SEPARATOR);
      String pattern = separator < 0 ? rule : rule.substring(0, separator);
      String replacement = separator < 0 ? "" : rule.substring(separator + SEPARATOR.length());
      if (pattern.isEmpty()) {
        if (!replacement.isEmpty()) {
          prefixes.add(SLASH.trimTrailingFrom(replacement));
        }
        continue;
      }
      substitutions.add(new Substitution(compile(pattern), replacement));
    }
    return new UserPathFixes(substitutions.build(), prefixes.build());
  }

  public static UserPathFixes empty() {
    return new UserPathFixes(ImmutableList.of(), ImmutableList.of());
  }

  static Pattern compile(String pattern) {
    String regex = pattern.replace("**", ".*");
    regex = LONE_STAR.matcher(regex).replaceAll(Matcher.quoteReplacement("[^/\\n]+"));
    return Pattern.compile(SLASH.trimLeadingFrom(regex));
  }

  public boolean isEmpty() {
    return substitutions.isEmpty() && prefixes.isEmpty();
  }

  /**
   * Rewrites {@code path} with the first matching substitution, then, if {@code addPrefixes},
   * prepends the prefix rules in order.
   */
  public String apply(String path, boolean addPrefixes) {
    String result = substitute(path);
    if (addPrefixes) {
      for (String prefix : prefixes) {
        result = result.isEmpty() ? prefix : prefix + "/" + result;
      }
    }
    return result;
  }

  private String substitute(String path) {
    for (Substitution substitution : substitutions) {
      Matcher matcher = substitution.pattern.matcher(path);
      if (!matcher.lookingAt()) {
        continue;
      }
      String remainder = SLASH.trimLeadingFrom(path.substring(matcher.end()));
      if (substitution.replacement.isEmpty()) {
        return remainder;
      }
      String replacement = SLASH.trimTrailingFrom(substitution.replacement);
      return remainder.isEmpty() ? replacement : replacement + "/" + remainder;
    }
    return path;
  }
}
