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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The repository's files organized by their path components in reverse order, so that a path can
 * be matched from its file name up.
 *
 * <p>For {@code src/foo/mod.rs} and {@code src/foo/bar/mod.rs} the tree is
 *
 * <pre>
 * mod.rs
 *   foo
 *     src      -> src/foo/mod.rs
 *   bar
 *     foo
 *       src    -> src/foo/bar/mod.rs
 * </pre>
 *
 * and a lookup of {@code C:\ci\repo\src\foo\mod.rs} walks {@code mod.rs}, {@code foo}, {@code
 * src} before it stops on {@code src/foo/mod.rs}.
 *
 * <p>Nodes live in a flat list and refer to each other by index. Components are compared
 * case-insensitively. The tree is immutable once built and safe to share between threads.
 */
public final class PathTree {

  private static final Splitter SLASH_SPLITTER = Splitter.on('/');
  private static final int ROOT = 0;

  private static final class Node {
    final Map<String, Integer> children = new HashMap<>();
    final List<String> fullPaths = new ArrayList<>();
  }

  private final List<Node> nodes = new ArrayList<>();
  private final Map<String, Integer> tocOrder = new HashMap<>();

  private PathTree() {
    nodes.add(new Node());
  }

  /** Builds a tree over the given table of contents. Entries are cleaned before insertion. */
  public static PathTree build(Iterable<String> toc) {
    PathTree tree = new PathTree();
    for (String path : toc) {
      String cleaned = PathCleaner.clean(path);
      if (!cleaned.equals(".")) {
        tree.insert(cleaned);
      }
    }
    return tree;
  }

  /** Builds a tree from a newline separated table of contents. */
  public static PathTree fromText(String toc) {
    return build(Splitter.on('\n').omitEmptyStrings().trimResults().split(toc));
  }

  public boolean isEmpty() {
    return nodes.get(ROOT).children.isEmpty();
  }

  private void insert(String path) {
    if (tocOrder.containsKey(path)) {
      return;
    }
    tocOrder.put(path, tocOrder.size());
    int node = ROOT;
    for (String component : Lists.reverse(SLASH_SPLITTER.splitToList(path))) {
      String key = Ascii.toLowerCase(component);
      Integer child = nodes.get(node).children.get(key);
      if (child == null) {
        child = nodes.size();
        nodes.add(new Node());
        nodes.get(node).children.put(key, child);
      }
      node = child;
    }
    nodes.get(node).fullPaths.add(path);
  }

  /** Resolves {@code path} without checking how many ancestors it shares with the match. */
  public Optional<String> resolve(String path) {
    return lookup(PathCleaner.clean(path));
  }

  /**
   * Resolves {@code path} to an entry of the table of contents.
   *
   * <p>The match is accepted when it equals the path ignoring case, when it is a shorter suffix of
   * the path, or when it ends with the last {@code ancestors + 1} components of the path.
   */
  public Optional<String> resolve(String path, int ancestors) {
    String cleaned = PathCleaner.clean(path);
    return lookup(cleaned).filter(match -> hasCommonAncestors(cleaned, match, ancestors));
  }

  private Optional<String> lookup(String path) {
    List<String> candidates = candidates(path);
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    if (candidates.size() == 1) {
      return Optional.of(candidates.get(0));
    }
    return Optional.of(bestMatch(path, candidates));
  }

  /**
   * Walks the reversed components of {@code path} as far as they match. Returns the full paths of
   * the deepest matched node that has any, plus those found by drilling down a straight chain when
   * the walk stopped on a node without full paths.
   */
  private List<String> candidates(String path) {
    List<String> components = Lists.reverse(SLASH_SPLITTER.splitToList(path));
    Set<String> results = new LinkedHashSet<>();
    int node = ROOT;
    boolean matched = false;
    boolean endsOnFullPath = false;
    for (String component : components) {
      Integer child = nodes.get(node).children.get(Ascii.toLowerCase(component));
      if (child == null) {
        break;
      }
      node = child;
      matched = true;
      endsOnFullPath = !nodes.get(node).fullPaths.isEmpty();
      if (endsOnFullPath) {
        results.clear();
        results.addAll(nodes.get(node).fullPaths);
      }
    }
    if (matched && !endsOnFullPath) {
      List<String> drilled = drill(node);
      if (drilled != null) {
        results.addAll(drilled);
      }
    }
    return ImmutableList.copyOf(results);
  }

  /** Follows a chain of single children and returns the first full paths on it. */
  @Nullable
  private List<String> drill(int start) {
    Node node = nodes.get(start);
    while (node.children.size() == 1) {
      node = nodes.get(node.children.values().iterator().next());
      if (!node.fullPaths.isEmpty()) {
        return node.fullPaths;
      }
    }
    return null;
  }

  /**
   * Picks the candidate sharing the longest case-insensitive character suffix with {@code path};
   * ties go to the entry listed first in the table of contents.
   */
  private String bestMatch(String path, List<String> candidates) {
    String best = null;
    int bestSuffix = -1;
    for (String candidate :
        candidates.stream()
            .sorted((a, b) -> Integer.compare(tocOrder.get(a), tocOrder.get(b)))
            .collect(toImmutableList())) {
      int suffix = commonSuffixLength(path, candidate);
      if (suffix > bestSuffix) {
        best = candidate;
        bestSuffix = suffix;
      }
    }
    return best;
  }

  private static int commonSuffixLength(String first, String second) {
    int length = 0;
    int i = first.length() - 1;
    int j = second.length() - 1;
    while (i >= 0
        && j >= 0
        && Ascii.toLowerCase(first.charAt(i)) == Ascii.toLowerCase(second.charAt(j))) {
      length++;
      i--;
      j--;
    }
    return length;
  }

  static boolean hasCommonAncestors(String path, String match, int ancestors) {
    String pathLower = Ascii.toLowerCase(path);
    String matchLower = Ascii.toLowerCase(match);
    if (pathLower.equals(matchLower)) {
      return true;
    }
    List<String> pathComponents = SLASH_SPLITTER.splitToList(pathLower);
    List<String> matchComponents = SLASH_SPLITTER.splitToList(matchLower);
    if (matchComponents.size() < pathComponents.size() && pathLower.endsWith(matchLower)) {
      return true;
    }
    int size = pathComponents.size();
    int keep = Math.min(ancestors + 1, size);
    return matchLower.endsWith(String.join("/", pathComponents.subList(size - keep, size)));
  }
}
