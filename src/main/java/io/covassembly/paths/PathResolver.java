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
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.SetMultimap;
import io.covassembly.config.AssemblyContext;
import io.covassembly.config.FlagConfiguration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Maps the paths found in uploaded coverage files to canonical repository paths.
 *
 * <p>A path goes through these steps, and is rejected as soon as one fails:
 *
 * <ol>
 *   <li>leading {@code .} and {@code /} characters are stripped and the path normalized;
 *   <li>user substitutions are applied;
 *   <li>with a table of contents, the path is resolved against it; without one, known CI and
 *       vendor prefixes are removed;
 *   <li>user substitutions are applied again, followed by user prefixes;
 *   <li>the include and exclude patterns are checked.
 * </ol>
 *
 * <p>Instances are safe for concurrent use.
 */
public class PathResolver {

  private static final Logger logger = Logger.getLogger(PathResolver.class.getName());
  private static final int DIAGNOSTIC_SAMPLE_SIZE = 10;

  private final UserPathFixes fixes;
  private final UserPathIncludes includes;
  @Nullable private final PathTree toc;
  private final boolean disableDefaultPathFixes;

  private final SetMultimap<String, String> resolved =
      Multimaps.synchronizedSetMultimap(LinkedHashMultimap.create());
  private final Set<String> rejected = Collections.synchronizedSet(new LinkedHashSet<>());

  public PathResolver(
      UserPathFixes fixes,
      UserPathIncludes includes,
      @Nullable PathTree toc,
      boolean disableDefaultPathFixes) {
    this.fixes = fixes;
    this.includes = includes;
    this.toc = toc == null || toc.isEmpty() ? null : toc;
    this.disableDefaultPathFixes = disableDefaultPathFixes;
  }

  /**
   * Creates the resolver for an upload carrying {@code flags}: global ignore entries and the
   * ignore entries of each flag become exclusions, and each flag's path patterns are added as
   * they are.
   */
  public static PathResolver forFlags(
      AssemblyContext context, Collection<String> flags, @Nullable PathTree toc) {
    List<String> patterns = new ArrayList<>();
    for (String ignored : context.ignore()) {
      patterns.add(UserPathIncludes.invert(ignored));
    }
    patterns.addAll(context.paths());
    for (String flag : flags) {
      FlagConfiguration configuration = context.carryforwardRules().flags().get(flag);
      if (configuration == null) {
        continue;
      }
      for (String ignored : configuration.ignore()) {
        patterns.add(UserPathIncludes.invert(ignored));
      }
      patterns.addAll(configuration.paths());
    }
    return new PathResolver(
        UserPathFixes.parse(context.fixes()),
        new UserPathIncludes(patterns),
        toc,
        context.disableDefaultPathFixes());
  }

  /** A resolver that only normalizes paths. */
  public static PathResolver identity() {
    return new PathResolver(
        UserPathFixes.empty(), UserPathIncludes.includeEverything(), null, false);
  }

  public boolean hasToc() {
    return toc != null;
  }

  /**
   * Returns the canonical path for {@code rawPath}, or empty if the path does not belong in the
   * report.
   */
  public Optional<String> resolve(String rawPath) {
    Optional<String> result = resolveQuietly(rawPath);
    if (result.isPresent()) {
      resolved.put(result.get(), rawPath);
    } else {
      rejected.add(rawPath);
    }
    return result;
  }

  /** Same as {@link #resolve} without recording the outcome for diagnostics. */
  Optional<String> resolveQuietly(@Nullable String rawPath) {
    if (rawPath == null || rawPath.isEmpty()) {
      return Optional.empty();
    }
    String path = PathCleaner.preClean(rawPath);
    if (!fixes.isEmpty()) {
      path = fixes.apply(path, /* addPrefixes= */ false);
    }
    if (toc != null && !disableDefaultPathFixes) {
      Optional<String> match = toc.resolve(path, /* ancestors= */ 1);
      if (!match.isPresent()) {
        return Optional.empty();
      }
      path = match.get();
    } else if (toc == null) {
      path = KnownBadPaths.strip(path);
    }
    if (!fixes.isEmpty()) {
      path = fixes.apply(path, /* addPrefixes= */ true);
    }
    if (path.isEmpty() || path.equals(".") || !includes.test(path)) {
      return Optional.empty();
    }
    return Optional.of(path);
  }

  /** Creates a resolver that also tries paths relative to where {@code uploadedFile} lived. */
  public BasePathAwarePathResolver forUploadedFile(@Nullable String uploadedFile) {
    return new BasePathAwarePathResolver(this, uploadedFile);
  }

  /** Raw paths that were rejected. */
  public ImmutableList<String> rejectedPaths() {
    synchronized (rejected) {
      return ImmutableList.copyOf(rejected);
    }
  }

  /** Canonical paths with the raw paths that resolved to them. */
  public Map<String, Collection<String>> resolvedPaths() {
    synchronized (resolved) {
      return LinkedHashMultimap.create(resolved).asMap();
    }
  }

  /**
   * Logs a sample of the paths that were rewritten, rejected, or that collapsed with other raw
   * paths onto the same canonical path.
   */
  public void logAbnormalities() {
    Map<String, Collection<String>> results = resolvedPaths();
    List<String> fixed = new ArrayList<>();
    List<String> collisions = new ArrayList<>();
    for (Map.Entry<String, Collection<String>> entry : results.entrySet()) {
      if (entry.getValue().size() > 1) {
        collisions.add(entry.getKey() + " <- " + entry.getValue());
      } else if (!Iterables.getOnlyElement(entry.getValue()).equals(entry.getKey())) {
        fixed.add(entry.getKey() + " <- " + Iterables.getOnlyElement(entry.getValue()));
      }
    }
    List<String> rejectedPaths = rejectedPaths();
    if (fixed.isEmpty() && collisions.isEmpty() && rejectedPaths.isEmpty()) {
      return;
    }
    logger.log(
        Level.INFO,
        String.format(
            "Path fixes: %d rewritten %s, %d rejected %s, %d collisions %s",
            fixed.size(),
            sample(fixed),
            rejectedPaths.size(),
            sample(rejectedPaths),
            collisions.size(),
            sample(collisions)));
  }

  private static List<String> sample(List<String> items) {
    return items.subList(0, Math.min(DIAGNOSTIC_SAMPLE_SIZE, items.size()));
  }
}
