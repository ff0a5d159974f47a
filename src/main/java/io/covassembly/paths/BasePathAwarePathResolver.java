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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Resolves the paths of one uploaded coverage file. Coverage tools often write paths relative to
 * the directory they ran in, so when a table of contents is available a relative path is also
 * tried below the directory that held the uploaded file, and below any extra base directory the
 * caller knows of.
 *
 * <p>The plain result always wins when there is one. Disagreements between the plain and the
 * base-relative result are recorded and logged.
 */
public final class BasePathAwarePathResolver {

  private static final Logger logger = Logger.getLogger(BasePathAwarePathResolver.class.getName());
  private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^[A-Za-z]:[\\\\/]");

  /** A raw path for which the plain and the base-relative resolution differ. */
  @AutoValue
  public abstract static class UnexpectedResult {
    public abstract String rawPath();

    public abstract Optional<String> plainResult();

    public abstract Optional<String> baseResult();

    static UnexpectedResult create(
        String rawPath, Optional<String> plainResult, Optional<String> baseResult) {
      return new AutoValue_BasePathAwarePathResolver_UnexpectedResult(
          rawPath, plainResult, baseResult);
    }
  }

  private final PathResolver resolver;
  private final ImmutableList<String> basePaths;
  private final char separator;
  private final List<UnexpectedResult> unexpectedResults =
      Collections.synchronizedList(new ArrayList<>());

  BasePathAwarePathResolver(PathResolver resolver, @Nullable String uploadedFile) {
    this.resolver = resolver;
    this.separator = uploadedFile != null && isWindowsPath(uploadedFile) ? '\\' : '/';
    String parent = uploadedFile == null ? null : parentOf(uploadedFile, separator);
    this.basePaths = parent == null ? ImmutableList.of() : ImmutableList.of(parent);
  }

  private static boolean isWindowsPath(String path) {
    return WINDOWS_ABSOLUTE.matcher(path).lookingAt() || path.indexOf('\\') >= 0;
  }

  @Nullable
  private static String parentOf(String path, char separator) {
    int last = path.lastIndexOf(separator);
    if (last < 0) {
      return null;
    }
    if (last == 0) {
      return String.valueOf(separator);
    }
    return path.substring(0, last);
  }

  /** The directories relative paths are tried against; empty if the upload had no location. */
  public ImmutableList<String> basePaths() {
    return basePaths;
  }

  public Optional<String> resolve(String rawPath) {
    return resolve(rawPath, ImmutableList.of());
  }

  /**
   * Resolves {@code rawPath}, trying it below the uploaded file's directory and then below each of
   * {@code basesToTry} if plain resolution fails.
   */
  public Optional<String> resolve(String rawPath, List<String> basesToTry) {
    Optional<String> plain = resolver.resolve(rawPath);
    if (!resolver.hasToc() || rawPath.isEmpty() || isAbsolute(rawPath)) {
      return plain;
    }
    Optional<String> fromBase = Optional.empty();
    List<String> bases = new ArrayList<>(basePaths);
    bases.addAll(basesToTry);
    for (String base : bases) {
      fromBase = resolver.resolveQuietly(join(base, rawPath));
      if (fromBase.isPresent()) {
        break;
      }
    }
    if (plain.isPresent()) {
      if (fromBase.isPresent() && !fromBase.equals(plain)) {
        unexpectedResults.add(UnexpectedResult.create(rawPath, plain, fromBase));
        logger.log(
            Level.INFO,
            String.format(
                "Path %s resolved to %s, relative to %s it resolves to %s",
                rawPath, plain.get(), basePaths, fromBase.get()));
      }
      return plain;
    }
    if (fromBase.isPresent()) {
      unexpectedResults.add(UnexpectedResult.create(rawPath, plain, fromBase));
    }
    return fromBase;
  }

  private String join(String base, String path) {
    char baseSeparator = base.indexOf('\\') >= 0 ? '\\' : separator;
    if (base.isEmpty() || base.charAt(base.length() - 1) == baseSeparator) {
      return base + path;
    }
    return base + baseSeparator + path;
  }

  private static boolean isAbsolute(String path) {
    return path.startsWith("/") || WINDOWS_ABSOLUTE.matcher(path).lookingAt();
  }

  /** Raw paths whose plain and base-relative resolutions differed. */
  public ImmutableList<UnexpectedResult> unexpectedResults() {
    synchronized (unexpectedResults) {
      return ImmutableList.copyOf(unexpectedResults);
    }
  }
}
