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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.regex.Pattern;

/**
 * Prefixes that CI machines, package managers and virtual environments put in front of repository
 * paths. Used only when no table of contents is available to resolve paths against.
 */
final class KnownBadPaths {

  private static final String COMPONENT = "[^\\/\\n]+";

  private static final ImmutableList<String> PREFIXES =
      ImmutableList.of(
          "((home|Users)/travis/build/" + COMPONENT + "/" + COMPONENT + "/)",
          "((home|Users)/jenkins/jobs/" + COMPONENT + "/workspace/)",
          "(Users/distiller/" + COMPONENT + "/)",
          // home/rof/src/github.com/owner/repo/
          "(home/" + COMPONENT + "/src/(" + COMPONENT + "/){3})",
          // Users/user/workspace/owner/repo/
          "((home|Users)/" + COMPONENT + "/workspace/" + COMPONENT + "/" + COMPONENT + "/)",
          "(.*/jenkins/workspace/" + COMPONENT + "/)",
          "((.+/src/)?github\\.com/" + COMPONENT + "/" + COMPONENT + "/)",
          "(\\w:/Repos/" + COMPONENT + "/" + COMPONENT + "/)",
          "([\\w:/]+projects/" + COMPONENT + "/)",
          "(\\w:/_build/GitHub/" + COMPONENT + "/)",
          "(build/lib\\." + COMPONENT + "/)",
          "(home/circleci/code/)",
          "(home/circleci/repo/)",
          "(vendor/src/.*)",
          "(pipeline/source/)",
          "(var/snap-ci/repo/)",
          "(home/ubuntu/" + COMPONENT + "/)",
          "(.*/site-packages/" + COMPONENT + "\\.egg/)",
          "(.*/site-packages/)",
          "(usr/local/lib/" + COMPONENT + "/dist-packages/)",
          "(.*/slather/spec/fixtures/[^\\n]*)",
          "(.*/target/generated-sources/[^\\n]*)",
          "(.*/\\.phpenv/.*)",
          "(.*/Debug-iphonesimulator/ReactiveCocoa\\.build/DerivedSources/RA.*)",
          "(usr/include/.*)",
          "(.*/handlebars\\.js/dist/.*)",
          "(node_modules/.*)",
          "(bower_components/.*)",
          "(.*/lib/clang/.*)",
          "(.*[\\<\\>].*)",
          // drive letters, E:/
          "(\\w\\:\\/)",
          "(.*/mac-coverage/build/src/.*)",
          // opt/ros/indigo/lib/python2.7/dist-packages/
          "(opt/.*/dist-packages/.*)",
          "(.*/iPhoneSimulator.platform/Developer/SDKs/.*)",
          "(Applications/Xcode\\.app/Contents/Developer/Toolchains/.*)",
          "((.*/)?\\.?v?(irtual)?\\.?envs?(-" + COMPONENT + ")?/.*/" + COMPONENT + "\\.py$)",
          "(Users/" + COMPONENT + "/Projects/.*/Pods/.*)",
          "(Users/" + COMPONENT + "/Projects/" + COMPONENT + "/)",
          // home/user/owner/repo/
          "(home/" + COMPONENT + "/" + COMPONENT + "/" + COMPONENT + "/)");

  private static final Pattern KNOWN_BAD_PREFIX =
      Pattern.compile(
          "^(\\.*\\/)*(" + Joiner.on('|').join(PREFIXES) + ")?",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private KnownBadPaths() {}

  /**
   * Removes a known CI or vendor prefix from {@code path}. Paths that are noise altogether, such as
   * files under {@code node_modules}, become empty.
   */
  static String strip(String path) {
    return KNOWN_BAD_PREFIX.matcher(path).replaceAll("");
  }
}
