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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PathCleanerTest {

  @Test
  public void testCleanResolvesDotSegments() {
    assertThat(PathCleaner.clean("./src/../lib/a.py")).isEqualTo("lib/a.py");
    assertThat(PathCleaner.clean("/abs/../x")).isEqualTo("/x");
    assertThat(PathCleaner.clean("../x")).isEqualTo("../x");
    assertThat(PathCleaner.clean("src//a.py")).isEqualTo("src/a.py");
    assertThat(PathCleaner.clean("")).isEqualTo(".");
  }

  @Test
  public void testCleanHandlesWindowsAndEscapes() {
    assertThat(PathCleaner.clean("C:\\ci\\repo\\file.py")).isEqualTo("C:/ci/repo/file.py");
    assertThat(PathCleaner.clean("  my\\ file.py\r")).isEqualTo("my file.py");
    assertThat(PathCleaner.clean("**/src/a.py")).isEqualTo("src/a.py");
  }

  @Test
  public void testCleanIsIdempotent() {
    for (String path :
        ImmutableList.of(
            "./ a/b", "**/**/x", "a\\ b\\c", "/../a", "x/./y/../../..", " ./**/ z", "\r\n")) {
      String cleaned = PathCleaner.clean(path);
      assertThat(PathCleaner.clean(cleaned)).isEqualTo(cleaned);
    }
  }

  @Test
  public void testPreCleanStripsLeadingDotsAndSlashes() {
    assertThat(PathCleaner.preClean("./src/a.py")).isEqualTo("src/a.py");
    assertThat(PathCleaner.preClean("/home/x.py")).isEqualTo("home/x.py");
    assertThat(PathCleaner.preClean("..\\a\\b.py")).isEqualTo("a/b.py");
    assertThat(PathCleaner.preClean("./.github/ci.yml")).isEqualTo("github/ci.yml");
  }
}
