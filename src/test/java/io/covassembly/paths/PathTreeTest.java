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
public class PathTreeTest {

  private static final PathTree RUST_TREE =
      PathTree.build(ImmutableList.of("src/foo/mod.rs", "src/foo/bar/mod.rs"));

  @Test
  public void testResolvesAbsoluteWindowsPath() {
    assertThat(RUST_TREE.resolve("C:\\ci\\repo\\src\\foo\\mod.rs", 1)).hasValue("src/foo/mod.rs");
  }

  @Test
  public void testDrillsDownUniqueChain() {
    assertThat(RUST_TREE.resolve("bar/mod.rs", 1)).hasValue("src/foo/bar/mod.rs");
  }

  @Test
  public void testIgnoresCase() {
    assertThat(RUST_TREE.resolve("SRC/Foo/MOD.rs")).hasValue("src/foo/mod.rs");
    assertThat(RUST_TREE.resolve("SRC/Foo/MOD.rs", 1)).hasValue("src/foo/mod.rs");
  }

  @Test
  public void testUnknownFile() {
    assertThat(RUST_TREE.resolve("lib.rs")).isEmpty();
  }

  @Test
  public void testPrefersDeepestMatch() {
    PathTree tree = PathTree.fromText("file.py\ny/file.py\n");

    assertThat(tree.resolve("x/y/file.py", 1)).hasValue("y/file.py");
    assertThat(tree.resolve("file.py", 1)).hasValue("file.py");
  }

  @Test
  public void testRejectsMatchWithoutCommonAncestor() {
    PathTree tree = PathTree.fromText("a/b/c/file.py");

    assertThat(tree.resolve("z/file.py")).hasValue("a/b/c/file.py");
    assertThat(tree.resolve("z/file.py", 1)).isEmpty();
    assertThat(tree.resolve("c/file.py", 1)).hasValue("a/b/c/file.py");
  }

  @Test
  public void testAmbiguousPathIsNotResolved() {
    PathTree tree = PathTree.fromText("foobar/bar/baz.py\nbarfoo/bar/baz.py");

    assertThat(tree.resolve("bar/baz.py", 1)).isEmpty();
    assertThat(tree.resolve("x/foobar/bar/baz.py", 1)).hasValue("foobar/bar/baz.py");
  }

  @Test
  public void testTiesGoToFirstEntry() {
    PathTree tree = PathTree.fromText("README.md\nreadme.md");

    assertThat(tree.resolve("readme.md")).hasValue("README.md");
  }

  @Test
  public void testEmptyTree() {
    assertThat(PathTree.fromText("\n\n").isEmpty()).isTrue();
    assertThat(PathTree.fromText("\n\n").resolve("a.py")).isEmpty();
  }

  @Test
  public void testHasCommonAncestors() {
    assertThat(PathTree.hasCommonAncestors("a/b.py", "A/B.py", 1)).isTrue();
    assertThat(PathTree.hasCommonAncestors("x/y/b.py", "y/b.py", 1)).isTrue();
    assertThat(PathTree.hasCommonAncestors("x/y/b.py", "q/y/b.py", 1)).isTrue();
    assertThat(PathTree.hasCommonAncestors("x/y/b.py", "q/z/b.py", 1)).isFalse();
  }
}
