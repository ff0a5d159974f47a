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

package io.covassembly.report;

/** Labels with a reserved meaning. */
public final class SpecialLabels {

  /**
   * Stands for "every test of this report". Lines covered outside of any single test, e.g. module
   * level code run at import time, are attributed to it. Always stored at index {@link
   * #PLACEHOLDER_ID}.
   */
  public static final String ALL_LABELS_PLACEHOLDER = "Th2dMtk4M_codecov";

  public static final int PLACEHOLDER_ID = 0;

  private SpecialLabels() {}
}
