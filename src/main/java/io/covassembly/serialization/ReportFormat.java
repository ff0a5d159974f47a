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

package io.covassembly.serialization;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.covassembly.report.CoverageValue;
import io.covassembly.report.ReportTotals;

/**
 * Layout of a stored report.
 *
 * <p>A report is stored as two documents. The summary is a JSON object:
 *
 * <pre>
 * {"files": {path: [chunk index, totals]},
 *  "sessions": {id: session},
 *  "labels_index": {id: label},
 *  "next_session_id": n,
 *  "totals": totals}
 * </pre>
 *
 * The chunks document starts with a {@code {}} header line followed by one chunk per file, in
 * chunk index order, separated by {@link #CHUNK_SEPARATOR}. Line {@code n} of a chunk holds the
 * JSON array of source line {@code n}, or nothing when the line has no coverage:
 *
 * <pre>
 * [coverage, type, [[session, coverage, missing branches, partials, complexity], ...],
 *  null, complexity, [[session, coverage, type, [label ids]], ...]]
 * </pre>
 *
 * Trailing empty elements are left out.
 */
final class ReportFormat {

  static final String HEADER = "{}";
  static final String CHUNK_SEPARATOR = "\n<<<<< end_of_chunk >>>>>\n";

  static final String FILES = "files";
  static final String SESSIONS = "sessions";
  static final String LABELS_INDEX = "labels_index";
  static final String NEXT_SESSION_ID = "next_session_id";
  static final String TOTALS = "totals";

  static final String SESSION_FLAGS = "flags";
  static final String SESSION_TYPE = "session_type";
  static final String SESSION_NAME = "name";
  static final String SESSION_PROVIDER = "provider";
  static final String SESSION_BUILD = "build";
  static final String SESSION_JOB = "job";
  static final String SESSION_BUILD_URL = "build_url";
  static final String SESSION_ENV = "env";
  static final String SESSION_TOTALS = "totals";

  private static final String TOTALS_FILES = "f";
  private static final String TOTALS_LINES = "n";
  private static final String TOTALS_HITS = "h";
  private static final String TOTALS_MISSES = "m";
  private static final String TOTALS_PARTIALS = "p";
  private static final String TOTALS_COVERAGE = "c";
  private static final String TOTALS_BRANCHES = "b";
  private static final String TOTALS_METHODS = "d";
  private static final String TOTALS_SESSIONS = "s";
  private static final String TOTALS_COMPLEXITY = "C";

  private ReportFormat() {}

  /** Hit counts are numbers, branch ratios strings and booleans booleans. */
  static JsonElement encodeValue(CoverageValue value) {
    switch (value.kind()) {
      case HITS:
        return new JsonPrimitive(value.hits());
      case BRANCH:
        return new JsonPrimitive(value.toString());
      case BOOLEAN:
        return new JsonPrimitive(value.isHit());
    }
    throw new AssertionError(value.kind());
  }

  static CoverageValue decodeValue(JsonElement element) {
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return CoverageValue.ofBoolean(primitive.getAsBoolean());
    }
    if (primitive.isNumber()) {
      return CoverageValue.ofHits(primitive.getAsLong());
    }
    return CoverageValue.parse(primitive.getAsString());
  }

  static JsonObject encodeTotals(ReportTotals totals) {
    JsonObject json = new JsonObject();
    json.addProperty(TOTALS_FILES, totals.files());
    json.addProperty(TOTALS_LINES, totals.lines());
    json.addProperty(TOTALS_HITS, totals.hits());
    json.addProperty(TOTALS_MISSES, totals.misses());
    json.addProperty(TOTALS_PARTIALS, totals.partials());
    json.add(
        TOTALS_COVERAGE,
        totals.coverage() == null ? JsonNull.INSTANCE : new JsonPrimitive(totals.coverage()));
    json.addProperty(TOTALS_BRANCHES, totals.branches());
    json.addProperty(TOTALS_METHODS, totals.methods());
    json.addProperty(TOTALS_SESSIONS, totals.sessions());
    json.addProperty(TOTALS_COMPLEXITY, totals.complexity());
    return json;
  }

  static ReportTotals decodeTotals(JsonObject json) {
    return ReportTotals.create(
        intOrZero(json, TOTALS_FILES),
        intOrZero(json, TOTALS_LINES),
        intOrZero(json, TOTALS_HITS),
        intOrZero(json, TOTALS_MISSES),
        intOrZero(json, TOTALS_PARTIALS),
        intOrZero(json, TOTALS_BRANCHES),
        intOrZero(json, TOTALS_METHODS),
        intOrZero(json, TOTALS_SESSIONS),
        intOrZero(json, TOTALS_COMPLEXITY));
  }

  private static int intOrZero(JsonObject json, String key) {
    JsonElement element = json.get(key);
    return element == null || element.isJsonNull() ? 0 : element.getAsInt();
  }
}
