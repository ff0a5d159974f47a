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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.covassembly.errors.CorruptInputException;
import io.covassembly.report.CoverageDatapoint;
import io.covassembly.report.CoverageType;
import io.covassembly.report.LabelsIndex;
import io.covassembly.report.LineSession;
import io.covassembly.report.PartialSpan;
import io.covassembly.report.Report;
import io.covassembly.report.ReportFile;
import io.covassembly.report.ReportLine;
import io.covassembly.report.Session;
import io.covassembly.report.SessionType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;

/** Reads the documents written by {@link ReportJsonWriter} back into a {@link Report}. */
public final class ReportJsonReader {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private final String name;

  private ReportJsonReader(String name) {
    this.name = name;
  }

  /**
   * Reads a stored report.
   *
   * @param name identifies the report in error messages
   * @throws CorruptInputException if either document is malformed
   */
  public static Report read(String name, String summaryJson, String chunks)
      throws CorruptInputException {
    ReportJsonReader reader = new ReportJsonReader(name);
    try {
      return reader.read(JsonParser.parseString(summaryJson).getAsJsonObject(), chunks);
    } catch (JsonParseException
        | IllegalStateException
        | IllegalArgumentException
        | IndexOutOfBoundsException
        | UnsupportedOperationException e) {
      throw new CorruptInputException(name, "malformed stored report: " + e.getMessage(), e);
    }
  }

  private Report read(JsonObject summary, String chunks) throws CorruptInputException {
    Report report = new Report();
    JsonObject sessions = summary.getAsJsonObject(ReportFormat.SESSIONS);
    if (sessions != null) {
      for (Map.Entry<String, JsonElement> entry : sessions.entrySet()) {
        report.putSession(
            decodeSession(Integer.parseInt(entry.getKey()), entry.getValue().getAsJsonObject()));
      }
    }
    JsonElement next = summary.get(ReportFormat.NEXT_SESSION_ID);
    if (next != null && !next.isJsonNull()) {
      report.setNextSessionId(next.getAsInt());
    }
    JsonObject labels = summary.getAsJsonObject(ReportFormat.LABELS_INDEX);
    if (labels != null) {
      Map<Integer, String> index = new HashMap<>();
      for (Map.Entry<String, JsonElement> entry : labels.entrySet()) {
        index.put(Integer.parseInt(entry.getKey()), entry.getValue().getAsString());
      }
      report.setLabelsIndex(LabelsIndex.fromMap(index));
    }

    JsonObject files = summary.getAsJsonObject(ReportFormat.FILES);
    if (files == null || files.size() == 0) {
      return report;
    }
    List<String> chunkTexts = splitChunks(chunks);
    for (Map.Entry<String, JsonElement> entry : files.entrySet()) {
      int index = entry.getValue().getAsJsonArray().get(0).getAsInt();
      if (index < 0 || index >= chunkTexts.size()) {
        throw new CorruptInputException(
            name, "file " + entry.getKey() + " points to missing chunk " + index);
      }
      ReportFile file = decodeFile(entry.getKey(), chunkTexts.get(index));
      if (!file.isEmpty()) {
        report.append(file);
      }
    }
    return report;
  }

  private List<String> splitChunks(String chunks) throws CorruptInputException {
    int newline = chunks.indexOf('\n');
    String header = newline < 0 ? chunks : chunks.substring(0, newline);
    if (!header.trim().startsWith("{")) {
      throw new CorruptInputException(name, "chunks do not start with a header");
    }
    String body = newline < 0 ? "" : chunks.substring(newline + 1);
    return Splitter.on(ReportFormat.CHUNK_SEPARATOR).splitToList(body);
  }

  private static Session decodeSession(int id, JsonObject json) {
    Session.Builder session = Session.builder().setId(id);
    JsonArray flags = json.getAsJsonArray(ReportFormat.SESSION_FLAGS);
    if (flags != null) {
      List<String> values = new ArrayList<>();
      flags.forEach(flag -> values.add(flag.getAsString()));
      session.setFlags(values);
    }
    String type = stringOrNull(json, ReportFormat.SESSION_TYPE);
    if (type != null) {
      session.setSessionType(SessionType.fromCode(type));
    }
    session
        .setName(stringOrNull(json, ReportFormat.SESSION_NAME))
        .setProvider(stringOrNull(json, ReportFormat.SESSION_PROVIDER))
        .setBuildCode(stringOrNull(json, ReportFormat.SESSION_BUILD))
        .setJob(stringOrNull(json, ReportFormat.SESSION_JOB))
        .setBuildUrl(stringOrNull(json, ReportFormat.SESSION_BUILD_URL));
    JsonObject env = json.getAsJsonObject(ReportFormat.SESSION_ENV);
    if (env != null) {
      Map<String, String> values = new TreeMap<>();
      for (Map.Entry<String, JsonElement> entry : env.entrySet()) {
        values.put(entry.getKey(), entry.getValue().getAsString());
      }
      session.setEnv(values);
    }
    JsonObject totals = json.getAsJsonObject(ReportFormat.SESSION_TOTALS);
    if (totals != null) {
      session.setTotals(ReportFormat.decodeTotals(totals));
    }
    return session.build();
  }

  @Nullable
  private static String stringOrNull(JsonObject json, String key) {
    JsonElement element = json.get(key);
    return element == null || element.isJsonNull() ? null : element.getAsString();
  }

  private static ReportFile decodeFile(String path, String chunk) {
    ReportFile file = new ReportFile(path);
    int lineNumber = 0;
    for (String text : LINE_SPLITTER.split(chunk)) {
      lineNumber++;
      if (text.trim().isEmpty()) {
        continue;
      }
      file.append(lineNumber, decodeLine(JsonParser.parseString(text).getAsJsonArray()));
    }
    return file;
  }

  static ReportLine decodeLine(JsonArray json) {
    CoverageType type = decodeType(element(json, 1));
    List<LineSession> sessions = new ArrayList<>();
    for (JsonElement session : json.get(2).getAsJsonArray()) {
      sessions.add(decodeLineSession(session.getAsJsonArray()));
    }
    List<CoverageDatapoint> datapoints = null;
    JsonElement encodedDatapoints = element(json, 5);
    if (encodedDatapoints != null) {
      datapoints = new ArrayList<>();
      for (JsonElement encoded : encodedDatapoints.getAsJsonArray()) {
        JsonArray datapoint = encoded.getAsJsonArray();
        List<Integer> labelIds = new ArrayList<>();
        datapoint.get(3).getAsJsonArray().forEach(id -> labelIds.add(id.getAsInt()));
        datapoints.add(
            CoverageDatapoint.create(
                datapoint.get(0).getAsInt(),
                ReportFormat.decodeValue(datapoint.get(1)),
                decodeType(element(datapoint, 2)),
                labelIds));
      }
    }
    return ReportLine.create(type, sessions, datapoints);
  }

  private static LineSession decodeLineSession(JsonArray json) {
    List<String> missing = null;
    JsonElement encodedMissing = element(json, 2);
    if (encodedMissing != null) {
      missing = new ArrayList<>();
      for (JsonElement branch : encodedMissing.getAsJsonArray()) {
        missing.add(branch.getAsString());
      }
    }
    List<PartialSpan> partials = null;
    JsonElement encodedPartials = element(json, 3);
    if (encodedPartials != null) {
      partials = new ArrayList<>();
      for (JsonElement encoded : encodedPartials.getAsJsonArray()) {
        JsonArray span = encoded.getAsJsonArray();
        partials.add(
            PartialSpan.create(
                intOrNull(element(span, 0)),
                intOrNull(element(span, 1)),
                ReportFormat.decodeValue(span.get(2))));
      }
    }
    JsonElement complexity = element(json, 4);
    return LineSession.create(
        json.get(0).getAsInt(),
        ReportFormat.decodeValue(json.get(1)),
        missing == null ? null : ImmutableList.copyOf(missing),
        partials,
        intOrNull(complexity));
  }

  /** The element at {@code index}, or null if the array is shorter or holds a JSON null there. */
  @Nullable
  private static JsonElement element(JsonArray json, int index) {
    if (index >= json.size() || json.get(index).isJsonNull()) {
      return null;
    }
    return json.get(index);
  }

  @Nullable
  private static Integer intOrNull(@Nullable JsonElement element) {
    return element == null ? null : element.getAsInt();
  }

  @Nullable
  private static CoverageType decodeType(@Nullable JsonElement element) {
    return element == null ? null : CoverageType.fromCode(element.getAsString());
  }
}
