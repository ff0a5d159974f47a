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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.covassembly.report.CoverageDatapoint;
import io.covassembly.report.CoverageType;
import io.covassembly.report.LineSession;
import io.covassembly.report.PartialSpan;
import io.covassembly.report.Report;
import io.covassembly.report.ReportFile;
import io.covassembly.report.ReportLine;
import io.covassembly.report.Session;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Writes a {@link Report} as a summary JSON document and a chunks document. */
public final class ReportJsonWriter {

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private ReportJsonWriter() {}

  /** Writes both documents and closes the streams. */
  public static void write(Report report, OutputStream summary, OutputStream chunks)
      throws IOException {
    try (Writer summaryWriter = new BufferedWriter(new OutputStreamWriter(summary, UTF_8));
        Writer chunksWriter = new BufferedWriter(new OutputStreamWriter(chunks, UTF_8))) {
      summaryWriter.write(summaryJson(report));
      chunksWriter.write(chunks(report));
    }
  }

  public static String summaryJson(Report report) {
    JsonObject files = new JsonObject();
    int index = 0;
    for (ReportFile file : report.files().values()) {
      JsonArray entry = new JsonArray();
      entry.add(index++);
      entry.add(ReportFormat.encodeTotals(file.totals()));
      files.add(file.name(), entry);
    }

    JsonObject sessions = new JsonObject();
    for (Map.Entry<Integer, Session> entry : report.sessions().entrySet()) {
      sessions.add(Integer.toString(entry.getKey()), encodeSession(entry.getValue()));
    }

    JsonObject summary = new JsonObject();
    summary.add(ReportFormat.FILES, files);
    summary.add(ReportFormat.SESSIONS, sessions);
    if (report.labelsIndex() != null) {
      JsonObject labels = new JsonObject();
      for (Map.Entry<Integer, String> entry : report.labelsIndex().asMap().entrySet()) {
        labels.addProperty(Integer.toString(entry.getKey()), entry.getValue());
      }
      summary.add(ReportFormat.LABELS_INDEX, labels);
    }
    summary.addProperty(ReportFormat.NEXT_SESSION_ID, report.nextSessionId());
    summary.add(ReportFormat.TOTALS, ReportFormat.encodeTotals(report.totals()));
    return GSON.toJson(summary);
  }

  private static JsonObject encodeSession(Session session) {
    JsonObject json = new JsonObject();
    JsonArray flags = new JsonArray();
    session.flags().forEach(flags::add);
    json.add(ReportFormat.SESSION_FLAGS, flags);
    json.addProperty(ReportFormat.SESSION_TYPE, session.sessionType().code());
    addIfPresent(json, ReportFormat.SESSION_NAME, session.name());
    addIfPresent(json, ReportFormat.SESSION_PROVIDER, session.provider());
    addIfPresent(json, ReportFormat.SESSION_BUILD, session.buildCode());
    addIfPresent(json, ReportFormat.SESSION_JOB, session.job());
    addIfPresent(json, ReportFormat.SESSION_BUILD_URL, session.buildUrl());
    if (!session.env().isEmpty()) {
      JsonObject env = new JsonObject();
      session.env().forEach(env::addProperty);
      json.add(ReportFormat.SESSION_ENV, env);
    }
    if (session.totals() != null) {
      json.add(ReportFormat.SESSION_TOTALS, ReportFormat.encodeTotals(session.totals()));
    }
    return json;
  }

  private static void addIfPresent(JsonObject json, String key, @Nullable String value) {
    if (value != null) {
      json.addProperty(key, value);
    }
  }

  public static String chunks(Report report) {
    StringBuilder out = new StringBuilder(ReportFormat.HEADER).append('\n');
    boolean first = true;
    for (ReportFile file : report.files().values()) {
      if (!first) {
        out.append(ReportFormat.CHUNK_SEPARATOR);
      }
      first = false;
      appendChunk(out, file);
    }
    return out.toString();
  }

  private static void appendChunk(StringBuilder out, ReportFile file) {
    int lineNumber = 1;
    for (Map.Entry<Integer, ReportLine> entry : file.lines().entrySet()) {
      for (; lineNumber < entry.getKey(); lineNumber++) {
        out.append('\n');
      }
      out.append(GSON.toJson(encodeLine(entry.getValue())));
    }
  }

  static JsonArray encodeLine(ReportLine line) {
    JsonArray json = new JsonArray();
    json.add(ReportFormat.encodeValue(line.coverage()));
    json.add(encodeType(line.type()));
    JsonArray sessions = new JsonArray();
    for (LineSession session : line.sessions()) {
      sessions.add(encodeLineSession(session));
    }
    json.add(sessions);
    if (line.complexity() != null || line.datapoints() != null) {
      json.add(JsonNull.INSTANCE);
      json.add(nullable(line.complexity()));
    }
    if (line.datapoints() != null) {
      JsonArray datapoints = new JsonArray();
      for (CoverageDatapoint datapoint : line.datapoints()) {
        JsonArray encoded = new JsonArray();
        encoded.add(datapoint.sessionId());
        encoded.add(ReportFormat.encodeValue(datapoint.coverage()));
        encoded.add(encodeType(datapoint.coverageType()));
        JsonArray labels = new JsonArray();
        datapoint.labelIds().forEach(labels::add);
        encoded.add(labels);
        datapoints.add(encoded);
      }
      json.add(datapoints);
    }
    return json;
  }

  private static JsonArray encodeLineSession(LineSession session) {
    JsonArray json = new JsonArray();
    json.add(session.sessionId());
    json.add(ReportFormat.encodeValue(session.coverage()));
    json.add(
        session.missingBranches() == null ? JsonNull.INSTANCE : strings(session.missingBranches()));
    json.add(session.partials() == null ? JsonNull.INSTANCE : partials(session.partials()));
    json.add(nullable(session.complexity()));
    trimTrailingNulls(json);
    return json;
  }

  private static JsonElement encodeType(@Nullable CoverageType type) {
    return type == null || type.code() == null ? JsonNull.INSTANCE : new JsonPrimitive(type.code());
  }

  private static JsonElement nullable(@Nullable Integer value) {
    return value == null ? JsonNull.INSTANCE : new JsonPrimitive(value);
  }

  private static JsonArray strings(List<String> values) {
    JsonArray json = new JsonArray();
    values.forEach(json::add);
    return json;
  }

  private static JsonArray partials(List<PartialSpan> spans) {
    JsonArray json = new JsonArray();
    for (PartialSpan span : spans) {
      JsonArray encoded = new JsonArray();
      encoded.add(nullable(span.start()));
      encoded.add(nullable(span.end()));
      encoded.add(ReportFormat.encodeValue(span.value()));
      json.add(encoded);
    }
    return json;
  }

  private static void trimTrailingNulls(JsonArray json) {
    while (json.size() > 0 && json.get(json.size() - 1).isJsonNull()) {
      json.remove(json.size() - 1);
    }
  }
}
