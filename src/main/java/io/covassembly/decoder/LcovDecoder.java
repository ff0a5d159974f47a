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

package io.covassembly.decoder;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.covassembly.errors.CorruptInputException;
import io.covassembly.report.CoverageType;
import io.covassembly.report.CoverageValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Decoder for the lcov tracefile format written by geninfo. See <a
 * href="http://ltp.sourceforge.net/coverage/lcov/geninfo.1.php">lcov documentation</a>.
 *
 * <p>Line counts come from {@code DA} lines and branch ratios from {@code BRDA} lines; a branch
 * line that starts a function ({@code FN}) is reported as a method. Function hit counts ({@code
 * FNDA}) and the summary lines are not used.
 */
public final class LcovDecoder implements LanguageDecoder {

  private static final Logger logger = Logger.getLogger(LcovDecoder.class.getName());

  static final String SF_MARKER = "SF";
  static final String DA_MARKER = "DA";
  static final String FN_MARKER = "FN";
  static final String FNDA_MARKER = "FNDA";
  static final String BRDA_MARKER = "BRDA";
  static final String END_OF_RECORD_MARKER = "end_of_record";
  static final String NOT_TAKEN = "-";

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");
  private static final Splitter DELIMITER = Splitter.on(',').trimResults();

  @Override
  public String name() {
    return "lcov";
  }

  @Override
  public boolean matches(String content, String firstLine, String filename) {
    return content.contains("\n" + END_OF_RECORD_MARKER);
  }

  @Override
  public ImmutableList<DecodedLine> decode(
      String content, String filename, DecoderContext context) throws CorruptInputException {
    return new Parser(filename).parse(content);
  }

  /** Parsing state of one tracefile. */
  private static final class Parser {
    private final String filename;
    private final ImmutableList.Builder<DecodedLine> output = ImmutableList.builder();

    // State of the current SF section, null outside of one.
    @Nullable private String sourceFile;
    private final Map<Integer, Long> lineHits = new TreeMap<>();
    private final Map<Integer, Map<String, Boolean>> branches = new TreeMap<>();
    private final Set<Integer> functionLines = new HashSet<>();
    private final Set<Integer> skippedLines = new HashSet<>();

    Parser(String filename) {
      this.filename = filename;
    }

    ImmutableList<DecodedLine> parse(String content) throws CorruptInputException {
      for (String line : LINE_SPLITTER.split(content)) {
        parseLine(line.trim());
      }
      flush();
      return output.build();
    }

    private void parseLine(String line) throws CorruptInputException {
      if (line.equals(END_OF_RECORD_MARKER)) {
        flush();
        return;
      }
      int colon = line.indexOf(':');
      if (colon < 0) {
        return;
      }
      String marker = line.substring(0, colon);
      String content = line.substring(colon + 1).trim();
      if (marker.equals(SF_MARKER)) {
        parseSFLine(content);
        return;
      }
      if (sourceFile == null) {
        logger.log(Level.FINE, "Tracefile " + filename + " has data outside of a record: " + line);
        return;
      }
      switch (marker) {
        case DA_MARKER:
          parseDALine(content, line);
          break;
        case FN_MARKER:
          parseFNLine(content, line);
          break;
        case FNDA_MARKER:
          break;
        case BRDA_MARKER:
          parseBRDALine(content, line);
          break;
        default:
          // TN, LF, LH, FNF, FNH, BRF, BRH and unknown markers carry nothing we keep.
          break;
      }
    }

    // SF:<path to source file>
    private void parseSFLine(String content) {
      flush();
      if (content.isEmpty()) {
        logger.log(Level.WARNING, "Tracefile " + filename + " has an SF line without a path");
        return;
      }
      sourceFile = content;
    }

    // DA:<line number>,<execution count>[,<checksum>]
    private void parseDALine(String content, String line) throws CorruptInputException {
      List<String> data = DELIMITER.splitToList(content);
      if (data.size() < 2) {
        throw new CorruptInputException(filename, "DA line without execution count: " + line);
      }
      String lineNumber = data.get(0);
      String hits = data.get(1);
      if (lineNumber.isEmpty()
          || lineNumber.startsWith("0")
          || lineNumber.startsWith("n")
          || lineNumber.equals("undefined")
          || hits.isEmpty()
          || hits.startsWith("=")
          || hits.startsWith("s")
          || hits.equals("undefined")) {
        return;
      }
      int number = parseLineNumber(lineNumber, line);
      long count;
      try {
        count = Long.parseLong(hits);
      } catch (NumberFormatException e) {
        throw new CorruptInputException(filename, "invalid execution count on " + line, e);
      }
      lineHits.merge(number, Math.max(0, count), Math::max);
    }

    // FN:<line number of function start>,<function name>
    private void parseFNLine(String content, String line) throws CorruptInputException {
      List<String> data = Splitter.on(',').limit(2).splitToList(content);
      if (data.size() != 2 || data.get(0).isEmpty()) {
        logger.log(Level.FINE, "Tracefile " + filename + " contains invalid FN line " + line);
        return;
      }
      if (isJavaScript()) {
        return;
      }
      int number = parseLineNumber(data.get(0), line);
      String function = data.get(1);
      if (isCpp() && (function.startsWith("_Z") || function.startsWith("_G"))) {
        skippedLines.add(number);
        return;
      }
      functionLines.add(number);
    }

    // BRDA:<line number>,<block number>,<branch number>,<taken>
    private void parseBRDALine(String content, String line) throws CorruptInputException {
      if (isJavaScript()) {
        return;
      }
      List<String> data = Splitter.on(',').limit(4).trimResults().splitToList(content);
      if (data.size() != 4) {
        throw new CorruptInputException(filename, "BRDA line needs four fields: " + line);
      }
      String lineNumber = data.get(0);
      if (lineNumber.isEmpty() || lineNumber.equals("0")) {
        return;
      }
      if (lineNumber.equals("1") && sourceFile.endsWith(".ts")) {
        return;
      }
      int number = parseLineNumber(lineNumber, line);
      String taken = data.get(3);
      boolean covered = !taken.equals(NOT_TAKEN) && !taken.equals("0");
      branches
          .computeIfAbsent(number, n -> new LinkedHashMap<>())
          .put(data.get(1) + ":" + data.get(2), covered);
    }

    private int parseLineNumber(String lineNumber, String line) throws CorruptInputException {
      try {
        return Integer.parseInt(lineNumber);
      } catch (NumberFormatException e) {
        throw new CorruptInputException(filename, "invalid line number on " + line, e);
      }
    }

    private boolean isJavaScript() {
      return sourceFile.endsWith(".js");
    }

    private boolean isCpp() {
      return sourceFile.endsWith(".cpp");
    }

    /** Emits the lines of the current record and resets the record state. */
    private void flush() {
      if (sourceFile != null) {
        for (Map.Entry<Integer, Long> entry : lineHits.entrySet()) {
          if (entry.getKey() >= 1 && !skippedLines.contains(entry.getKey())) {
            output.add(
                DecodedLine.create(
                    sourceFile, entry.getKey(), CoverageValue.ofHits(entry.getValue())));
          }
        }
        for (Map.Entry<Integer, Map<String, Boolean>> entry : branches.entrySet()) {
          int number = entry.getKey();
          if (number < 1 || skippedLines.contains(number)) {
            continue;
          }
          List<String> missing = new ArrayList<>();
          int covered = 0;
          for (Map.Entry<String, Boolean> branch : entry.getValue().entrySet()) {
            if (branch.getValue()) {
              covered++;
            } else {
              missing.add(branch.getKey());
            }
          }
          output.add(
              DecodedLine.builder(
                      sourceFile,
                      number,
                      CoverageValue.ofBranches(covered, entry.getValue().size()))
                  .setType(
                      functionLines.contains(number) ? CoverageType.METHOD : CoverageType.BRANCH)
                  .setMissingBranches(missing.isEmpty() ? null : ImmutableList.copyOf(missing))
                  .build());
        }
      }
      sourceFile = null;
      lineHits.clear();
      branches.clear();
      functionLines.clear();
      skippedLines.clear();
    }
  }
}
