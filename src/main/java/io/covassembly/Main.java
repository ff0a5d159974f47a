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

package io.covassembly;

import static java.nio.charset.StandardCharsets.UTF_8;

import io.covassembly.config.AssemblyContext;
import io.covassembly.decoder.DecoderRegistry;
import io.covassembly.errors.CorruptInputException;
import io.covassembly.errors.EmptyUploadException;
import io.covassembly.report.Report;
import io.covassembly.report.Session;
import io.covassembly.serialization.ReportJsonReader;
import io.covassembly.serialization.ReportJsonWriter;
import io.covassembly.upload.FileError;
import io.covassembly.upload.RawUpload;
import io.covassembly.upload.UploadProcessingResult;
import io.covassembly.upload.UploadProcessor;
import io.covassembly.upload.UploadedFile;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Command line utility that merges one upload of coverage files into a stored report and writes
 * the result.
 */
public class Main {
  private static final Logger logger = Logger.getLogger(Main.class.getName());

  public static void main(String... args) {
    try {
      int exitCode = runWithArgs(args);
      System.exit(exitCode);
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Unhandled exception on report assembly: " + e.getMessage(), e);
      System.exit(1);
    }
  }

  static int runWithArgs(String... args) throws ExecutionException, InterruptedException {
    AssemblyFlags flags;
    AssemblyContext context;
    try {
      flags = AssemblyFlags.parseFlags(args);
      context = flags.toContext();
    } catch (IllegalArgumentException e) {
      logger.log(Level.SEVERE, e.getMessage());
      return 1;
    }

    Report previous;
    RawUpload upload;
    try {
      previous = readPreviousReport(flags);
      upload =
          RawUpload.create(
              readCoverageFiles(flags.coverageFiles()),
              readOptional(flags.tocFile()),
              readOptional(flags.envFile()),
              flags.basePaths());
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Could not read input: " + e.getMessage());
      return 1;
    } catch (CorruptInputException e) {
      logger.log(Level.SEVERE, e.getMessage());
      return 1;
    }

    Session template =
        Session.builder().setFlags(flags.uploadFlags()).setName(flags.sessionName()).build();
    UploadProcessingResult result;
    try {
      result =
          new UploadProcessor(context, DecoderRegistry.withDefaults())
              .process(previous, upload, template);
    } catch (EmptyUploadException e) {
      logger.log(Level.SEVERE, "Nothing to merge: " + e.getMessage());
      return 1;
    }
    for (FileError error : result.errors()) {
      logger.log(
          Level.WARNING, error.kind() + " input " + error.filename() + ": " + error.message());
    }
    logger.log(Level.FINE, "Assembly counters: " + context.counters());

    Report merged = result.mergeResult().report();
    try {
      writeReport(
          merged, Paths.get(flags.outputReportJson()), Paths.get(flags.outputReportChunks()));
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Could not write report due to: " + e.getMessage());
      return 1;
    }
    logger.log(
        Level.INFO,
        "Merged session "
            + result.mergeResult().session().id()
            + " into a report of "
            + merged.files().size()
            + " files.");
    return 0;
  }

  private static Report readPreviousReport(AssemblyFlags flags)
      throws IOException, CorruptInputException {
    if (!flags.hasPreviousReport()) {
      return new Report();
    }
    Path summary = Paths.get(flags.previousReportJson());
    return ReportJsonReader.read(
        summary.toString(),
        Files.readString(summary, UTF_8),
        Files.readString(Paths.get(flags.previousReportChunks()), UTF_8));
  }

  private static List<UploadedFile> readCoverageFiles(List<String> paths) throws IOException {
    List<UploadedFile> files = new ArrayList<>();
    for (String path : paths) {
      files.add(UploadedFile.create(path, Files.readString(Paths.get(path), UTF_8)));
    }
    return files;
  }

  @Nullable
  private static String readOptional(@Nullable String path) throws IOException {
    return path == null ? null : Files.readString(Paths.get(path), UTF_8);
  }

  private static void writeReport(Report report, Path summary, Path chunks) throws IOException {
    try (OutputStream summaryOut = Files.newOutputStream(summary);
        OutputStream chunksOut = Files.newOutputStream(chunks)) {
      ReportJsonWriter.write(report, summaryOut, chunksOut);
    }
  }
}
