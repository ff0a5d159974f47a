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

package io.covassembly.upload;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.covassembly.builder.FileBuilder;
import io.covassembly.builder.ReportBuilder;
import io.covassembly.builder.ReportBuilderSession;
import io.covassembly.config.AssemblyContext;
import io.covassembly.decoder.DecodedLine;
import io.covassembly.decoder.DecoderContext;
import io.covassembly.decoder.DecoderRegistry;
import io.covassembly.decoder.LanguageDecoder;
import io.covassembly.errors.CorruptInputException;
import io.covassembly.errors.EmptyUploadException;
import io.covassembly.errors.ReportExpiredException;
import io.covassembly.paths.PathResolver;
import io.covassembly.paths.PathTree;
import io.covassembly.report.Report;
import io.covassembly.report.Session;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Turns a raw upload into a merged report: decodes each uploaded file, resolves its paths, builds
 * its report and merges all of them into the previous report.
 *
 * <p>A file that cannot be decoded is reported in the result and contributes nothing; the other
 * files of the upload are merged regardless.
 */
public final class UploadProcessor {

  private static final Logger logger = Logger.getLogger(UploadProcessor.class.getName());

  // Istanbul writes the same data twice; the json form wins.
  private static final String JS_JSON_REPORT = "coverage/coverage.json";
  private static final String JS_LCOV_REPORT = "coverage/coverage.lcov";

  private final AssemblyContext context;
  private final DecoderRegistry decoders;

  public UploadProcessor(AssemblyContext context, DecoderRegistry decoders) {
    this.context = context;
    this.decoders = decoders;
  }

  /**
   * Merges {@code upload} into a copy of {@code previous}.
   *
   * @param template metadata of the upload's session; its flags select path filters and
   *     carryforward rules
   * @throws EmptyUploadException if no file of the upload contributed coverage
   */
  public UploadProcessingResult process(Report previous, RawUpload upload, Session template)
      throws EmptyUploadException, ExecutionException, InterruptedException {
    UploadMergeEngine engine = UploadMergeEngine.start(previous, context.carryforwardRules());
    PathTree toc = upload.toc() == null ? null : PathTree.fromText(upload.toc());
    PathResolver resolver = PathResolver.forFlags(context, template.flags(), toc);
    ReportBuilder builder = ReportBuilder.create(context, engine.sessionId(), resolver);

    List<FileOutcome> outcomes =
        decodeFiles(builder, filesToProcess(upload.files()), upload.basesToTry());
    List<FileError> errors = new ArrayList<>();
    for (FileOutcome outcome : outcomes) {
      if (outcome.error != null) {
        errors.add(outcome.error);
      } else if (outcome.report != null) {
        engine.appendFile(outcome.report);
      }
    }
    resolver.logAbnormalities();

    Session session = template;
    ImmutableMap<String, String> env = upload.envMap();
    if (!env.isEmpty()) {
      session = template.toBuilder().setEnv(env).build();
    }
    MergeResult result = engine.finalizeUpload(session);
    context.counters().recordMergedUpload();
    return UploadProcessingResult.create(result, errors);
  }

  private static ImmutableList<UploadedFile> filesToProcess(List<UploadedFile> files) {
    Set<String> skipped = new HashSet<>();
    for (UploadedFile file : files) {
      if (file.name().equals(JS_JSON_REPORT)) {
        skipped.add(JS_LCOV_REPORT);
      }
    }
    ImmutableList.Builder<UploadedFile> kept = ImmutableList.builder();
    for (UploadedFile file : files) {
      if (file.content().isEmpty()) {
        continue;
      }
      if (skipped.contains(file.name())) {
        logger.log(Level.FINE, "Skipping " + file.name());
        continue;
      }
      kept.add(file);
    }
    return kept.build();
  }

  private List<FileOutcome> decodeFiles(
      ReportBuilder builder, List<UploadedFile> files, List<String> basesToTry)
      throws ExecutionException, InterruptedException {
    if (context.parseParallelism() == 1 || files.size() <= 1) {
      return files.stream()
          .map(file -> decodeFile(builder, file, basesToTry))
          .collect(toImmutableList());
    }
    ForkJoinPool pool = new ForkJoinPool(context.parseParallelism());
    try {
      return pool.submit(
              () ->
                  files.parallelStream()
                      .map(file -> decodeFile(builder, file, basesToTry))
                      .collect(toImmutableList()))
          .get();
    } finally {
      pool.shutdown();
    }
  }

  private FileOutcome decodeFile(
      ReportBuilder builder, UploadedFile file, List<String> basesToTry) {
    String name = file.name();
    Optional<LanguageDecoder> decoder = decoders.find(file.content(), name);
    if (!decoder.isPresent()) {
      context.counters().recordUnrecognizedFile();
      logger.log(Level.WARNING, "File " + name + " does not have a supported format, skipping");
      return FileOutcome.empty();
    }
    logger.log(Level.FINE, "Decoding " + name + " as " + decoder.get().name());
    try {
      Report report = buildReport(builder, decoder.get(), file, basesToTry);
      context.counters().recordDecodedFile();
      return FileOutcome.decoded(report);
    } catch (CorruptInputException e) {
      context.counters().recordCorruptFile();
      logger.log(Level.WARNING, e.getMessage());
      return FileOutcome.failed(FileError.create(name, FileError.Kind.CORRUPT, e.getMessage()));
    } catch (ReportExpiredException e) {
      context.counters().recordExpiredFile();
      logger.log(Level.WARNING, e.getMessage());
      return FileOutcome.failed(FileError.create(name, FileError.Kind.EXPIRED, e.getMessage()));
    } catch (RuntimeException e) {
      // Decoders and builders reject malformed data with unchecked exceptions; only this file
      // is dropped.
      context.counters().recordCorruptFile();
      logger.log(Level.WARNING, "Could not process " + name + ": " + e.getMessage(), e);
      return FileOutcome.failed(
          FileError.create(name, FileError.Kind.CORRUPT, String.valueOf(e.getMessage())));
    }
  }

  private Report buildReport(
      ReportBuilder builder, LanguageDecoder decoder, UploadedFile file, List<String> basesToTry)
      throws CorruptInputException, ReportExpiredException {
    String name = file.name();
    ImmutableList<DecodedLine> lines =
        decoder.decode(file.content(), name, DecoderContext.from(context));

    ReportBuilderSession session = builder.createSession(name, basesToTry);
    Map<String, Optional<FileBuilder>> fileBuilders = new HashMap<>();
    List<FileBuilder> started = new ArrayList<>();
    for (DecodedLine line : lines) {
      Optional<FileBuilder> fileBuilder =
          fileBuilders.computeIfAbsent(
              line.rawPath(),
              path -> {
                Optional<FileBuilder> created = session.createFile(path);
                created.ifPresent(started::add);
                return created;
              });
      if (fileBuilder.isPresent()) {
        fileBuilder
            .get()
            .append(
                line.lineNumber(),
                line.value(),
                line.type(),
                line.partials(),
                line.missingBranches(),
                line.complexity(),
                line.labelHintGroups());
      }
    }
    for (FileBuilder fileBuilder : started) {
      fileBuilder.finish();
    }
    context.counters().recordRejectedPaths(session.rejectedPaths().size());
    return session.output();
  }

  /** What decoding one uploaded file produced. */
  private static final class FileOutcome {
    @Nullable final Report report;
    @Nullable final FileError error;

    private FileOutcome(@Nullable Report report, @Nullable FileError error) {
      this.report = report;
      this.error = error;
    }

    static FileOutcome decoded(Report report) {
      return new FileOutcome(report, null);
    }

    static FileOutcome failed(FileError error) {
      return new FileOutcome(null, error);
    }

    static FileOutcome empty() {
      return new FileOutcome(null, null);
    }
  }
}
