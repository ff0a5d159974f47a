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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableMap;
import io.covassembly.config.CarryforwardRules;
import io.covassembly.errors.EmptyUploadException;
import io.covassembly.report.LabelsIndex;
import io.covassembly.report.Report;
import io.covassembly.report.Session;
import io.covassembly.report.SessionType;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Merges the per-file reports of one upload into a commit report.
 *
 * <p>Usage is {@link #start}, any number of {@link #appendFile} calls, then {@link
 * #finalizeUpload}. The report passed to {@code start} is never modified: the merged report is a
 * copy, so a failed upload leaves it as it was. Callers must hold the commit's lock for the whole
 * sequence.
 */
public final class UploadMergeEngine {

  private static final Logger logger = Logger.getLogger(UploadMergeEngine.class.getName());

  private final Report previous;
  private final CarryforwardRules rules;
  private final int sessionId;
  private final Report transaction = new Report();
  @Nullable private LabelsIndex transactionLabels;
  private boolean finalized;

  private UploadMergeEngine(Report previous, CarryforwardRules rules) {
    this.previous = previous;
    this.rules = rules;
    this.sessionId = previous.nextSessionId();
    this.transactionLabels = rules.usesLabels() ? LabelsIndex.create() : null;
  }

  /** Starts merging an upload into {@code previous}, reserving the upload's session id. */
  public static UploadMergeEngine start(Report previous, CarryforwardRules rules) {
    return new UploadMergeEngine(previous, rules);
  }

  /** The id the upload's session will get. */
  public int sessionId() {
    return sessionId;
  }

  /**
   * Adds the report built from one uploaded file. Its label ids are translated to the upload's
   * label index first.
   */
  public void appendFile(Report fileReport) {
    checkState(!finalized, "Upload %s was already finalized", sessionId);
    Report file = fileReport;
    LabelsIndex fileLabels = fileReport.labelsIndex();
    if (fileLabels != null) {
      if (transactionLabels == null) {
        transactionLabels = LabelsIndex.create();
      }
      ImmutableMap<Integer, Integer> remapping = transactionLabels.absorb(fileLabels);
      if (!remapping.isEmpty()) {
        file = fileReport.copy();
        file.remapLabels(remapping);
      }
    }
    transaction.merge(file);
  }

  /** Whether nothing was appended yet, or only files without lines. */
  public boolean isEmpty() {
    return transaction.isEmpty();
  }

  /**
   * Creates the upload's session from {@code template} and merges the upload into a copy of the
   * previous report, deleting the carried-forward data it replaces.
   *
   * @throws EmptyUploadException if no file contributed a line; nothing is merged then
   */
  public MergeResult finalizeUpload(Session template) throws EmptyUploadException {
    checkState(!finalized, "Upload %s was already finalized", sessionId);
    if (transaction.isEmpty()) {
      throw new EmptyUploadException("No coverage found in upload for session " + sessionId);
    }
    finalized = true;
    if (transactionLabels != null && transactionLabels.hasOnlyPlaceholder()) {
      transactionLabels = null;
    }

    Report merged = previous.copy();
    Session session =
        merged.putSession(
            template.toBuilder()
                .setId(sessionId)
                .setSessionType(SessionType.UPLOADED)
                .setTotals(transaction.totals().withSessions(1))
                .build());

    if (transactionLabels != null) {
      LabelsIndex target =
          merged.labelsIndex() == null ? LabelsIndex.create() : merged.labelsIndex();
      transaction.remapLabels(target.absorb(transactionLabels));
      merged.setLabelsIndex(target);
      for (int labelId : transaction.allLabelIds()) {
        Verify.verify(target.containsId(labelId), "Label id %s is missing from the index", labelId);
      }
    }
    Set<Integer> newLabels = transaction.allLabelIds();

    SessionAdjustmentResult adjustment =
        new CarryforwardAdjuster(rules).adjust(merged, session, newLabels);
    merged.merge(transaction);
    logger.log(
        Level.FINE,
        String.format(
            "Merged session %d: %d files, carried forward sessions deleted %s, partially %s",
            sessionId,
            transaction.files().size(),
            adjustment.fullyDeletedSessionIds(),
            adjustment.partiallyDeletedSessionIds()));
    return MergeResult.create(merged, session, adjustment);
  }
}
