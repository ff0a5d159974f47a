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

import com.google.common.collect.ImmutableSortedSet;
import io.covassembly.config.CarryforwardMode;
import io.covassembly.config.CarryforwardRules;
import io.covassembly.report.Report;
import io.covassembly.report.Session;
import io.covassembly.report.SessionType;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes carried-forward data that a new upload replaces.
 *
 * <p>A carried-forward session sharing a flag with the new upload is deleted when that flag
 * carries forward in {@link CarryforwardMode#ALL} mode. In {@link CarryforwardMode#LABELS} mode
 * only the datapoints of labels the new upload ran again are removed; a session left without any
 * label is then deleted as well.
 */
final class CarryforwardAdjuster {

  private static final Logger logger = Logger.getLogger(CarryforwardAdjuster.class.getName());

  private final CarryforwardRules rules;

  CarryforwardAdjuster(CarryforwardRules rules) {
    this.rules = rules;
  }

  /**
   * Adjusts {@code report} for the arrival of {@code newSession}.
   *
   * @param newLabelIds labels contributed by the new upload, in {@code report}'s label index and
   *     without the placeholder
   */
  SessionAdjustmentResult adjust(Report report, Session newSession, Set<Integer> newLabelIds) {
    ImmutableSortedSet<String> replaceAll =
        rules.carriedForwardIn(newSession.flags(), CarryforwardMode.ALL);
    ImmutableSortedSet<String> replaceLabels =
        rules.carriedForwardIn(newSession.flags(), CarryforwardMode.LABELS);
    if (replaceAll.isEmpty() && replaceLabels.isEmpty()) {
      return SessionAdjustmentResult.none();
    }

    Set<Integer> fullyDeleted = new TreeSet<>();
    Set<Integer> partiallyDeleted = new TreeSet<>();
    for (Map.Entry<Integer, Session> entry : report.sessions().entrySet()) {
      Session session = entry.getValue();
      if (session.sessionType() != SessionType.CARRIEDFORWARD
          || session.id() == newSession.id()) {
        continue;
      }
      if (session.hasAnyFlag(replaceAll)) {
        fullyDeleted.add(entry.getKey());
      } else if (session.hasAnyFlag(replaceLabels)) {
        partiallyDeleted.add(entry.getKey());
      }
    }

    if (!fullyDeleted.isEmpty()) {
      logger.log(
          Level.INFO,
          "Deleting carried forward sessions " + fullyDeleted + " replaced by session "
              + newSession.id());
      report.deleteSessions(fullyDeleted);
    }

    if (!partiallyDeleted.isEmpty()) {
      logger.log(
          Level.INFO,
          "Deleting labels " + newLabelIds + " from carried forward sessions " + partiallyDeleted);
      report.deleteLabels(partiallyDeleted, newLabelIds);
      Set<Integer> emptied = new TreeSet<>();
      for (int sessionId : partiallyDeleted) {
        if (report.labelIdsForSession(sessionId).isEmpty()) {
          emptied.add(sessionId);
        }
      }
      if (!emptied.isEmpty()) {
        logger.log(Level.INFO, "Sessions " + emptied + " have no labels left, deleting them");
        report.deleteSessions(emptied);
        fullyDeleted.addAll(emptied);
        partiallyDeleted.removeAll(emptied);
      }
    }
    return SessionAdjustmentResult.create(fullyDeleted, partiallyDeleted);
  }
}
