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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import javax.annotation.Nullable;

/**
 * Bidirectional mapping between small integers and test labels, shared by every datapoint of a
 * report.
 *
 * <p>Index {@link SpecialLabels#PLACEHOLDER_ID} always holds {@link
 * SpecialLabels#ALL_LABELS_PLACEHOLDER}. Other ids are stable for the lifetime of the index; a
 * label not seen before gets an id one greater than the largest id in use.
 */
public final class LabelsIndex {

  private final BiMap<Integer, String> labels;

  private LabelsIndex(BiMap<Integer, String> labels) {
    this.labels = labels;
  }

  /** Creates an index holding only the placeholder. */
  public static LabelsIndex create() {
    BiMap<Integer, String> labels = HashBiMap.create();
    labels.put(SpecialLabels.PLACEHOLDER_ID, SpecialLabels.ALL_LABELS_PLACEHOLDER);
    return new LabelsIndex(labels);
  }

  /**
   * Restores a persisted index. The placeholder is added at index 0 if missing.
   *
   * @throws IllegalArgumentException if ids are negative, a label appears twice, or index 0 holds
   *     anything but the placeholder
   */
  public static LabelsIndex fromMap(Map<Integer, String> persisted) {
    LabelsIndex index = create();
    for (Entry<Integer, String> entry : persisted.entrySet()) {
      int id = entry.getKey();
      String label = entry.getValue();
      checkArgument(id >= 0, "Label ids are non-negative: %s", id);
      if (id == SpecialLabels.PLACEHOLDER_ID
          || label.equals(SpecialLabels.ALL_LABELS_PLACEHOLDER)) {
        checkArgument(
            id == SpecialLabels.PLACEHOLDER_ID
                && label.equals(SpecialLabels.ALL_LABELS_PLACEHOLDER),
            "Index %s is reserved for the placeholder label, found %s",
            SpecialLabels.PLACEHOLDER_ID,
            label);
        continue;
      }
      checkArgument(!index.labels.containsValue(label), "Label %s appears twice", label);
      index.labels.put(id, label);
    }
    return index;
  }

  public LabelsIndex copy() {
    return new LabelsIndex(HashBiMap.create(labels));
  }

  /** Returns the id of {@code label}, allocating a fresh one if the label is new. */
  public int idFor(String label) {
    Integer existing = labels.inverse().get(label);
    if (existing != null) {
      return existing;
    }
    int id = Collections.max(labels.keySet()) + 1;
    labels.put(id, label);
    return id;
  }

  @Nullable
  public Integer lookup(String label) {
    return labels.inverse().get(label);
  }

  @Nullable
  public String labelOf(int id) {
    return labels.get(id);
  }

  public boolean containsId(int id) {
    return labels.containsKey(id);
  }

  public int size() {
    return labels.size();
  }

  /** Whether no label besides the placeholder was ever added. */
  public boolean hasOnlyPlaceholder() {
    return labels.size() == 1;
  }

  public ImmutableSortedMap<Integer, String> asMap() {
    return ImmutableSortedMap.copyOf(labels);
  }

  /**
   * Adds the labels of {@code other} to this index and returns how to rewrite label ids of {@code
   * other} so they point into this index. Only ids that change appear in the result. Labels new to
   * this index are added in lexicographic order, so the ids they get do not depend on the order in
   * which labels were first seen by {@code other}.
   */
  public ImmutableMap<Integer, Integer> absorb(LabelsIndex other) {
    List<Entry<Integer, String>> unseen = new ArrayList<>();
    ImmutableMap.Builder<Integer, Integer> remapping = ImmutableMap.builder();
    for (Entry<Integer, String> entry : other.asMap().entrySet()) {
      Integer existing = labels.inverse().get(entry.getValue());
      if (existing == null) {
        unseen.add(entry);
      } else if (!existing.equals(entry.getKey())) {
        remapping.put(entry.getKey(), existing);
      }
    }
    unseen.sort(Entry.comparingByValue());
    for (Entry<Integer, String> entry : unseen) {
      int id = idFor(entry.getValue());
      if (id != entry.getKey()) {
        remapping.put(entry.getKey(), id);
      }
    }
    return remapping.build();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof LabelsIndex && ((LabelsIndex) o).labels.equals(labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return asMap().toString();
  }
}
