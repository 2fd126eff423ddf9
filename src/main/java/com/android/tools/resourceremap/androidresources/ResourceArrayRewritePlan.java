// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

/** The new content of one {@link RClassArrayGroup}, as decided by a remap strategy. */
public class ResourceArrayRewritePlan {

  private final RClassArrayGroup group;
  private final IntList newElements;
  private final int newSize;
  private final int remappedCount;
  private final int deletedCount;
  private final IntSortedSet duplicateElements;

  ResourceArrayRewritePlan(
      RClassArrayGroup group,
      IntList newElements,
      int newSize,
      int remappedCount,
      int deletedCount,
      IntSortedSet duplicateElements) {
    assert newSize == newElements.size();
    this.group = group;
    this.newElements = IntLists.unmodifiable(newElements);
    this.newSize = newSize;
    this.remappedCount = remappedCount;
    this.deletedCount = deletedCount;
    this.duplicateElements = IntSortedSets.unmodifiable(duplicateElements);
  }

  public RClassArrayGroup getGroup() {
    return group;
  }

  public IntList getNewElements() {
    return newElements;
  }

  public int getNewSize() {
    return newSize;
  }

  /** Number of ids present in the mapping, whether or not their value changed. */
  public int getKeptCount() {
    return group.size() - deletedCount;
  }

  /** Number of kept ids whose value changed. */
  public int getRemappedCount() {
    return remappedCount;
  }

  /** Number of ids absent from the mapping, dropped or zeroed depending on the strategy. */
  public int getDeletedCount() {
    return deletedCount;
  }

  public boolean hasDuplicateElements() {
    return !duplicateElements.isEmpty();
  }

  /** New ids occurring more than once in the new content. */
  public IntSortedSet getDuplicateElements() {
    return duplicateElements;
  }

  public boolean isSizeChanged() {
    return newSize != group.getDeclaredSize();
  }

  public boolean isContentChanged() {
    return !newElements.equals(group.getElements());
  }

  @Override
  public String toString() {
    return "ResourceArrayRewritePlan("
        + group
        + " -> size "
        + newSize
        + ", kept "
        + getKeptCount()
        + ", deleted "
        + deletedCount
        + ")";
  }
}
