// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Remaps the arrays of the umbrella R class: deleted ids are dropped and the array shrinks.
 *
 * <p>The relative order of the remaining ids is preserved. Two old ids mapped to the same new id
 * both remain in the array; the plan records the duplicated new ids.
 */
public class SequentialResourceArrayRemapStrategy implements ResourceArrayRemapStrategy {

  private static final SequentialResourceArrayRemapStrategy INSTANCE =
      new SequentialResourceArrayRemapStrategy();

  private SequentialResourceArrayRemapStrategy() {}

  public static SequentialResourceArrayRemapStrategy getInstance() {
    return INSTANCE;
  }

  @Override
  public ResourceArrayRewritePlan plan(RClassArrayGroup group, ResourceIdMapping mapping) {
    IntList newElements = new IntArrayList(group.size());
    IntSet seen = new IntOpenHashSet();
    IntSortedSet duplicates = new IntRBTreeSet();
    int remapped = 0;
    for (int slot = 0; slot < group.size(); slot++) {
      int oldId = group.getElement(slot);
      if (!mapping.contains(oldId)) {
        continue;
      }
      int newId = mapping.lookup(oldId);
      if (newId != oldId) {
        remapped++;
      }
      if (!seen.add(newId)) {
        duplicates.add(newId);
      }
      newElements.add(newId);
    }
    int deleted = group.size() - newElements.size();
    return new ResourceArrayRewritePlan(
        group, newElements, newElements.size(), remapped, deleted, duplicates);
  }

  @Override
  public String toString() {
    return "Sequential";
  }
}
