// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

/**
 * Remaps the arrays of {@code R$styleable}: every slot keeps its offset and deleted ids become 0.
 *
 * <p>Attribute lookups address these arrays through generated index constants, hence neither the
 * length of the array nor the position of any id may change.
 */
public class PositionalResourceArrayRemapStrategy implements ResourceArrayRemapStrategy {

  public static final int DELETED_ID = 0;

  private static final PositionalResourceArrayRemapStrategy INSTANCE =
      new PositionalResourceArrayRemapStrategy();

  private PositionalResourceArrayRemapStrategy() {}

  public static PositionalResourceArrayRemapStrategy getInstance() {
    return INSTANCE;
  }

  @Override
  public ResourceArrayRewritePlan plan(RClassArrayGroup group, ResourceIdMapping mapping) {
    IntList newElements = new IntArrayList(group.size());
    int remapped = 0;
    int deleted = 0;
    for (int slot = 0; slot < group.size(); slot++) {
      int oldId = group.getElement(slot);
      if (mapping.contains(oldId)) {
        int newId = mapping.lookup(oldId);
        if (newId != oldId) {
          remapped++;
        }
        newElements.add(newId);
      } else {
        deleted++;
        newElements.add(DELETED_ID);
      }
    }
    assert newElements.size() == group.size();
    return new ResourceArrayRewritePlan(
        group, newElements, group.getDeclaredSize(), remapped, deleted, IntSortedSets.EMPTY_SET);
  }

  @Override
  public String toString() {
    return "Positional";
  }
}
