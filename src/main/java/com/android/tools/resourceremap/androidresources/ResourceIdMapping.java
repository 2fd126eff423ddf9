// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMaps;
import it.unimi.dsi.fastutil.ints.IntComparator;
import java.util.function.IntConsumer;

/**
 * Mapping from old resource ids to new resource ids for one optimization run.
 *
 * <p>An id without an entry is deleted. An entry mapping an id to itself keeps the id unchanged.
 * The mapping is ordered by the unsigned value of the old id and cannot be modified once built,
 * so a single instance is safely read by all threads of the remapping.
 */
public class ResourceIdMapping {

  private static final IntComparator UNSIGNED_ORDER = Integer::compareUnsigned;

  private static final ResourceIdMapping EMPTY = new ResourceIdMapping(new Int2IntRBTreeMap());

  private final Int2IntSortedMap oldToNewIds;

  private ResourceIdMapping(Int2IntSortedMap oldToNewIds) {
    this.oldToNewIds = Int2IntSortedMaps.unmodifiable(oldToNewIds);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ResourceIdMapping empty() {
    return EMPTY;
  }

  public static ResourceIdMapping create(Int2IntMap oldToNewIds) {
    Builder builder = builder();
    for (Int2IntMap.Entry entry : oldToNewIds.int2IntEntrySet()) {
      builder.map(entry.getIntKey(), entry.getIntValue());
    }
    return builder.build();
  }

  public boolean contains(int oldId) {
    return oldToNewIds.containsKey(oldId);
  }

  /**
   * Returns the new id of {@code oldId}. Must only be called for ids the mapping {@link
   * #contains}.
   */
  public int lookup(int oldId) {
    assert contains(oldId);
    return oldToNewIds.get(oldId);
  }

  public boolean isIdentity(int oldId) {
    return contains(oldId) && lookup(oldId) == oldId;
  }

  public int size() {
    return oldToNewIds.size();
  }

  public boolean isEmpty() {
    return oldToNewIds.isEmpty();
  }

  public void forEachOldId(IntConsumer consumer) {
    oldToNewIds.keySet().forEach(consumer);
  }

  @Override
  public String toString() {
    return "ResourceIdMapping(" + size() + " entries)";
  }

  public static class Builder {

    private final Int2IntSortedMap oldToNewIds = new Int2IntRBTreeMap(UNSIGNED_ORDER);

    public Builder map(int oldId, int newId) {
      oldToNewIds.put(oldId, newId);
      return this;
    }

    public Builder keep(int id) {
      return map(id, id);
    }

    public ResourceIdMapping build() {
      return new ResourceIdMapping(new Int2IntRBTreeMap(oldToNewIds));
    }
  }
}
