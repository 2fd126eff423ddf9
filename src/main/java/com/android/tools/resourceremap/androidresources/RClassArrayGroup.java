// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import com.android.tools.resourceremap.dex.code.DexConstNumber;
import com.android.tools.resourceremap.dex.code.DexFillArrayData;
import com.android.tools.resourceremap.dex.code.DexNewArray;
import com.android.tools.resourceremap.dex.code.DexSputObject;
import com.android.tools.resourceremap.graph.DexField;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * One int[] declaration of an R class initializer, reconstructed from the instruction pattern:
 *
 * <pre>
 *   const vSize, N
 *   new-array vArray, vSize, [I
 *   fill-array-data vArray, payload
 *   sput-object vArray, R$type.field   (optional)
 * </pre>
 *
 * <p>Element {@code i} of the group is the id at slot {@code i} of the payload. The literal of the
 * size definer equals the number of elements.
 */
public class RClassArrayGroup {

  public static final int NO_STORE = -1;

  private final int sizeDefinerIndex;
  private final DexConstNumber sizeDefiner;
  private final int newArrayIndex;
  private final DexNewArray newArray;
  private final int fillArrayDataIndex;
  private final DexFillArrayData fillArrayData;
  private final int storeIndex;
  private final DexSputObject store;
  private final IntList elements;

  RClassArrayGroup(
      int sizeDefinerIndex,
      DexConstNumber sizeDefiner,
      int newArrayIndex,
      DexNewArray newArray,
      int fillArrayDataIndex,
      DexFillArrayData fillArrayData,
      int storeIndex,
      DexSputObject store,
      IntList elements) {
    assert sizeDefiner.getLiteral() == elements.size();
    assert sizeDefinerIndex < newArrayIndex && newArrayIndex < fillArrayDataIndex;
    assert (store == null) == (storeIndex == NO_STORE);
    this.sizeDefinerIndex = sizeDefinerIndex;
    this.sizeDefiner = sizeDefiner;
    this.newArrayIndex = newArrayIndex;
    this.newArray = newArray;
    this.fillArrayDataIndex = fillArrayDataIndex;
    this.fillArrayData = fillArrayData;
    this.storeIndex = storeIndex;
    this.store = store;
    this.elements = IntLists.unmodifiable(elements);
  }

  public int getSizeDefinerIndex() {
    return sizeDefinerIndex;
  }

  public DexConstNumber getSizeDefiner() {
    return sizeDefiner;
  }

  public int getNewArrayIndex() {
    return newArrayIndex;
  }

  public DexNewArray getNewArray() {
    return newArray;
  }

  public int getFillArrayDataIndex() {
    return fillArrayDataIndex;
  }

  public DexFillArrayData getFillArrayData() {
    return fillArrayData;
  }

  public boolean hasStore() {
    return store != null;
  }

  public int getStoreIndex() {
    return storeIndex;
  }

  /** The field the array is stored into, or null if the array is not stored to a field. */
  public DexField getField() {
    return store != null ? store.getField() : null;
  }

  public int getDeclaredSize() {
    return sizeDefiner.getLiteral();
  }

  public IntList getElements() {
    return elements;
  }

  public int getElement(int slot) {
    return elements.getInt(slot);
  }

  public int size() {
    return elements.size();
  }

  /** Returns the type id shared by all elements, or -1 if the group is empty or mixes types. */
  public int getResourceTypeId() {
    if (elements.isEmpty()) {
      return -1;
    }
    int first = elements.getInt(0);
    for (int i = 1; i < elements.size(); i++) {
      if (!ResourceId.isSameType(first, elements.getInt(i))) {
        return -1;
      }
    }
    return ResourceId.getTypeId(first);
  }

  @Override
  public String toString() {
    return "RClassArrayGroup("
        + (store != null ? store.getField().getName() : "@" + newArrayIndex)
        + ", size "
        + elements.size()
        + ")";
  }
}
