// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

import com.android.tools.resourceremap.graph.DexType;

/** {@code new-array vA, vB, type}: allocates an array of type with the length held in vB. */
public class DexNewArray extends DexInstruction {

  public final int A;
  public final int B;
  private final DexType type;

  public DexNewArray(int dest, int size, DexType type) {
    assert type.isArrayType();
    this.A = dest;
    this.B = size;
    this.type = type;
  }

  public int getDestRegister() {
    return A;
  }

  public int getSizeRegister() {
    return B;
  }

  public DexType getType() {
    return type;
  }

  @Override
  public String getName() {
    return "new-array";
  }

  @Override
  public int getSize() {
    return 2;
  }

  @Override
  public boolean readsRegister(int register) {
    return register == B;
  }

  @Override
  public boolean writesRegister(int register) {
    return register == A;
  }

  @Override
  public boolean isNewArray() {
    return true;
  }

  @Override
  public DexNewArray asNewArray() {
    return this;
  }

  @Override
  protected String operandsToString() {
    return formatRegister(A) + ", " + formatRegister(B) + ", " + type.toDescriptorString();
  }
}
