// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexMove extends DexInstruction {

  public final int A;
  public final int B;

  public DexMove(int dest, int src) {
    this.A = dest;
    this.B = src;
  }

  @Override
  public String getName() {
    return "move";
  }

  @Override
  public int getSize() {
    return 1;
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
  protected String operandsToString() {
    return formatRegister(A) + ", " + formatRegister(B);
  }
}
