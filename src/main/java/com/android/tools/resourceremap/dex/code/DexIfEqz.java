// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexIfEqz extends DexInstruction {

  public final int AA;
  private final int offset;

  public DexIfEqz(int register, int offset) {
    this.AA = register;
    this.offset = offset;
  }

  @Override
  public String getName() {
    return "if-eqz";
  }

  @Override
  public int getSize() {
    return 2;
  }

  @Override
  public boolean readsRegister(int register) {
    return register == AA;
  }

  @Override
  public boolean isBranch() {
    return true;
  }

  @Override
  protected String operandsToString() {
    return formatRegister(AA) + ", " + (offset >= 0 ? "+" : "") + offset;
  }
}
