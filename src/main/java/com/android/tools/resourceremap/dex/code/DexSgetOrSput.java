// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

import com.android.tools.resourceremap.graph.DexField;

public abstract class DexSgetOrSput extends DexInstruction {

  public final int AA;
  private final DexField BBBB;

  DexSgetOrSput(int AA, DexField BBBB) {
    this.AA = AA;
    this.BBBB = BBBB;
  }

  public int getRegister() {
    return AA;
  }

  public final DexField getField() {
    return BBBB;
  }

  @Override
  public int getSize() {
    return 2;
  }

  @Override
  public boolean isSgetOrSput() {
    return true;
  }

  @Override
  public DexSgetOrSput asSgetOrSput() {
    return this;
  }

  @Override
  protected String operandsToString() {
    return formatRegister(AA) + ", " + BBBB;
  }
}
