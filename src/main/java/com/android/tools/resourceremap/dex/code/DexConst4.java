// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexConst4 extends DexConstNumber {

  private final int B;

  public DexConst4(int dest, int constant) {
    super(dest);
    assert dest <= Constants.U4BIT_MAX;
    assert Constants.S4BIT_MIN <= constant && constant <= Constants.S4BIT_MAX;
    this.B = constant;
  }

  @Override
  public String getName() {
    return "const/4";
  }

  @Override
  public int getSize() {
    return 1;
  }

  @Override
  public int getLiteral() {
    return B;
  }
}
