// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexConst16 extends DexConstNumber {

  private final int BBBB;

  public DexConst16(int dest, int constant) {
    super(dest);
    assert Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE;
    this.BBBB = constant;
  }

  @Override
  public String getName() {
    return "const/16";
  }

  @Override
  public int getSize() {
    return 2;
  }

  @Override
  public int getLiteral() {
    return BBBB;
  }
}
