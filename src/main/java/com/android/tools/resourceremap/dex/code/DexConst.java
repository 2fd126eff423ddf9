// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexConst extends DexConstNumber {

  private final int BBBBBBBB;

  public DexConst(int dest, int constant) {
    super(dest);
    this.BBBBBBBB = constant;
  }

  @Override
  public String getName() {
    return "const";
  }

  @Override
  public int getSize() {
    return 3;
  }

  @Override
  public int getLiteral() {
    return BBBBBBBB;
  }
}
