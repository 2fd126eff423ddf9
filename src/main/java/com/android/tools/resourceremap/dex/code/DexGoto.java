// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexGoto extends DexInstruction {

  private final int offset;

  public DexGoto(int offset) {
    this.offset = offset;
  }

  public int getOffset() {
    return offset;
  }

  @Override
  public String getName() {
    return "goto";
  }

  @Override
  public int getSize() {
    return 1;
  }

  @Override
  public boolean isBranch() {
    return true;
  }

  @Override
  protected String operandsToString() {
    return (offset >= 0 ? "+" : "") + offset;
  }
}
