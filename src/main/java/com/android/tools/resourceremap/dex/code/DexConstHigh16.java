// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

/** Loads a literal whose low 16 bits are zero, such as a resource type base {@code 0x7f010000}. */
public class DexConstHigh16 extends DexConstNumber {

  private final int BBBB;

  public DexConstHigh16(int dest, int constant) {
    super(dest);
    assert (constant & 0xffff) == 0;
    this.BBBB = constant >>> 16;
  }

  @Override
  public String getName() {
    return "const/high16";
  }

  @Override
  public int getSize() {
    return 2;
  }

  @Override
  public int getLiteral() {
    return BBBB << 16;
  }
}
