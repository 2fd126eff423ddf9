// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

/** Base class of the const instructions loading a 32-bit literal into a single register. */
public abstract class DexConstNumber extends DexInstruction {

  public final int AA;

  DexConstNumber(int AA) {
    assert 0 <= AA && AA <= Constants.U8BIT_MAX;
    this.AA = AA;
  }

  /**
   * Creates the smallest const instruction able to load {@code literal} into {@code register}, the
   * same way a dex compiler selects the encoding.
   */
  public static DexConstNumber create(int register, int literal) {
    if (register <= Constants.U4BIT_MAX
        && Constants.S4BIT_MIN <= literal
        && literal <= Constants.S4BIT_MAX) {
      return new DexConst4(register, literal);
    }
    if (Short.MIN_VALUE <= literal && literal <= Short.MAX_VALUE) {
      return new DexConst16(register, literal);
    }
    if ((literal & 0xffff) == 0) {
      return new DexConstHigh16(register, literal);
    }
    return new DexConst(register, literal);
  }

  public int getRegister() {
    return AA;
  }

  public abstract int getLiteral();

  @Override
  public boolean writesRegister(int register) {
    return register == AA;
  }

  @Override
  public boolean isConstNumber() {
    return true;
  }

  @Override
  public DexConstNumber asConstNumber() {
    return this;
  }

  @Override
  protected String operandsToString() {
    return formatRegister(AA) + ", 0x" + Integer.toHexString(getLiteral());
  }
}
