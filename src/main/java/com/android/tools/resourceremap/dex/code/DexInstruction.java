// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

/**
 * Base class of the dex instructions of a method body.
 *
 * <p>Instructions are immutable. Code is rewritten by replacing instructions in the instruction
 * array of the owning {@link DexCode}.
 */
public abstract class DexInstruction {

  public abstract String getName();

  /** Size of the instruction in 16-bit code units. */
  public abstract int getSize();

  public boolean readsRegister(int register) {
    return false;
  }

  public boolean writesRegister(int register) {
    return false;
  }

  /** True if control may continue at an instruction other than the next one. */
  public boolean isBranch() {
    return false;
  }

  public boolean isReturn() {
    return false;
  }

  public boolean isConstNumber() {
    return false;
  }

  public DexConstNumber asConstNumber() {
    return null;
  }

  public boolean isNewArray() {
    return false;
  }

  public DexNewArray asNewArray() {
    return null;
  }

  public boolean isFillArrayData() {
    return false;
  }

  public DexFillArrayData asFillArrayData() {
    return null;
  }

  public boolean isSgetOrSput() {
    return false;
  }

  public DexSgetOrSput asSgetOrSput() {
    return null;
  }

  public boolean isSput() {
    return false;
  }

  public boolean isSputObject() {
    return false;
  }

  public DexSputObject asSputObject() {
    return null;
  }

  public boolean isAputObject() {
    return false;
  }

  public DexAputObject asAputObject() {
    return null;
  }

  /** True for stores that put a register value into a static field or an array slot. */
  public boolean isStaticOrArrayStoreOf(int register) {
    return false;
  }

  static String formatRegister(int register) {
    return "v" + register;
  }

  protected abstract String operandsToString();

  @Override
  public String toString() {
    String operands = operandsToString();
    return operands.isEmpty() ? getName() : getName() + " " + operands;
  }
}
