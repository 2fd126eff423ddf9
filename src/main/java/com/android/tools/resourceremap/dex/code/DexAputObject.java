// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

/** {@code aput-object vAA, vBB, vCC}: stores vAA into the array vBB at index vCC. */
public class DexAputObject extends DexInstruction {

  public final int AA;
  public final int BB;
  public final int CC;

  public DexAputObject(int value, int array, int index) {
    this.AA = value;
    this.BB = array;
    this.CC = index;
  }

  @Override
  public String getName() {
    return "aput-object";
  }

  @Override
  public int getSize() {
    return 2;
  }

  @Override
  public boolean readsRegister(int register) {
    return register == AA || register == BB || register == CC;
  }

  @Override
  public boolean isAputObject() {
    return true;
  }

  @Override
  public DexAputObject asAputObject() {
    return this;
  }

  @Override
  public boolean isStaticOrArrayStoreOf(int register) {
    // Only storing the value counts, using the register as the target array does not.
    return register == AA && register != BB && register != CC;
  }

  @Override
  protected String operandsToString() {
    return formatRegister(AA) + ", " + formatRegister(BB) + ", " + formatRegister(CC);
  }
}
