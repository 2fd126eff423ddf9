// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexConstString extends DexInstruction {

  public final int AA;
  private final String string;

  public DexConstString(int register, String string) {
    this.AA = register;
    this.string = string;
  }

  public String getString() {
    return string;
  }

  @Override
  public String getName() {
    return "const-string";
  }

  @Override
  public int getSize() {
    return 2;
  }

  @Override
  public boolean writesRegister(int register) {
    return register == AA;
  }

  @Override
  protected String operandsToString() {
    return formatRegister(AA) + ", \"" + string + "\"";
  }
}
