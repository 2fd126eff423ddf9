// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class DexReturnVoid extends DexInstruction {

  @Override
  public String getName() {
    return "return-void";
  }

  @Override
  public int getSize() {
    return 1;
  }

  @Override
  public boolean isReturn() {
    return true;
  }

  @Override
  protected String operandsToString() {
    return "";
  }
}
