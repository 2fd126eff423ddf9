// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.stream.Collectors;

public class DexInvokeStatic extends DexInstruction {

  private final String method;
  private final int[] arguments;

  public DexInvokeStatic(String method, int... arguments) {
    this.method = method;
    this.arguments = arguments.clone();
  }

  public String getMethod() {
    return method;
  }

  @Override
  public String getName() {
    return "invoke-static";
  }

  @Override
  public int getSize() {
    return 3;
  }

  @Override
  public boolean readsRegister(int register) {
    return Ints.contains(arguments, register);
  }

  @Override
  protected String operandsToString() {
    return Arrays.stream(arguments)
            .mapToObj(DexInstruction::formatRegister)
            .collect(Collectors.joining(", ", "{", "}"))
        + ", "
        + method;
  }
}
