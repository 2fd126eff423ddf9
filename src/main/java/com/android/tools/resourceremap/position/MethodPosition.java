// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.position;

import com.android.tools.resourceremap.graph.DexEncodedMethod;

/** A {@link Position} denoting a method, optionally narrowed to an instruction index. */
public class MethodPosition implements Position {

  public static final int NO_INSTRUCTION = -1;

  private final DexEncodedMethod method;
  private final int instructionIndex;

  public MethodPosition(DexEncodedMethod method) {
    this(method, NO_INSTRUCTION);
  }

  public MethodPosition(DexEncodedMethod method, int instructionIndex) {
    this.method = method;
    this.instructionIndex = instructionIndex;
  }

  public DexEncodedMethod getMethod() {
    return method;
  }

  public int getInstructionIndex() {
    return instructionIndex;
  }

  @Override
  public String getDescription() {
    if (instructionIndex == NO_INSTRUCTION) {
      return method.toSourceString();
    }
    return method.toSourceString() + "@" + instructionIndex;
  }

  @Override
  public String toString() {
    return getDescription();
  }
}
