// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.errors;

/**
 * Signals that the array declarations of an R class initializer could not be reconstructed
 * consistently, e.g., the array size is not defined by a constant or disagrees with the payload.
 *
 * <p>The instruction index refers to the instruction at which the inconsistency was detected.
 */
public class MalformedRClassInitializerException extends CompilationError {

  private final int instructionIndex;

  public MalformedRClassInitializerException(String message, int instructionIndex) {
    super(message);
    this.instructionIndex = instructionIndex;
  }

  public MalformedRClassInitializerException(
      String message, int instructionIndex, Throwable cause) {
    super(message, cause);
    this.instructionIndex = instructionIndex;
  }

  public int getInstructionIndex() {
    return instructionIndex;
  }
}
