// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

import java.util.Arrays;

/**
 * The dex code of a method: a register frame size and the instructions in code order.
 *
 * <p>The instruction array is owned by the method. Rewriters build a complete replacement array
 * and install it with {@link #setInstructions}, so that a rewrite is either fully visible or not
 * at all.
 */
public class DexCode {

  public final int registerSize;
  private DexInstruction[] instructions;

  public DexCode(int registerSize, DexInstruction[] instructions) {
    this.registerSize = registerSize;
    this.instructions = instructions;
  }

  public DexInstruction[] getInstructions() {
    return instructions;
  }

  public DexInstruction getInstruction(int index) {
    return instructions[index];
  }

  public int getInstructionCount() {
    return instructions.length;
  }

  public void setInstructions(DexInstruction[] instructions) {
    this.instructions = instructions;
  }

  public int codeSizeInCodeUnits() {
    int size = 0;
    for (DexInstruction instruction : instructions) {
      size += instruction.getSize();
    }
    return size;
  }

  /** Structural equality of the instruction streams, comparing payloads by content. */
  public boolean hasSameInstructions(DexCode other) {
    if (instructions.length != other.instructions.length) {
      return false;
    }
    for (int i = 0; i < instructions.length; i++) {
      DexInstruction instruction = instructions[i];
      DexInstruction otherInstruction = other.instructions[i];
      if (instruction.isFillArrayData() && otherInstruction.isFillArrayData()) {
        if (!instruction.asFillArrayData().hasSamePayload(otherInstruction.asFillArrayData())) {
          return false;
        }
      } else if (!instruction.toString().equals(otherInstruction.toString())) {
        return false;
      }
    }
    return true;
  }

  public DexCode copy() {
    return new DexCode(registerSize, Arrays.copyOf(instructions, instructions.length));
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append("registers: ").append(registerSize).append("\n");
    for (int i = 0; i < instructions.length; i++) {
      builder.append(i).append(": ").append(instructions[i]).append("\n");
    }
    return builder.toString();
  }
}
